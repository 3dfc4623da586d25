package com.teamsmith.core.model;

import java.util.List;

/**
 * The validated contents of an input document: tasks and the roster, both in input order.
 */
public record Staffing(
    List<Task> tasks,
    List<Person> people
) {

    public Staffing {
        tasks = List.copyOf(tasks);
        people = List.copyOf(people);
    }
}
