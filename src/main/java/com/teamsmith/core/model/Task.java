package com.teamsmith.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A piece of work and the skills it needs.
 *
 * @param name   task name, echoed in the output document
 * @param skills required skills in input order
 */
public record Task(
    String name,
    List<String> skills
) {

    public Task {
        skills = skills == null ? List.of() : List.copyOf(skills);
    }

    /** Required skills as an insertion-ordered set. */
    public Set<String> requiredSkills() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(skills));
    }

    @Override
    public String toString() {
        return "Task Name: " + name + ", Needed skills " + skills;
    }
}
