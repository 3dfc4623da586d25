package com.teamsmith.core.model;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A group of people, ordered by name, that together cover a task.
 * Two teams with equal member lists are the same team.
 */
public record Team(List<Person> members) {

    public Team {
        members = List.copyOf(members);
    }

    public BigDecimal price() {
        return members.stream()
                .map(Person::salary)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public List<String> memberNames() {
        return members.stream().map(Person::name).toList();
    }

    /**
     * Returns {@code true} when the members' skills, intersected with the
     * requirement, equal the requirement.
     */
    public boolean covers(Set<String> required) {
        var covered = new HashSet<String>();
        for (Person member : members) {
            covered.addAll(member.relevantSkills(required));
        }
        return covered.equals(required);
    }
}
