package com.teamsmith.core.model;

import java.util.List;
import java.util.Optional;

/**
 * A task together with the teams found for it, cheapest first.
 */
public record TaskAssignment(
    Task task,
    List<Team> teams
) {

    public TaskAssignment {
        teams = List.copyOf(teams);
    }

    public Optional<Team> cheapest() {
        return teams.isEmpty() ? Optional.empty() : Optional.of(teams.get(0));
    }
}
