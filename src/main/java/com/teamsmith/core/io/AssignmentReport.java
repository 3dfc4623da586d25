package com.teamsmith.core.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.teamsmith.core.model.TaskAssignment;
import com.teamsmith.core.model.Team;

import java.math.BigDecimal;
import java.util.List;

/**
 * Shape of the output document: each task with its teams as names and price.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AssignmentReport(
    @JsonProperty("Tasks") List<TaskReport> tasks
) {

    @JsonPropertyOrder({"name", "teams"})
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TaskReport(
        String name,
        List<TeamReport> teams
    ) {
    }

    @JsonPropertyOrder({"peoples", "price"})
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TeamReport(
        List<String> peoples,
        BigDecimal price
    ) {
    }

    public static AssignmentReport of(List<TaskAssignment> assignments) {
        return new AssignmentReport(assignments.stream()
                .map(a -> new TaskReport(a.task().name(),
                        a.teams().stream().map(AssignmentReport::toTeamReport).toList()))
                .toList());
    }

    private static TeamReport toTeamReport(Team team) {
        return new TeamReport(team.memberNames(), team.price());
    }
}
