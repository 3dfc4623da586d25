package com.teamsmith.core.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamsmith.core.model.Person;
import com.teamsmith.core.model.Staffing;
import com.teamsmith.core.model.Task;
import com.teamsmith.core.model.TaskAssignment;
import com.teamsmith.core.model.Team;
import com.teamsmith.core.teams.TeamBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StaffingDocumentWriterTest {

    @TempDir
    Path tempDir;

    StaffingDocumentWriter writer = new StaffingDocumentWriter();
    ObjectMapper yaml = YamlMappers.create();

    private static Person person(String name, int salary, String... skills) {
        return new Person(name, BigDecimal.valueOf(salary), List.of(skills));
    }

    @Test
    @DisplayName("writes block-style YAML with names and summed price")
    void yamlLayout() {
        var john = person("John", 1200, "js");
        var justin = person("Justin", 1600, "brand");
        var assignment = new TaskAssignment(new Task("Two", List.of("js", "brand")),
                List.of(new Team(List.of(john, justin))));

        String out = writer.toYaml(List.of(assignment));

        assertEquals("""
                Tasks:
                - name: Two
                  teams:
                  - peoples:
                    - John
                    - Justin
                    price: 2800
                """, out);
    }

    @Test
    @DisplayName("task without teams is written with an empty team list")
    void emptyTeams() throws IOException {
        String out = writer.toYaml(List.of(new TaskAssignment(new Task("Four", List.of("Java")), List.of())));
        var report = yaml.readValue(out, AssignmentReport.class);
        assertEquals("Four", report.tasks().get(0).name());
        assertTrue(report.tasks().get(0).teams().isEmpty());
    }

    @Test
    @DisplayName("file round trip keeps names in order and prices match the roster")
    void roundTrip() throws IOException {
        var reader = new StaffingDocumentReader();
        var builder = new TeamBuilder();
        Staffing staffing;
        try (InputStream in = getClass().getResourceAsStream("/task.yaml")) {
            staffing = reader.read(in);
        }
        var assignments = staffing.tasks().stream()
                .map(t -> new TaskAssignment(t, builder.buildTeams(t, staffing.people())))
                .toList();

        Path out = tempDir.resolve("nested/result.yaml");
        writer.write(assignments, out);
        assertTrue(Files.exists(out));

        Map<String, BigDecimal> salaries = staffing.people().stream()
                .collect(Collectors.toMap(Person::name, Person::salary));
        var report = yaml.readValue(out.toFile(), AssignmentReport.class);

        assertEquals(assignments.size(), report.tasks().size());
        for (int i = 0; i < assignments.size(); i++) {
            var expected = assignments.get(i);
            var actual = report.tasks().get(i);
            assertEquals(expected.task().name(), actual.name());
            assertEquals(expected.teams().size(), actual.teams().size());
            for (int j = 0; j < actual.teams().size(); j++) {
                var teamReport = actual.teams().get(j);
                assertEquals(expected.teams().get(j).memberNames(), teamReport.peoples());
                BigDecimal recomputed = teamReport.peoples().stream()
                        .map(salaries::get)
                        .reduce(BigDecimal.ZERO, BigDecimal::add);
                assertEquals(0, recomputed.compareTo(teamReport.price()));
            }
        }
    }

    @Test
    @DisplayName("numeric-looking names stay strings")
    void numericNames() throws IOException {
        var team = new Team(List.of(person("007", 10, "x")));
        String out = writer.toYaml(List.of(new TaskAssignment(new Task("1", List.of("x")), List.of(team))));
        var report = yaml.readValue(out, AssignmentReport.class);
        assertEquals("1", report.tasks().get(0).name());
        assertEquals(List.of("007"), report.tasks().get(0).teams().get(0).peoples());
    }
}
