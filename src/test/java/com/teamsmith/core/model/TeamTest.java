package com.teamsmith.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TeamTest {

    private final Person john = new Person("John", new BigDecimal("1200"), List.of("js", "html"));
    private final Person justin = new Person("Justin", new BigDecimal("1600"), List.of("marketing", "brand"));

    @Test
    @DisplayName("price is the sum of salaries")
    void price() {
        assertEquals(new BigDecimal("2800"), new Team(List.of(john, justin)).price());
        assertEquals(BigDecimal.ZERO, new Team(List.of()).price());
    }

    @Test
    @DisplayName("covers compares the union of relevant skills with the requirement")
    void covers() {
        var team = new Team(List.of(john, justin));
        assertTrue(team.covers(Set.of("js", "brand")));
        assertFalse(team.covers(Set.of("js", "python")));
    }

    @Test
    @DisplayName("member order matters for equality")
    void equality() {
        assertEquals(new Team(List.of(john, justin)), new Team(List.of(john, justin)));
        assertNotEquals(new Team(List.of(john, justin)), new Team(List.of(justin, john)));
        assertEquals(List.of("John", "Justin"), new Team(List.of(john, justin)).memberNames());
    }

    @Test
    @DisplayName("task requirement drops duplicate skills but keeps order")
    void requiredSkills() {
        var task = new Task("One", List.of("js", "html", "js"));
        assertEquals(List.of("js", "html"), List.copyOf(task.requiredSkills()));
    }
}
