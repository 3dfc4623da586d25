package com.teamsmith.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PersonTest {

    private final Person mark = new Person("Mark", new BigDecimal("1200"), List.of("js", "python"));

    @Test
    @DisplayName("equality covers name, salary and skill order")
    void structuralEquality() {
        assertEquals(mark, new Person("Mark", new BigDecimal("1200"), List.of("js", "python")));
        assertNotEquals(mark, new Person("Mark", new BigDecimal("1300"), List.of("js", "python")));
        assertNotEquals(mark, new Person("Mark", new BigDecimal("1200"), List.of("python", "js")));
    }

    @Test
    @DisplayName("salaries differing only in trailing zeros make the same person")
    void salaryScaleIgnored() {
        assertEquals(mark, new Person("Mark", new BigDecimal("1200.0"), List.of("js", "python")));
        assertEquals(mark, new Person("Mark", new BigDecimal("1200.00"), List.of("js", "python")));
        assertEquals("1200", new Person("Mark", new BigDecimal("1200.0"), List.of()).salary().toPlainString());
        assertEquals("1000", new Person("Ann", new BigDecimal("1000"), List.of()).salary().toString());
        assertEquals(new BigDecimal("0.5"), new Person("Ann", new BigDecimal("0.50"), List.of()).salary());
    }

    @Test
    @DisplayName("ordering is by name only and stable for equal names")
    void orderByName() {
        var richMark = new Person("Mark", new BigDecimal("9000"), List.of("ruby"));
        var ann = new Person("Ann", new BigDecimal("10"), List.of());
        var people = new ArrayList<>(List.of(mark, ann, richMark));
        people.sort(null);

        assertEquals(List.of(ann, mark, richMark), people);
        assertEquals(0, mark.compareTo(richMark));
    }

    @Test
    @DisplayName("relevant skills keep only required ones")
    void relevantSkills() {
        assertEquals(Set.of("js"), mark.relevantSkills(Set.of("js", "html")));
        assertTrue(mark.hasAnyOf(Set.of("python")));
        assertFalse(mark.hasAnyOf(Set.of("ruby")));
        assertFalse(mark.skills().contains("ruby"));
    }

    @Test
    @DisplayName("missing skills read as empty")
    void nullSkills() {
        assertTrue(new Person("Ann", BigDecimal.ONE, null).skills().isEmpty());
    }

    @Test
    void describesItself() {
        assertEquals("Person Name: Mark Salary: 1200 Skills: [js, python]", mark.toString());
        assertEquals("Task Name: One, Needed skills [js, python]",
                new Task("One", List.of("js", "python")).toString());
    }
}
