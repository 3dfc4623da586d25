package com.teamsmith.core.model;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A member of the roster that tasks draw their teams from.
 * <p>
 * Equality is structural over all fields; the natural order is by name only,
 * which is how team members are canonicalised.
 *
 * @param name   identity and sort key
 * @param salary monthly cost of the person, never negative; trailing fractional zeros are
 *               dropped so {@code 1500} and {@code 1500.0} make the same person
 * @param skills skills in input order, duplicates kept
 */
public record Person(
    String name,
    BigDecimal salary,
    List<String> skills
) implements Comparable<Person> {

    public Person {
        salary = normalize(salary);
        skills = skills == null ? List.of() : List.copyOf(skills);
    }

    /**
     * Returns the subset of this person's skills that the given requirement asks for.
     */
    public Set<String> relevantSkills(Set<String> required) {
        var relevant = new LinkedHashSet<String>();
        for (String skill : skills) {
            if (required.contains(skill)) {
                relevant.add(skill);
            }
        }
        return relevant;
    }

    public boolean hasAnyOf(Set<String> required) {
        for (String skill : skills) {
            if (required.contains(skill)) {
                return true;
            }
        }
        return false;
    }

    private static BigDecimal normalize(BigDecimal salary) {
        if (salary == null || salary.scale() <= 0) {
            return salary;
        }
        BigDecimal stripped = salary.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    @Override
    public int compareTo(Person other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return "Person Name: " + name + " Salary: " + salary + " Skills: " + skills;
    }
}
