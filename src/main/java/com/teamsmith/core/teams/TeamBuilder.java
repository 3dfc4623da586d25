package com.teamsmith.core.teams;

import com.teamsmith.core.model.Person;
import com.teamsmith.core.model.Task;
import com.teamsmith.core.model.Team;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Searches a roster for teams whose combined skills cover a task.
 * <p>
 * The search is a deterministic greedy heuristic, not an optimal set cover:
 * <ol>
 *   <li>people without any required skill are dropped;</li>
 *   <li>people who are the only holder of some required skill are seeded into every team;</li>
 *   <li>for each remaining candidate the seed is extended with whoever adds a missing skill,
 *       and every time the requirement is covered the team is pruned of redundant members,
 *       recorded, and the seed is rebuilt while the scan carries on;</li>
 *   <li>a candidate who covers the requirement alone is recorded as a singleton team and ends
 *       the scan for the current seed.</li>
 * </ol>
 * Teams are kept sorted by name and recorded once; the result is ordered by price with ties
 * in discovery order.
 */
@Service
public class TeamBuilder {

    private static final Logger log = LoggerFactory.getLogger(TeamBuilder.class);

    private static final Comparator<Team> BY_PRICE = Comparator.comparing(Team::price);

    /**
     * Finds the candidate teams for a task.
     *
     * @param task   the task whose required skills must be covered
     * @param people the full roster, in input order
     * @return distinct teams, cheapest first; empty if the task cannot be covered
     */
    public List<Team> buildTeams(Task task, List<Person> people) {
        return new Search(task.requiredSkills(), people).run();
    }

    /** State of a single search. Not shared between tasks. */
    private static final class Search {

        private final Set<String> required;
        private final List<Person> candidates;
        private final List<Person> uniqueSkillPeople;
        private final List<List<Person>> found = new ArrayList<>();

        private List<Person> team;
        private Set<String> covered;

        Search(Set<String> required, List<Person> people) {
            this.required = required;
            this.candidates = people.stream()
                    .filter(p -> p.hasAnyOf(required))
                    .toList();
            this.uniqueSkillPeople = findUniqueSkillPeople();
        }

        List<Team> run() {
            if (required.isEmpty() || candidates.isEmpty()) {
                return List.of();
            }
            log.debug("{} candidates, unique-skill people: {}", candidates.size(),
                    uniqueSkillPeople.stream().map(Person::name).toList());

            for (Person current : candidates) {
                seed(current);

                if (covered.equals(required)) {
                    record(team);
                    continue;
                }

                for (Person other : candidates) {
                    if (other.equals(current) || team.contains(other)) {
                        continue;
                    }

                    Set<String> otherSkills = other.relevantSkills(required);

                    if (otherSkills.equals(required)) {
                        record(List.of(other));
                        break;
                    }

                    if (!covered.containsAll(otherSkills)) {
                        covered.addAll(otherSkills);
                        team.add(other);
                    }

                    if (covered.equals(required)) {
                        pruneRedundant();
                        record(team);
                        seed(current);
                    }
                }
            }

            var teams = new ArrayList<Team>(found.size());
            for (List<Person> members : found) {
                teams.add(new Team(members));
            }
            teams.sort(BY_PRICE);
            return teams;
        }

        /**
         * People who are the sole candidate holding at least one required skill,
         * in the order their skills appear in the requirement.
         */
        private List<Person> findUniqueSkillPeople() {
            Map<String, List<Person>> holders = new LinkedHashMap<>();
            for (String skill : required) {
                holders.put(skill, new ArrayList<>());
            }
            for (Person p : candidates) {
                for (String skill : required) {
                    if (p.skills().contains(skill)) {
                        holders.get(skill).add(p);
                    }
                }
            }

            var unique = new ArrayList<Person>();
            for (List<Person> holdersOfSkill : holders.values()) {
                if (holdersOfSkill.size() == 1 && !unique.contains(holdersOfSkill.get(0))) {
                    unique.add(holdersOfSkill.get(0));
                }
            }
            return unique;
        }

        private void seed(Person current) {
            team = new ArrayList<>(uniqueSkillPeople);
            if (!team.contains(current)) {
                team.add(current);
            }
            covered = coveredBy(team);
        }

        /**
         * Drops members the rest of the team can do without. Removability is judged
         * against a snapshot of the full team; removals are then applied one at a time
         * and undone (member re-appended) if they break coverage.
         */
        private void pruneRedundant() {
            List<Person> snapshot = List.copyOf(team);
            var removable = new ArrayList<Person>();
            for (int i = 0; i < snapshot.size(); i++) {
                var rest = new ArrayList<Person>(snapshot.size() - 1);
                for (int j = 0; j < snapshot.size(); j++) {
                    if (j != i) {
                        rest.add(snapshot.get(j));
                    }
                }
                if (coveredBy(rest).equals(covered)) {
                    removable.add(snapshot.get(i));
                }
            }

            for (Person r : removable) {
                team.remove(r);
                if (!coveredBy(team).equals(covered)) {
                    team.add(r);
                }
            }
        }

        private void record(List<Person> members) {
            var sorted = new ArrayList<>(members);
            sorted.sort(Comparator.naturalOrder());
            if (!found.contains(sorted)) {
                found.add(sorted);
            }
        }

        private Set<String> coveredBy(List<Person> members) {
            var skills = new HashSet<String>();
            for (Person p : members) {
                skills.addAll(p.relevantSkills(required));
            }
            return skills;
        }
    }
}
