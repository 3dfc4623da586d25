package com.teamsmith.core.teams;

import com.teamsmith.core.config.TeamsmithProperties;
import com.teamsmith.core.logging.MdcContext;
import com.teamsmith.core.metrics.TeamsmithMetrics;
import com.teamsmith.core.model.Person;
import com.teamsmith.core.model.Task;
import com.teamsmith.core.model.TaskAssignment;
import com.teamsmith.core.model.Team;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the team search once per task and collects the assignments in task order.
 * <p>
 * When {@code teamsmith.parallelism} is above 1, tasks are searched on a fixed pool of that
 * many threads. The roster is only read during a search, and each search owns its state,
 * so the result is identical to a sequential run.
 */
@Service
public class TeamAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(TeamAssignmentService.class);

    private final TeamBuilder teamBuilder;
    private final int parallelism;
    private final TeamsmithMetrics metrics;

    @Autowired
    public TeamAssignmentService(TeamBuilder teamBuilder, TeamsmithProperties properties,
                                 @Autowired(required = false) TeamsmithMetrics metrics) {
        this(teamBuilder, properties.getParallelism(), metrics);
    }

    TeamAssignmentService(TeamBuilder teamBuilder, int parallelism) {
        this(teamBuilder, parallelism, null);
    }

    TeamAssignmentService(TeamBuilder teamBuilder, int parallelism, TeamsmithMetrics metrics) {
        this.teamBuilder = teamBuilder;
        this.parallelism = Math.max(1, parallelism);
        this.metrics = metrics;
    }

    /**
     * Finds teams for every task.
     *
     * @param tasks  tasks in input order
     * @param people the roster; not modified
     * @return one assignment per task, in the same order as {@code tasks}
     * @throws TeamSearchException if the search for any task fails
     */
    public List<TaskAssignment> assign(List<Task> tasks, List<Person> people) {
        log.info("Assigning teams for {} tasks from a roster of {} people (parallelism={})",
                tasks.size(), people.size(), parallelism);

        if (parallelism == 1 || tasks.size() < 2) {
            var assignments = new ArrayList<TaskAssignment>(tasks.size());
            for (Task task : tasks) {
                assignments.add(assignOne(task, people));
            }
            return assignments;
        }
        return assignConcurrently(tasks, people);
    }

    private List<TaskAssignment> assignConcurrently(List<Task> tasks, List<Person> people) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, tasks.size()));
        try {
            var futures = new ArrayList<Future<TaskAssignment>>(tasks.size());
            for (Task task : tasks) {
                futures.add(executor.submit(() -> assignOne(task, people)));
            }

            var assignments = new ArrayList<TaskAssignment>(tasks.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    assignments.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    futures.forEach(f -> f.cancel(true));
                    if (e.getCause() instanceof TeamSearchException tse) {
                        throw tse;
                    }
                    throw new TeamSearchException(
                            "Team search failed for task " + tasks.get(i).name(), e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    futures.forEach(f -> f.cancel(true));
                    throw new TeamSearchException("Interrupted while waiting for team search", e);
                }
            }
            return assignments;
        } finally {
            executor.shutdownNow();
        }
    }

    private TaskAssignment assignOne(Task task, List<Person> people) {
        MdcContext.setTask(task.name());
        long start = System.currentTimeMillis();
        try {
            List<Team> teams = teamBuilder.buildTeams(task, people);
            long elapsed = System.currentTimeMillis() - start;
            if (teams.isEmpty()) {
                log.warn("No team covers task {} (needs {})", task.name(), task.skills());
            } else {
                log.info("Task {}: {} teams, cheapest {} at {} ({}ms)", task.name(), teams.size(),
                        teams.get(0).memberNames(), teams.get(0).price(), elapsed);
            }
            if (metrics != null) {
                metrics.recordTeamSearch(elapsed, teams.size());
            }
            return new TaskAssignment(task, teams);
        } catch (RuntimeException e) {
            throw new TeamSearchException("Team search failed for task " + task.name(), e);
        } finally {
            MdcContext.clearTask();
        }
    }
}
