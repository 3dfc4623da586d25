package com.teamsmith.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for team search.
 */
@Service
public class TeamsmithMetrics {

    private final MeterRegistry registry;

    public TeamsmithMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTeamSearch(long ms, int teamsFound) {
        Timer.builder("teamsmith.team.search.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        DistributionSummary.builder("teamsmith.teams.found")
                .register(registry)
                .record(teamsFound);
        if (teamsFound == 0) {
            Counter.builder("teamsmith.tasks.uncovered")
                    .register(registry)
                    .increment();
        }
    }

    public void recordRun(String status) {
        Counter.builder("teamsmith.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
