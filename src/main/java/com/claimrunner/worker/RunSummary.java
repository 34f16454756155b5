package com.claimrunner.worker;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

public record RunSummary(
    Instant startedAt,
    Instant finishedAt,
    boolean aborted,
    int fetched,
    int skipped,
    Map<ProcessingOutcome, Integer> outcomes
) {
    public RunSummary {
        outcomes = Map.copyOf(outcomes);
    }

    public static RunSummary aborted(Instant startedAt, Instant finishedAt) {
        return new RunSummary(startedAt, finishedAt, true, 0, 0, Map.of());
    }

    public int processed() {
        return outcomes.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int count(ProcessingOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }
}
