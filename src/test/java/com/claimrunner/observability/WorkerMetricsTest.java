package com.claimrunner.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkerMetricsTest {

    @Test
    void countsOutcomesPerTag() {
        var metrics = new WorkerMetrics();

        metrics.recordOutcome("success");
        metrics.recordOutcome("success");
        metrics.recordOutcome("timeout");

        assertEquals(2.0, metrics.outcomeCount("success"));
        assertEquals(1.0, metrics.outcomeCount("timeout"));
        assertEquals(0.0, metrics.outcomeCount("error"));
    }

    @Test
    void snapshotSummarisesRunsAndAccounts() {
        var registry = new SimpleMeterRegistry();
        var metrics = new WorkerMetrics(registry);

        metrics.recordRun(Duration.ofSeconds(3), false);
        metrics.recordRun(Duration.ofMillis(5), true);
        metrics.runRejected();
        metrics.recordOutcome("flood_wait");

        var snapshot = metrics.snapshot();

        assertSame(registry, metrics.registry());
        assertEquals(2L, snapshot.get("runs"));
        assertEquals(1L, snapshot.get("runsRejected"));
        assertEquals(Map.of("flood_wait", 1L), snapshot.get("accounts"));
    }

    @Test
    void emptySnapshotHasZeroes() {
        var snapshot = new WorkerMetrics().snapshot();

        assertEquals(0L, snapshot.get("runs"));
        assertEquals(0L, snapshot.get("runsRejected"));
        assertEquals(Map.of(), snapshot.get("accounts"));
    }
}
