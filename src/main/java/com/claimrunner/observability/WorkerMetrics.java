package com.claimrunner.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

public class WorkerMetrics {

    private static final String ACCOUNTS = "claimrunner.accounts";
    private static final String RUN_DURATION = "claimrunner.run.duration";
    private static final String RUNS_REJECTED = "claimrunner.runs.rejected";

    private final MeterRegistry registry;

    public WorkerMetrics() {
        this(new SimpleMeterRegistry());
    }

    public WorkerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public void recordOutcome(String outcome) {
        Counter.builder(ACCOUNTS).tag("outcome", outcome).register(registry).increment();
    }

    public void recordRun(Duration elapsed, boolean aborted) {
        Timer.builder(RUN_DURATION).tag("aborted", String.valueOf(aborted))
                .register(registry).record(elapsed);
    }

    public void runRejected() {
        Counter.builder(RUNS_REJECTED).register(registry).increment();
    }

    public double outcomeCount(String outcome) {
        var counter = registry.find(ACCOUNTS).tag("outcome", outcome).counter();
        return counter != null ? counter.count() : 0;
    }

    /** Outcome counters plus run totals, keyed for JSON output. */
    public Map<String, Object> snapshot() {
        var outcomes = new LinkedHashMap<String, Object>();
        registry.find(ACCOUNTS).counters().forEach(c ->
                outcomes.put(c.getId().getTag("outcome"), (long) c.count()));
        long runs = registry.find(RUN_DURATION).timers().stream().mapToLong(Timer::count).sum();
        var rejected = registry.find(RUNS_REJECTED).counter();
        var result = new LinkedHashMap<String, Object>();
        result.put("runs", runs);
        result.put("runsRejected", rejected != null ? (long) rejected.count() : 0L);
        result.put("accounts", outcomes);
        return result;
    }
}
