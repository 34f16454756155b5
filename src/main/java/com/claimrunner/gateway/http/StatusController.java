package com.claimrunner.gateway.http;

import com.claimrunner.observability.WorkerMetrics;
import com.claimrunner.worker.RunTrigger;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class StatusController {

    private final Clock clock;
    private final RunTrigger trigger;
    private final WorkerMetrics metrics;

    public StatusController(Clock clock, RunTrigger trigger, WorkerMetrics metrics) {
        this.clock = clock;
        this.trigger = trigger;
        this.metrics = metrics;
    }

    /** Liveness only: no auth, no side effects. */
    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok", "ts", clock.instant().toString());
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        var body = new LinkedHashMap<String, Object>();
        body.put("running", trigger.isRunning());
        body.putAll(metrics.snapshot());
        body.put("ts", clock.instant().toString());
        return body;
    }
}
