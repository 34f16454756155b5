package com.claimrunner.worker;

import com.claimrunner.auth.RunSecretVerifier;
import com.claimrunner.observability.WorkerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Entry point for every run request, whether it comes over HTTP or from startup. */
public class RunTrigger {

    private static final Logger log = LoggerFactory.getLogger(RunTrigger.class);

    private final RunGuard guard;
    private final RunSecretVerifier verifier;
    private final WorkerMetrics metrics;

    public RunTrigger(RunGuard guard, RunSecretVerifier verifier, WorkerMetrics metrics) {
        this.guard = guard;
        this.verifier = verifier;
        this.metrics = metrics;
    }

    public TriggerResult requestRun(String presentedSecret) {
        if (!verifier.permits(presentedSecret)) {
            log.warn("run_rejected reason=unauthorized");
            return TriggerResult.UNAUTHORIZED;
        }
        if (!guard.tryStart()) {
            log.info("run_rejected reason=already_running");
            metrics.runRejected();
            return TriggerResult.ALREADY_RUNNING;
        }
        log.info("run_accepted");
        return TriggerResult.STARTED;
    }

    public boolean isRunning() {
        return guard.isRunning();
    }
}
