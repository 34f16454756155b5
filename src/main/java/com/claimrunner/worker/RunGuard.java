package com.claimrunner.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-flight guard around the batch: at most one run per process, started in the
 * background. The flag is released however the run ends.
 */
public class RunGuard implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RunGuard.class);

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Runnable batch;
    private final ExecutorService runner;

    public RunGuard(Runnable batch) {
        this.batch = batch;
        this.runner = Executors.newSingleThreadExecutor(r -> {
            var t = new Thread(r, "batch-run");
            t.setDaemon(true);
            return t;
        });
    }

    /** Starts a run unless one is already going; returns whether this call started it. */
    public boolean tryStart() {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        try {
            runner.execute(this::runAndRelease);
        } catch (RejectedExecutionException e) {
            running.set(false);
            throw e;
        }
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    private void runAndRelease() {
        try {
            batch.run();
        } catch (RuntimeException e) {
            log.error("Run error", e);
        } finally {
            running.set(false);
        }
    }

    @Override
    public void close() {
        runner.shutdownNow();
    }
}
