package com.claimrunner.worker;

import com.claimrunner.observability.WorkerMetrics;
import com.claimrunner.remote.ActionOutcome;
import com.claimrunner.remote.RemoteActionCapability;
import com.claimrunner.remote.RemoteSession;
import com.claimrunner.sessions.SessionStore;
import com.claimrunner.shared.Sleeper;
import com.claimrunner.shared.config.WorkerSettings;
import com.claimrunner.shared.model.Session;
import com.claimrunner.shared.model.SessionPatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the remote action for one session under a deadline and moves the record through
 * {@code in_progress} to {@code active} or {@code error}.
 *
 * <p>Timeouts, rate limits and a missing bonus button release the session for a later run;
 * every other failure parks it in {@code error}. Nothing escapes {@link #process(Session)}.
 */
public class AccountProcessor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AccountProcessor.class);
    static final String MDC_KEY = "session";

    private final SessionStore store;
    private final RemoteActionCapability remote;
    private final WorkerSettings settings;
    private final WorkerMetrics metrics;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ExecutorService attempts;

    public AccountProcessor(SessionStore store, RemoteActionCapability remote, WorkerSettings settings,
                            WorkerMetrics metrics, Clock clock, Sleeper sleeper) {
        this.store = store;
        this.remote = remote;
        this.settings = settings;
        this.metrics = metrics;
        this.clock = clock;
        this.sleeper = sleeper;
        var counter = new AtomicInteger();
        // cached pool: an attempt that ignores cancellation must not block the next account
        this.attempts = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "account-attempt-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public ProcessingOutcome process(Session session) {
        var id = session.id();
        MDC.put(MDC_KEY, String.valueOf(id));
        try {
            log.info("account_start id={}", id);
            claim(session);

            var slot = new RemoteSessionSlot();
            Result result;
            try {
                result = attemptWithDeadline(session, slot);
            } finally {
                var established = slot.close();
                if (established != null) {
                    teardownQuietly(established);
                }
            }

            finish(id, result);
            metrics.recordOutcome(result.outcome().tag());
            return result.outcome();
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    private void claim(Session session) {
        try {
            if (!store.update(session.id(), SessionPatch.claim(clock.instant()))) {
                log.warn("claim_skipped id={} reason=record_missing", session.id());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to mark in_progress id={}: {}", session.id(), e.getMessage());
        }
    }

    private Result attemptWithDeadline(Session session, RemoteSessionSlot slot) {
        var mdc = MDC.getCopyOfContextMap();
        var future = attempts.submit(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                return attempt(session, slot);
            } finally {
                MDC.clear();
            }
        });
        try {
            return classify(future.get(settings.accountTimeoutSeconds(), TimeUnit.SECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            return new Result(ProcessingOutcome.TIMEOUT, "account_timeout", 0);
        } catch (ExecutionException e) {
            return classify(e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return new Result(ProcessingOutcome.INTERRUPTED, "worker_interrupted", 0);
        }
    }

    private ActionOutcome attempt(Session session, RemoteSessionSlot slot) {
        var established = remote.establishSession(session.accountIdentifier(), session.credentialPayload());
        if (!slot.attach(established)) {
            // deadline already passed; nobody else will close this one
            teardownQuietly(established);
            throw new CancellationException("session established after deadline");
        }
        var outcome = remote.performAction(established);
        if (outcome == null) {
            throw new IllegalStateException("remote action returned no outcome");
        }
        return outcome;
    }

    private static Result classify(ActionOutcome outcome) {
        return switch (outcome.kind()) {
            case SUCCESS -> new Result(ProcessingOutcome.SUCCESS, null, 0);
            case UNAVAILABLE -> new Result(ProcessingOutcome.UNAVAILABLE, outcome.detail(), 0);
            case RATE_LIMITED -> new Result(ProcessingOutcome.FLOOD_WAIT, outcome.detail(),
                    FloodWait.clamp(outcome.waitSeconds()));
            case ERROR -> new Result(ProcessingOutcome.ERROR, outcome.detail(), 0);
        };
    }

    private static Result classify(Throwable error) {
        var wait = FloodWait.waitSeconds(error);
        if (wait.isPresent()) {
            return new Result(ProcessingOutcome.FLOOD_WAIT, error.getMessage(), wait.getAsLong());
        }
        var message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new Result(ProcessingOutcome.ERROR, message, 0);
    }

    private void finish(long id, Result result) {
        try {
            recordOutcome(id, result);
        } catch (RuntimeException e) {
            log.error("Failed to finish session {} with outcome {}, releasing", id, result.outcome().tag(), e);
            persist(id, SessionPatch.release());
        }
    }

    private void recordOutcome(long id, Result result) {
        switch (result.outcome()) {
            case SUCCESS -> {
                log.info("account_success id={}", id);
                persist(id, SessionPatch.success(clock.instant()));
            }
            case UNAVAILABLE -> {
                log.info("bonus_unavailable id={} reason={}", id, result.detail());
                persist(id, SessionPatch.release());
            }
            case TIMEOUT -> {
                log.warn("timeout id={} after_seconds={}", id, settings.accountTimeoutSeconds());
                persist(id, SessionPatch.release());
            }
            case FLOOD_WAIT -> {
                log.warn("flood_wait id={} wait_seconds={}", id, result.waitSeconds());
                backOff(result.waitSeconds());
                persist(id, SessionPatch.release());
            }
            case ERROR -> {
                log.error("account_error id={} error={}", id, result.detail());
                persist(id, SessionPatch.error(result.detail()));
            }
            case INTERRUPTED -> {
                log.warn("account_interrupted id={}", id);
                persist(id, SessionPatch.release());
            }
        }
    }

    private void backOff(long waitSeconds) {
        try {
            var total = FloodWait.clamp(saturatedAdd(waitSeconds, settings.floodWaitMarginSeconds()));
            sleeper.sleep(Duration.ofSeconds(total));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("flood_wait_interrupted");
        }
    }

    private static long saturatedAdd(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private void persist(long id, SessionPatch patch) {
        try {
            if (!store.update(id, patch)) {
                log.warn("session_missing id={} status={}", id, patch.status().wireValue());
            }
        } catch (RuntimeException e) {
            log.error("Failed to store status {} for session {}", patch.status().wireValue(), id, e);
        }
    }

    private void teardownQuietly(RemoteSession established) {
        try {
            remote.teardown(established);
        } catch (RuntimeException e) {
            log.debug("teardown failed: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        attempts.shutdownNow();
    }

    private record Result(ProcessingOutcome outcome, String detail, long waitSeconds) {}

    /** Hands an established remote session from the attempt thread to whoever closes it. */
    private static final class RemoteSessionSlot {
        private RemoteSession session;
        private boolean closed;

        synchronized boolean attach(RemoteSession established) {
            if (closed) return false;
            session = established;
            return true;
        }

        synchronized RemoteSession close() {
            closed = true;
            var established = session;
            session = null;
            return established;
        }
    }
}
