package com.claimrunner.worker;

import com.claimrunner.observability.WorkerMetrics;
import com.claimrunner.sessions.SessionStore;
import com.claimrunner.shared.Sleeper;
import com.claimrunner.shared.config.WorkerSettings;
import com.claimrunner.shared.model.Session;
import com.claimrunner.shared.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;

/**
 * One pass over the active sessions, strictly one account at a time in id order, with a
 * fixed pause after every processed account.
 */
public class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final SessionStore store;
    private final AccountProcessor processor;
    private final WorkerSettings settings;
    private final WorkerMetrics metrics;
    private final Clock clock;
    private final Sleeper sleeper;

    public BatchOrchestrator(SessionStore store, AccountProcessor processor, WorkerSettings settings,
                             WorkerMetrics metrics, Clock clock, Sleeper sleeper) {
        this.store = store;
        this.processor = processor;
        this.settings = settings;
        this.metrics = metrics;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public RunSummary runOnce() {
        var startedAt = clock.instant();
        log.info("run_start at={}", startedAt);

        List<Session> sessions;
        try {
            sessions = store.listByStatus(SessionStatus.ACTIVE);
        } catch (RuntimeException e) {
            log.error("Failed to fetch sessions, run aborted", e);
            var summary = RunSummary.aborted(startedAt, clock.instant());
            metrics.recordRun(summary.elapsed(), true);
            return summary;
        }

        var outcomes = new EnumMap<ProcessingOutcome, Integer>(ProcessingOutcome.class);
        int skipped = 0;
        for (var session : sessions) {
            if (!EligibilityGate.isEligible(session.lastSuccessAt(), clock.instant(), settings.eligibilityMinutes())) {
                log.info("account_skipped_not_eligible id={}", session.id());
                skipped++;
                continue;
            }
            var outcome = processor.process(session);
            outcomes.merge(outcome, 1, Integer::sum);
            if (!pause()) {
                log.warn("run_interrupted after id={}", session.id());
                break;
            }
        }

        var summary = new RunSummary(startedAt, clock.instant(), false, sessions.size(), skipped, outcomes);
        log.info("run_complete at={} fetched={} processed={} skipped={} outcomes={}",
                summary.finishedAt(), summary.fetched(), summary.processed(), summary.skipped(), outcomes);
        metrics.recordRun(summary.elapsed(), false);
        return summary;
    }

    private boolean pause() {
        try {
            sleeper.sleep(Duration.ofSeconds(settings.delayBetweenAccountsSeconds()));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
