package com.claimrunner.worker;

import com.claimrunner.sessions.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Startup crash recovery: claims left in {@code in_progress} longer than the threshold
 * belonged to a process that died mid-account and are handed back to {@code active}.
 */
public class StaleSessionRecovery {

    private static final Logger log = LoggerFactory.getLogger(StaleSessionRecovery.class);

    private final SessionStore store;
    private final Duration staleAfter;
    private final Clock clock;

    public StaleSessionRecovery(SessionStore store, Duration staleAfter, Clock clock) {
        this.store = store;
        this.staleAfter = staleAfter;
        this.clock = clock;
    }

    /** Returns the number of records reset; never throws. */
    public int recover() {
        var cutoff = clock.instant().minus(staleAfter);
        try {
            int reset = store.resetStaleInProgress(cutoff);
            log.info("startup_cleared_stale_in_progress count={} cutoff={}", reset, cutoff);
            return reset;
        } catch (RuntimeException e) {
            log.warn("Failed to clear stale in_progress: {}", e.getMessage());
            return 0;
        }
    }
}
