package com.claimrunner.sessions;

import com.claimrunner.shared.model.Session;
import com.claimrunner.shared.model.SessionPatch;
import com.claimrunner.shared.model.SessionStatus;

import java.time.Instant;
import java.util.List;

/**
 * Record store for account sessions. Implementations throw {@link SessionStoreException}
 * when the backing store cannot be read or written.
 */
public interface SessionStore {

    /** Sessions with the given status, ordered by id ascending. */
    List<Session> listByStatus(SessionStatus status);

    /** Applies the patch; returns {@code false} when no record has this id. */
    boolean update(long id, SessionPatch patch);

    /**
     * Moves every {@code in_progress} record claimed before {@code cutoff} back to
     * {@code active}. Returns the number of records reset.
     */
    int resetStaleInProgress(Instant cutoff);
}
