package com.claimrunner.shared.model;

import java.time.Instant;

/**
 * A single state transition applied to one session record.
 *
 * <p>{@code status}, {@code inProgressSince} and {@code errorReason} are always written
 * (null clears the column); {@code lastSuccessAt} is written only when non-null.
 */
public record SessionPatch(
    SessionStatus status,
    Instant inProgressSince,
    String errorReason,
    Instant lastSuccessAt
) {
    public SessionPatch {
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        if ((status == SessionStatus.IN_PROGRESS) != (inProgressSince != null)) {
            throw new IllegalArgumentException("inProgressSince must be set iff status is in_progress");
        }
        if (errorReason != null && status != SessionStatus.ERROR) {
            throw new IllegalArgumentException("errorReason is only allowed on error status");
        }
    }

    public static SessionPatch claim(Instant now) {
        return new SessionPatch(SessionStatus.IN_PROGRESS, now, null, null);
    }

    public static SessionPatch release() {
        return new SessionPatch(SessionStatus.ACTIVE, null, null, null);
    }

    public static SessionPatch success(Instant now) {
        return new SessionPatch(SessionStatus.ACTIVE, null, null, now);
    }

    public static SessionPatch error(String reason) {
        return new SessionPatch(SessionStatus.ERROR, null, reason != null ? reason : "unknown error", null);
    }

    public Session applyTo(Session session) {
        return new Session(
                session.id(),
                session.accountIdentifier(),
                session.credentialPayload(),
                lastSuccessAt != null ? lastSuccessAt : session.lastSuccessAt(),
                status,
                inProgressSince,
                errorReason);
    }
}
