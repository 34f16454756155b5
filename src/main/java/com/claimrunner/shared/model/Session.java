package com.claimrunner.shared.model;

import java.time.Instant;

public record Session(
    long id,
    String accountIdentifier,
    String credentialPayload,
    Instant lastSuccessAt,
    SessionStatus status,
    Instant inProgressSince,
    String errorReason
) {
    public static Session active(long id, String accountIdentifier, String credentialPayload, Instant lastSuccessAt) {
        return new Session(id, accountIdentifier, credentialPayload, lastSuccessAt, SessionStatus.ACTIVE, null, null);
    }

    // credentials stay out of logs
    @Override
    public String toString() {
        return "Session[id=" + id
                + ", status=" + status.wireValue()
                + ", lastSuccessAt=" + lastSuccessAt
                + ", inProgressSince=" + inProgressSince
                + ", errorReason=" + errorReason + "]";
    }
}
