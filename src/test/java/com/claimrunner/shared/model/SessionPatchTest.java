package com.claimrunner.shared.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SessionPatchTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Instant EARLIER = Instant.parse("2026-03-01T06:00:00Z");

    @Test
    void claimMarksInProgressWithTimestamp() {
        var claimed = SessionPatch.claim(NOW).applyTo(Session.active(7, "+1", "p", EARLIER));

        assertEquals(SessionStatus.IN_PROGRESS, claimed.status());
        assertEquals(NOW, claimed.inProgressSince());
        assertEquals(EARLIER, claimed.lastSuccessAt());
    }

    @Test
    void successClearsClaimAndAdvancesLastSuccess() {
        var claimed = SessionPatch.claim(EARLIER).applyTo(Session.active(7, "+1", "p", null));

        var done = SessionPatch.success(NOW).applyTo(claimed);

        assertEquals(SessionStatus.ACTIVE, done.status());
        assertNull(done.inProgressSince());
        assertEquals(NOW, done.lastSuccessAt());
    }

    @Test
    void errorKeepsLastSuccessAndRecordsReason() {
        var failed = SessionPatch.error("AUTH_KEY_UNREGISTERED").applyTo(Session.active(7, "+1", "p", EARLIER));

        assertEquals(SessionStatus.ERROR, failed.status());
        assertEquals("AUTH_KEY_UNREGISTERED", failed.errorReason());
        assertEquals(EARLIER, failed.lastSuccessAt());
    }

    @Test
    void errorWithoutReasonGetsPlaceholder() {
        assertEquals("unknown error", SessionPatch.error(null).errorReason());
    }

    @Test
    void rejectsInconsistentTransitions() {
        assertThrows(IllegalArgumentException.class,
                () -> new SessionPatch(SessionStatus.IN_PROGRESS, null, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new SessionPatch(SessionStatus.ACTIVE, NOW, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new SessionPatch(SessionStatus.ACTIVE, null, "oops", null));
        assertThrows(IllegalArgumentException.class,
                () -> new SessionPatch(null, null, null, null));
    }

    @Test
    void toStringHidesCredentials() {
        var session = Session.active(7, "+1", "very-secret-payload", null);

        assertFalse(session.toString().contains("very-secret-payload"));
    }

    @Test
    void statusWireValuesRoundTrip() {
        for (var status : SessionStatus.values()) {
            assertEquals(status, SessionStatus.fromWire(status.wireValue()));
        }
        assertEquals("in_progress", SessionStatus.IN_PROGRESS.wireValue());
    }
}
