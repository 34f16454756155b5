package com.claimrunner.worker;

import java.time.Duration;
import java.time.Instant;

public final class EligibilityGate {

    private static final double MILLIS_PER_MINUTE = 60_000.0;

    private EligibilityGate() {
    }

    /**
     * A session may run when it never succeeded, or when at least {@code cooldownMinutes}
     * have passed since its last success.
     */
    public static boolean isEligible(Instant lastSuccessAt, Instant now, long cooldownMinutes) {
        if (lastSuccessAt == null) return true;
        var elapsedMinutes = Duration.between(lastSuccessAt, now).toMillis() / MILLIS_PER_MINUTE;
        return elapsedMinutes >= cooldownMinutes;
    }
}
