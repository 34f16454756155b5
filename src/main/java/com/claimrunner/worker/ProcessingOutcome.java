package com.claimrunner.worker;

import java.util.Locale;

public enum ProcessingOutcome {
    SUCCESS,
    UNAVAILABLE,
    TIMEOUT,
    FLOOD_WAIT,
    ERROR,
    /** The worker itself was asked to stop mid-account; the session is released. */
    INTERRUPTED;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
