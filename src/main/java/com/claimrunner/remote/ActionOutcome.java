package com.claimrunner.remote;

public record ActionOutcome(Kind kind, long waitSeconds, String detail) {

    public enum Kind { SUCCESS, UNAVAILABLE, RATE_LIMITED, ERROR }

    public static ActionOutcome success() {
        return new ActionOutcome(Kind.SUCCESS, 0, null);
    }

    public static ActionOutcome unavailable(String reason) {
        return new ActionOutcome(Kind.UNAVAILABLE, 0, reason);
    }

    public static ActionOutcome rateLimited(long waitSeconds) {
        return new ActionOutcome(Kind.RATE_LIMITED, waitSeconds, "FLOOD_WAIT_" + waitSeconds);
    }

    public static ActionOutcome error(String detail) {
        return new ActionOutcome(Kind.ERROR, 0, detail);
    }
}
