package com.claimrunner.worker;

import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Recognises remote rate-limit errors such as {@code FLOOD_WAIT_45}. */
final class FloodWait {

    static final long DEFAULT_WAIT_SECONDS = 60;
    static final long MAX_WAIT_SECONDS = 86_400;

    private static final Pattern FLOOD = Pattern.compile("(?i)FLOOD");
    private static final Pattern WAIT_AFTER_FLOOD = Pattern.compile("(?i)FLOOD\\D*(\\d+)");
    private static final Pattern NUMBER = Pattern.compile("(\\d+)");

    private FloodWait() {
    }

    /** Wait in seconds requested by the remote side, or empty when this is not a rate limit. */
    static OptionalLong waitSeconds(Throwable error) {
        for (var t = error; t != null; t = t.getCause()) {
            var wait = waitSeconds(t.getMessage());
            if (wait.isPresent()) return wait;
        }
        return OptionalLong.empty();
    }

    static OptionalLong waitSeconds(String message) {
        if (message == null || !FLOOD.matcher(message).find()) {
            return OptionalLong.empty();
        }
        Matcher m = WAIT_AFTER_FLOOD.matcher(message);
        if (m.find()) return parse(m.group(1));
        m = NUMBER.matcher(message);
        if (m.find()) return parse(m.group(1));
        return OptionalLong.of(DEFAULT_WAIT_SECONDS);
    }

    /** Bounds a requested wait to {@code [0, MAX_WAIT_SECONDS]}. */
    static long clamp(long seconds) {
        return Math.max(0, Math.min(seconds, MAX_WAIT_SECONDS));
    }

    private static OptionalLong parse(String digits) {
        try {
            return OptionalLong.of(clamp(Long.parseLong(digits)));
        } catch (NumberFormatException e) {
            // more digits than a long holds
            return OptionalLong.of(MAX_WAIT_SECONDS);
        }
    }
}
