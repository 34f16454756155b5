package com.claimrunner.shared.config;

public record WorkerSettings(
    long delayBetweenAccountsSeconds,
    long eligibilityMinutes,
    long accountTimeoutSeconds,
    long staleInProgressMinutes,
    long floodWaitMarginSeconds,
    boolean runOnStartup
) {
    public static WorkerSettings defaults() {
        return new WorkerSettings(10, 240, 30, 60, 2, false);
    }
}
