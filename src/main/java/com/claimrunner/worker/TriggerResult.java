package com.claimrunner.worker;

public enum TriggerResult {
    STARTED,
    ALREADY_RUNNING,
    UNAUTHORIZED
}
