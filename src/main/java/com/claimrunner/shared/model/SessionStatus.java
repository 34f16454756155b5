package com.claimrunner.shared.model;

public enum SessionStatus {
    ACTIVE("active"),
    IN_PROGRESS("in_progress"),
    ERROR("error");

    private final String wireValue;

    SessionStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    /** Lowercase value persisted by every store backend. */
    public String wireValue() {
        return wireValue;
    }

    public static SessionStatus fromWire(String value) {
        for (var status : values()) {
            if (status.wireValue.equals(value)) return status;
        }
        throw new IllegalArgumentException("Unknown session status: " + value);
    }
}
