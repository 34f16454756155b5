package com.claimrunner.remote;

/** Handle to an established remote session; {@code client} is owned by the capability. */
public record RemoteSession(String accountIdentifier, MessengerClient client) {

    @Override
    public String toString() {
        return "RemoteSession[" + (client != null ? client.getClass().getSimpleName() : "detached") + "]";
    }
}
