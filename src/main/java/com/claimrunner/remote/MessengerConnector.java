package com.claimrunner.remote;

public interface MessengerConnector {

    /**
     * Logs in with a stored session string.
     *
     * @throws RemoteAuthException when the session string is no longer valid
     */
    MessengerClient connect(String accountIdentifier, String credentialPayload);
}
