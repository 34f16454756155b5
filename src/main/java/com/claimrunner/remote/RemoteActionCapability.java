package com.claimrunner.remote;

/**
 * The remote interaction performed for one account.
 *
 * <p>Implementations keep any client-library background noise to themselves; callers only
 * see a {@link RemoteSession}, an {@link ActionOutcome} or an exception.
 */
public interface RemoteActionCapability {

    /**
     * Opens an authenticated session from the stored credential.
     *
     * @throws RemoteAuthException when the credential is rejected
     */
    RemoteSession establishSession(String accountIdentifier, String credentialPayload);

    ActionOutcome performAction(RemoteSession session);

    /** Best-effort close. May throw; callers swallow the failure. */
    void teardown(RemoteSession session);
}
