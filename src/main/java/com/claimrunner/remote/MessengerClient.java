package com.claimrunner.remote;

import java.util.List;

/** A logged-in messenger account. All calls may throw {@link RemoteCallException}. */
public interface MessengerClient {

    void sendMessage(String peer, String text);

    /** Most recent messages in the chat with {@code peer}, newest first. */
    List<BotMessage> recentMessages(String peer, int limit);

    /** Presses an inline button, as the official apps do on tap. */
    void pressButton(String peer, long messageId, byte[] callbackData);

    void disconnect();
}
