package com.claimrunner.remote;

import com.claimrunner.shared.Sleeper;
import com.claimrunner.shared.config.RemoteConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Claims the periodic bonus offered by a bot: opens the chat with {@code /start}, passes the
 * optional subscription gate, then presses the bonus button.
 */
public class BonusClaimAction implements RemoteActionCapability {

    private static final Logger log = LoggerFactory.getLogger(BonusClaimAction.class);
    private static final String START_COMMAND = "/start";

    private final MessengerConnector connector;
    private final RemoteConfig config;
    private final Sleeper sleeper;

    public BonusClaimAction(MessengerConnector connector, RemoteConfig config, Sleeper sleeper) {
        this.connector = connector;
        this.config = config;
        this.sleeper = sleeper;
    }

    @Override
    public RemoteSession establishSession(String accountIdentifier, String credentialPayload) {
        if (credentialPayload == null || credentialPayload.isBlank()) {
            throw new RemoteAuthException("AUTH_KEY_UNREGISTERED: empty session string");
        }
        return new RemoteSession(accountIdentifier, connector.connect(accountIdentifier, credentialPayload));
    }

    @Override
    public ActionOutcome performAction(RemoteSession session) {
        var client = session.client();
        var bot = config.botUsername();

        client.sendMessage(bot, START_COMMAND);
        settle();
        var messages = client.recentMessages(bot, config.messageLimit());

        var gate = firstWithButton(messages, config.subscriptionLabel());
        if (gate != null) {
            log.info("subscription_gate_found");
            var confirm = gate.callbackButton(config.subscriptionLabel());
            if (confirm.isPresent()) {
                try {
                    client.pressButton(bot, gate.id(), confirm.get().callbackData());
                    log.info("subscription_confirmed");
                    settle();
                    messages = client.recentMessages(bot, config.messageLimit());
                } catch (RemoteCallException e) {
                    log.warn("subscription_click_failed error={}", e.getMessage());
                }
            }
        }

        if (messages.isEmpty()) {
            return ActionOutcome.unavailable("no_messages");
        }
        var bonusMessage = firstWithButton(messages, config.bonusLabel());
        if (bonusMessage == null) {
            return ActionOutcome.unavailable("no_matching_button");
        }
        var bonus = bonusMessage.callbackButton(config.bonusLabel());
        if (bonus.isEmpty()) {
            return ActionOutcome.unavailable("no_callback_data");
        }

        client.pressButton(bot, bonusMessage.id(), bonus.get().callbackData());
        log.info("bonus_clicked");
        settle();
        return ActionOutcome.success();
    }

    @Override
    public void teardown(RemoteSession session) {
        session.client().disconnect();
    }

    private static BotMessage firstWithButton(List<BotMessage> messages, String label) {
        for (var message : messages) {
            if (message.hasButtonLabelled(label)) return message;
        }
        return null;
    }

    private void settle() {
        try {
            sleeper.sleep(Duration.ofSeconds(config.settleSeconds()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteCallException("Interrupted while waiting for the bot", e);
        }
    }
}
