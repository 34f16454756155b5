package com.claimrunner.remote;

import java.util.List;
import java.util.Optional;

public record BotMessage(long id, String text, List<List<InlineButton>> buttonRows) {

    public BotMessage {
        buttonRows = buttonRows != null ? List.copyOf(buttonRows) : List.of();
    }

    public boolean hasButtonLabelled(String fragment) {
        return buttonRows.stream()
                .flatMap(List::stream)
                .anyMatch(b -> b.text() != null && b.text().contains(fragment));
    }

    /** First button whose label contains {@code fragment} and which carries callback data. */
    public Optional<InlineButton> callbackButton(String fragment) {
        return buttonRows.stream()
                .flatMap(List::stream)
                .filter(b -> b.text() != null && b.text().contains(fragment))
                .findFirst()
                .filter(b -> b.callbackData() != null && b.callbackData().length > 0);
    }
}
