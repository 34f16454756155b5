package com.claimrunner.remote;

public record InlineButton(String text, byte[] callbackData) {
}
