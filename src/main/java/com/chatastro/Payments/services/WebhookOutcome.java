package com.chatastro.Payments.services;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What an authenticated webhook did. All three are acknowledged to the sender.
 */
public enum WebhookOutcome {
    PROCESSED("processed"),
    DUPLICATE("duplicate"),
    IGNORED("ignored");

    private final String value;

    WebhookOutcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
