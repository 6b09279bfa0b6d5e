package com.chatastro.Payments.Entities.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PaymentSource {
    CLIENT_CONFIRMATION("client_confirmation"),
    WEBHOOK("webhook");

    private final String value;

    PaymentSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static PaymentSource fromValue(String value) {
        for (PaymentSource source : values()) {
            if (source.value.equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown payment source: " + value);
    }
}
