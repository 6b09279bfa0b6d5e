package com.chatastro.Payments.Entities.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Only captured payments are recorded here; refunds and disputes stay on the gateway side.
 */
public enum PaymentStatus {
    CAPTURED("captured");

    private final String value;

    PaymentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static PaymentStatus fromValue(String value) {
        for (PaymentStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown payment status: " + value);
    }
}
