package com.chatastro.Payments.Entities.model;

import lombok.Builder;
import lombok.Value;

/**
 * Error details reported for a failed payment attempt, either by the client checkout
 * callback or by a {@code payment.failed} webhook.
 */
@Value
@Builder
public class FailureDetail {
    String code;
    String description;
    String source;
    String reason;

    public String describe() {
        return description == null || description.isBlank() ? "Unknown error" : description;
    }
}
