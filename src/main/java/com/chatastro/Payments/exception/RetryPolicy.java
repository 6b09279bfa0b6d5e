package com.chatastro.Payments.exception;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tells a caller what a repeat of the failed request can achieve.
 */
public enum RetryPolicy {
    /** Transient failure, the same request may succeed later. */
    RETRYABLE("retry"),
    /** The same request will always fail. */
    NOT_RETRYABLE("do_not_retry"),
    /** The client has to correct its input first. */
    RESUBMIT("resubmit");

    private final String value;

    RetryPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
