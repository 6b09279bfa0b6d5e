package com.chatastro.Payments.exception;

/**
 * Base type for every failure raised by the order and payment core. Messages never carry
 * secrets or signatures.
 */
public abstract class PaymentException extends RuntimeException {

    private final RetryPolicy retryPolicy;

    protected PaymentException(String message, RetryPolicy retryPolicy) {
        super(message);
        this.retryPolicy = retryPolicy;
    }

    protected PaymentException(String message, RetryPolicy retryPolicy, Throwable cause) {
        super(message, cause);
        this.retryPolicy = retryPolicy;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }
}
