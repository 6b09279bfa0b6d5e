package com.chatastro.Payments.exception;

public class GatewayException extends PaymentException {
    public GatewayException(String message) {
        super(message, RetryPolicy.RETRYABLE);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, RetryPolicy.RETRYABLE, cause);
    }
}
