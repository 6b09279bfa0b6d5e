package com.chatastro.Payments.exception;

public class MalformedWebhookPayloadException extends PaymentException {
    public MalformedWebhookPayloadException(String message) {
        super(message, RetryPolicy.NOT_RETRYABLE);
    }

    public MalformedWebhookPayloadException(String message, Throwable cause) {
        super(message, RetryPolicy.NOT_RETRYABLE, cause);
    }
}
