package com.chatastro.Payments.exception;

public class InvalidWebhookSignatureException extends PaymentException {
    public InvalidWebhookSignatureException() {
        super("Invalid webhook signature", RetryPolicy.NOT_RETRYABLE);
    }
}
