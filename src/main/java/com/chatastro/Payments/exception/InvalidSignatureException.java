package com.chatastro.Payments.exception;

public class InvalidSignatureException extends PaymentException {
    public InvalidSignatureException(String orderId) {
        super("Invalid payment signature for order " + orderId, RetryPolicy.NOT_RETRYABLE);
    }
}
