package com.chatastro.Payments.exception;

public class StoreUnavailableException extends PaymentException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, RetryPolicy.RETRYABLE, cause);
    }
}
