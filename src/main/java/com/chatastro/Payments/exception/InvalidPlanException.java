package com.chatastro.Payments.exception;

public class InvalidPlanException extends PaymentException {
    public InvalidPlanException(String planType) {
        super("Invalid plan type: " + planType, RetryPolicy.RESUBMIT);
    }
}
