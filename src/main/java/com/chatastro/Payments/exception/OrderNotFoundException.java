package com.chatastro.Payments.exception;

public class OrderNotFoundException extends PaymentException {

    private final String orderId;

    public OrderNotFoundException(String orderId) {
        super("Order not found: " + orderId, RetryPolicy.NOT_RETRYABLE);
        this.orderId = orderId;
    }

    public String getOrderId() {
        return orderId;
    }
}
