package com.chatastro.Payments.exception;

/**
 * Raised when an order that is already paid receives a different payment id, or when a
 * payment id already recorded for one order is presented for another.
 */
public class PaymentConflictException extends PaymentException {

    private PaymentConflictException(String message) {
        super(message, RetryPolicy.NOT_RETRYABLE);
    }

    public PaymentConflictException(String orderId, String existingPaymentId, String incomingPaymentId) {
        this("Order " + orderId + " is already paid by " + existingPaymentId
                + ", rejecting payment " + incomingPaymentId);
    }

    public static PaymentConflictException paymentOfAnotherOrder(String orderId, String paymentId, String ownerOrderId) {
        return new PaymentConflictException("Payment " + paymentId + " belongs to order " + ownerOrderId
                + ", rejecting it for order " + orderId);
    }
}
