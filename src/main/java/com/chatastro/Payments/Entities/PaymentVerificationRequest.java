package com.chatastro.Payments.Entities;

/**
 * Payload posted by the checkout widget once the gateway reports a successful payment.
 * Field names follow the gateway's handler response.
 */
public class PaymentVerificationRequest {
    private String razorpay_order_id;
    private String razorpay_payment_id;
    private String razorpay_signature;

    public PaymentVerificationRequest() {}

    public PaymentVerificationRequest(String orderId, String paymentId, String signature) {
        this.razorpay_order_id = orderId;
        this.razorpay_payment_id = paymentId;
        this.razorpay_signature = signature;
    }

    public String getRazorpay_order_id() { return razorpay_order_id; }
    public void setRazorpay_order_id(String razorpay_order_id) { this.razorpay_order_id = razorpay_order_id; }

    public String getRazorpay_payment_id() { return razorpay_payment_id; }
    public void setRazorpay_payment_id(String razorpay_payment_id) { this.razorpay_payment_id = razorpay_payment_id; }

    public String getRazorpay_signature() { return razorpay_signature; }
    public void setRazorpay_signature(String razorpay_signature) { this.razorpay_signature = razorpay_signature; }

    @Override
    public String toString() {
        // the signature is left out on purpose
        return "PaymentVerificationRequest{orderId=" + razorpay_order_id + ", paymentId=" + razorpay_payment_id + "}";
    }
}
