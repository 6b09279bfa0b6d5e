package com.chatastro.Payments.Entities;

import com.chatastro.Payments.Entities.model.OrderSnapshot;
import com.chatastro.Payments.Entities.model.OrderStatus;
import com.chatastro.Payments.Entities.model.Payment;
import com.chatastro.Payments.Entities.model.PaymentStatus;
import lombok.Data;

import java.time.Instant;

@Data
public class PaymentStatusResponse {
    private OrderView order;
    private PaymentView payment;

    @Data
    public static class OrderView {
        private String id;
        private long amount;
        private String currency;
        private OrderStatus status;
        private int attempts;
        private Instant createdAt;
    }

    @Data
    public static class PaymentView {
        private String id;
        private PaymentStatus status;
        private String method;
        private Instant verifiedAt;
    }

    public static PaymentStatusResponse from(OrderSnapshot snapshot) {
        PaymentStatusResponse response = new PaymentStatusResponse();

        OrderView order = new OrderView();
        order.setId(snapshot.getOrder().getId());
        order.setAmount(snapshot.getOrder().getAmountMinorUnits());
        order.setCurrency(snapshot.getOrder().getCurrency());
        order.setStatus(snapshot.getOrder().getStatus());
        order.setAttempts(snapshot.getOrder().getAttempts());
        order.setCreatedAt(snapshot.getOrder().getCreatedAt());
        response.setOrder(order);

        Payment payment = snapshot.getPayment();
        if (payment != null) {
            PaymentView view = new PaymentView();
            view.setId(payment.getId());
            view.setStatus(payment.getStatus());
            view.setMethod(payment.getMethod() == null ? "unknown" : payment.getMethod());
            view.setVerifiedAt(payment.getVerifiedAt());
            response.setPayment(view);
        }
        return response;
    }
}
