package com.chatastro.Payments.Entities;

import com.chatastro.Payments.Entities.model.Payment;
import com.chatastro.Payments.Entities.model.PaymentStatus;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

@Data
public class PaymentHistoryEntry {
    private String id;
    private String orderId;
    private BigDecimal amount; // major units
    private String currency;
    private String planType;
    private String planName;
    private int questions;
    private PaymentStatus status;
    private Instant createdAt;

    public static PaymentHistoryEntry from(Payment payment) {
        PaymentHistoryEntry entry = new PaymentHistoryEntry();
        entry.setId(payment.getId());
        entry.setOrderId(payment.getOrderId());
        entry.setAmount(BigDecimal.valueOf(payment.getAmountMinorUnits(), 2));
        entry.setCurrency(payment.getCurrency());
        entry.setPlanType(payment.getPlanType());
        entry.setPlanName(payment.getPlanName());
        entry.setQuestions(payment.getQuestionCount());
        entry.setStatus(payment.getStatus());
        entry.setCreatedAt(payment.getCreatedAt());
        return entry;
    }
}
