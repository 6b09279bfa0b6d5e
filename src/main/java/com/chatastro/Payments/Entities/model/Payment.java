package com.chatastro.Payments.Entities.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class Payment {
    String id;
    String orderId;
    long amountMinorUnits;
    String currency;
    PaymentStatus status;
    // null unless read from an authenticated webhook payload
    String method;
    String userId;
    String planType;
    String planName;
    int questionCount;
    PaymentSource source;
    Instant createdAt;
    Instant verifiedAt;
}
