package com.chatastro.Payments.Entities.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable snapshot of a purchase order. Every transition produces a new instance that
 * replaces the stored one as a whole.
 */
@Value
@Builder(toBuilder = true)
public class Order {
    String id;
    // id assigned by the gateway when the remote order was created, null for offline orders
    String gatewayOrderId;
    long amountMinorUnits;
    String currency;
    OrderStatus status;
    int attempts;
    Instant createdAt;
    String userId;
    String planType;
    UserDetails userDetails;
    String paymentId;
    FailureDetail failure;
    Instant failedAt;
    Instant paidAt;

    @JsonIgnore
    public boolean isPaid() {
        return status == OrderStatus.PAID;
    }
}
