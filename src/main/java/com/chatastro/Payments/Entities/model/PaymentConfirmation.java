package com.chatastro.Payments.Entities.model;

import lombok.Value;

/**
 * Result of a paid transition. {@code replay} is set when the transition had already been
 * applied with the same payment id and nothing was written.
 */
@Value
public class PaymentConfirmation {
    Order order;
    Payment payment;
    boolean replay;
}
