package com.chatastro.Payments.Entities.model;

import lombok.Value;

/**
 * An order together with its payment, if one has been captured.
 */
@Value
public class OrderSnapshot {
    Order order;
    Payment payment;
}
