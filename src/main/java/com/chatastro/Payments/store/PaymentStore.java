package com.chatastro.Payments.store;

import com.chatastro.Payments.Entities.model.Payment;

import java.util.List;
import java.util.Optional;

/**
 * Keyed store of captured payments, with a secondary index by owning user.
 * Same concurrency contract as {@link OrderStore}. A payment id is recorded at most once:
 * a stored payment is never overwritten.
 */
public interface PaymentStore {

    /**
     * Stores {@code payment} unless its id is already taken.
     *
     * @return false when a payment with the same id exists; the stored one is left untouched
     */
    boolean add(Payment payment);

    Optional<Payment> get(String paymentId);

    /**
     * Withdraws a payment whose order was paid by another payment before it could be linked.
     */
    void remove(String paymentId);

    /**
     * @return the user's payments in the order they were first stored, empty if none
     */
    List<Payment> listByUser(String userId);
}
