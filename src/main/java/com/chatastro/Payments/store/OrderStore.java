package com.chatastro.Payments.store;

import com.chatastro.Payments.Entities.model.Order;

import java.util.Optional;

/**
 * Keyed store of orders, the source of truth for the order lifecycle.
 *
 * <p>Implementations must be safe for concurrent use and must never expose a partially
 * written record: a write replaces the whole order atomically. Transitions go through
 * {@link #replace}, which only succeeds while the stored order is still the one the caller
 * read, so two processes sharing a backend cannot both apply a transition. Backend failures
 * are reported as {@link com.chatastro.Payments.exception.StoreUnavailableException}.
 */
public interface OrderStore {

    void put(Order order);

    /**
     * Atomically swaps {@code expected} for {@code updated}.
     *
     * @return false when the stored order is missing or no longer matches {@code expected}
     */
    boolean replace(Order expected, Order updated);

    Optional<Order> get(String orderId);

    Optional<Order> findByGatewayOrderId(String gatewayOrderId);
}
