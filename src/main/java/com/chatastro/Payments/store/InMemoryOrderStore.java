package com.chatastro.Payments.store;

import com.chatastro.Payments.Entities.model.Order;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryOrderStore implements OrderStore {

    private final ConcurrentMap<String, Order> orders = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> byGatewayOrderId = new ConcurrentHashMap<>();

    @Override
    public void put(Order order) {
        orders.put(order.getId(), order);
        // index after the record so a lookup through the index always finds it
        if (order.getGatewayOrderId() != null) {
            byGatewayOrderId.putIfAbsent(order.getGatewayOrderId(), order.getId());
        }
    }

    @Override
    public boolean replace(Order expected, Order updated) {
        return orders.replace(expected.getId(), expected, updated);
    }

    @Override
    public Optional<Order> get(String orderId) {
        if (orderId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public Optional<Order> findByGatewayOrderId(String gatewayOrderId) {
        if (gatewayOrderId == null) {
            return Optional.empty();
        }
        String orderId = byGatewayOrderId.get(gatewayOrderId);
        return orderId == null ? Optional.empty() : get(orderId);
    }
}
