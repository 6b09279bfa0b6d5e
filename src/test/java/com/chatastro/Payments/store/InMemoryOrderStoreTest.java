package com.chatastro.Payments.store;

import com.chatastro.Payments.Entities.model.Order;
import com.chatastro.Payments.Entities.model.OrderStatus;
import com.chatastro.Payments.Entities.model.UserDetails;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryOrderStoreTest {

    private final InMemoryOrderStore store = new InMemoryOrderStore();

    @Test
    void get_shouldReturnEmpty_whenAbsent() {
        assertTrue(store.get("order_missing").isEmpty());
        assertTrue(store.get(null).isEmpty());
        assertTrue(store.findByGatewayOrderId("order_remote").isEmpty());
    }

    @Test
    void put_shouldReplaceWholeRecord() {
        Order created = order("order_1", "order_remote_1");
        store.put(created);

        Order paid = created.toBuilder().status(OrderStatus.PAID).paymentId("pay_1").attempts(1).build();
        store.put(paid);

        assertEquals(paid, store.get("order_1").orElseThrow());
    }

    @Test
    void replace_shouldOnlySwapExpectedVersion() {
        // Given
        Order created = order("order_1", "order_remote_1");
        store.put(created);
        Order failed = created.toBuilder().status(OrderStatus.FAILED).attempts(1).build();
        Order paid = created.toBuilder().status(OrderStatus.PAID).paymentId("pay_1").attempts(1).build();

        // When
        boolean first = store.replace(created, failed);
        boolean stale = store.replace(created, paid);

        // Then
        assertTrue(first);
        assertFalse(stale);
        assertEquals(failed, store.get("order_1").orElseThrow());
        assertFalse(store.replace(order("order_2", null), paid));
    }

    @Test
    void findByGatewayOrderId_shouldReturnLatestVersion() {
        Order created = order("order_1", "order_remote_1");
        store.put(created);
        store.put(created.toBuilder().status(OrderStatus.FAILED).attempts(1).build());

        Order found = store.findByGatewayOrderId("order_remote_1").orElseThrow();

        assertEquals("order_1", found.getId());
        assertEquals(OrderStatus.FAILED, found.getStatus());
    }

    private static Order order(String id, String gatewayOrderId) {
        return Order.builder()
                .id(id)
                .gatewayOrderId(gatewayOrderId)
                .amountMinorUnits(29900)
                .currency("INR")
                .status(OrderStatus.CREATED)
                .createdAt(Instant.parse("2026-01-01T10:00:00Z"))
                .userId("u1")
                .planType("standard")
                .userDetails(UserDetails.anonymous())
                .build();
    }
}
