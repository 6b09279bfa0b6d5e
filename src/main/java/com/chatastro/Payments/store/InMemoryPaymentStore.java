package com.chatastro.Payments.store;

import com.chatastro.Payments.Entities.model.Payment;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryPaymentStore implements PaymentStore {

    private final ConcurrentMap<String, Payment> payments = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<String>> paymentIdsByUser = new ConcurrentHashMap<>();

    @Override
    public boolean add(Payment payment) {
        if (payments.putIfAbsent(payment.getId(), payment) != null) {
            return false;
        }
        if (payment.getUserId() != null) {
            paymentIdsByUser
                    .computeIfAbsent(payment.getUserId(), userId -> new CopyOnWriteArrayList<>())
                    .add(payment.getId());
        }
        return true;
    }

    @Override
    public Optional<Payment> get(String paymentId) {
        if (paymentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(payments.get(paymentId));
    }

    @Override
    public void remove(String paymentId) {
        Payment removed = payments.remove(paymentId);
        if (removed != null && removed.getUserId() != null) {
            List<String> ids = paymentIdsByUser.get(removed.getUserId());
            if (ids != null) {
                ids.remove(paymentId);
            }
        }
    }

    @Override
    public List<Payment> listByUser(String userId) {
        if (userId == null) {
            return List.of();
        }
        return paymentIdsByUser.getOrDefault(userId, List.of()).stream()
                .map(payments::get)
                .filter(Objects::nonNull)
                .toList();
    }
}
