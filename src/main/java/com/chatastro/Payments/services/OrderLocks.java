package com.chatastro.Payments.services;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per order id, created on demand and dropped once nobody holds or waits for it.
 * Transitions of different orders never contend.
 */
@Component
public class OrderLocks {

    private final ConcurrentMap<String, LockEntry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String orderId, Supplier<T> action) {
        LockEntry entry = locks.compute(orderId, (id, existing) -> {
            LockEntry e = existing == null ? new LockEntry() : existing;
            e.users++;
            return e;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(orderId, (id, e) -> --e.users == 0 ? null : e);
        }
    }

    int activeLocks() {
        return locks.size();
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }
}
