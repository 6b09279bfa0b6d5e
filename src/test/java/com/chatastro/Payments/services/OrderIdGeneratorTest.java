package com.chatastro.Payments.services;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class OrderIdGeneratorTest {

    private static final int THREADS = 8;
    private static final int IDS_PER_THREAD = 125_000;

    private final OrderIdGenerator generator = new OrderIdGenerator();

    @Test
    void nextId_shouldHavePrefixAnd128RandomBits() {
        String id = generator.nextId();

        assertTrue(id.matches("order_[0-9a-f]{32}"), id);
    }

    @Test
    void nextId_shouldNotCollideAcrossOneMillionConcurrentIds() throws Exception {
        // the first 64 random bits of each id are kept; distinct prefixes imply distinct ids
        long[] prefixes = new long[THREADS * IDS_PER_THREAD];
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                int offset = t * IDS_PER_THREAD;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < IDS_PER_THREAD; i++) {
                        String id = generator.nextId();
                        prefixes[offset + i] = Long.parseUnsignedLong(id.substring(6, 22), 16);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        Arrays.sort(prefixes);
        for (int i = 1; i < prefixes.length; i++) {
            assertNotEquals(prefixes[i - 1], prefixes[i], "collision at index " + i);
        }
    }
}
