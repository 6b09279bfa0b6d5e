package com.chatastro.Payments.services;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Local order ids: {@code order_} followed by 128 random bits in hex. Ids carry no timestamp or
 * counter, so they cannot be guessed from one another.
 */
@Component
public class OrderIdGenerator {

    static final String PREFIX = "order_";
    private static final int RANDOM_BYTES = 16;

    private final SecureRandom random = new SecureRandom();

    public String nextId() {
        byte[] bytes = new byte[RANDOM_BYTES];
        random.nextBytes(bytes);
        return PREFIX + HexFormat.of().formatHex(bytes);
    }
}
