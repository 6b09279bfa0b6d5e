package com.chatastro.Payments.services;

import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * HMAC-SHA256 signing and verification for gateway payloads. Digests are lowercase hex, the
 * format the gateway uses for both checkout signatures and webhook headers.
 */
@Component
public class SignatureVerifier {

    private static final String HMAC_SHA256 = "HmacSHA256";

    public static String confirmationMessage(String orderId, String paymentId) {
        return orderId + "|" + paymentId;
    }

    public String sign(String secret, String message) {
        return sign(secret, message.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Signs {@code message} exactly as given; webhook bodies must be passed as received.
     */
    public String sign(String secret, byte[] message) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalStateException("Signing secret is not configured");
        }
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            return HexFormat.of().formatHex(mac.doFinal(message));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 is not available", e);
        }
    }

    public boolean verify(String secret, String message, String suppliedDigest) {
        if (message == null) {
            return false;
        }
        return verify(secret, message.getBytes(StandardCharsets.UTF_8), suppliedDigest);
    }

    /**
     * Constant-time comparison of the expected digest against {@code suppliedDigest}. A missing
     * secret, message or digest never verifies.
     */
    public boolean verify(String secret, byte[] message, String suppliedDigest) {
        if (secret == null || secret.isEmpty() || message == null
                || suppliedDigest == null || suppliedDigest.isBlank()) {
            return false;
        }
        byte[] expected = sign(secret, message).getBytes(StandardCharsets.US_ASCII);
        byte[] supplied = suppliedDigest.trim().getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, supplied);
    }
}
