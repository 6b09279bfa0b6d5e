package com.chatastro.Payments.config;

/**
 * Gateway key id plus the two independent secrets: one signs client payment confirmations,
 * the other signs webhook bodies.
 */
public final class RazorpayCredentials {

    private final String keyId;
    private final String keySecret;
    private final String webhookSecret;

    public RazorpayCredentials(String keyId, String keySecret, String webhookSecret) {
        this.keyId = keyId == null ? "" : keyId;
        this.keySecret = keySecret == null ? "" : keySecret;
        this.webhookSecret = webhookSecret == null ? "" : webhookSecret;
    }

    public String getKeyId() {
        return keyId;
    }

    public String getKeySecret() {
        return keySecret;
    }

    public String getWebhookSecret() {
        return webhookSecret;
    }

    public boolean hasApiCredentials() {
        return !keyId.isBlank() && !keySecret.isBlank();
    }

    @Override
    public String toString() {
        return "RazorpayCredentials{keyId=" + keyId + ", keySecret=***, webhookSecret=***}";
    }
}
