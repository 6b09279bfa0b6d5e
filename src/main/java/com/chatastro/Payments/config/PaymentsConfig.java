package com.chatastro.Payments.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
@Slf4j
public class PaymentsConfig {

    @Value("${razorpay.key-id:}")
    private String keyId;

    @Value("${razorpay.key-secret:}")
    private String keySecret;

    @Value("${razorpay.webhook-secret:}")
    private String webhookSecret;

    @Bean
    public RazorpayCredentials razorpayCredentials() {
        RazorpayCredentials credentials = new RazorpayCredentials(keyId, keySecret, webhookSecret);
        if (credentials.getKeySecret().isBlank()) {
            log.warn("razorpay.key-secret is not set; payment confirmations will be rejected");
        }
        if (credentials.getWebhookSecret().isBlank()) {
            log.warn("razorpay.webhook-secret is not set; webhooks will be rejected");
        }
        return credentials;
    }

    /**
     * Ticks in microseconds, the precision Firestore stores timestamps with.
     */
    @Bean
    public Clock clock() {
        return Clock.tick(Clock.systemUTC(), Duration.ofNanos(1_000));
    }
}
