package com.chatastro.Payments.services;

import com.chatastro.Payments.Entities.Plan;
import com.chatastro.Payments.Entities.model.Order;
import com.chatastro.Payments.Entities.model.UserDetails;
import com.chatastro.Payments.config.RazorpayCredentials;
import com.chatastro.Payments.store.InMemoryOrderStore;
import com.chatastro.Payments.store.InMemoryPaymentStore;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wires a real {@link OrderLifecycle} over in-memory stores.
 */
public class LifecycleFixture {

    public static final String KEY_SECRET = "test-key-secret";
    public static final String WEBHOOK_SECRET = "test-webhook-secret";

    public final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T10:00:00Z"));
    public final InMemoryOrderStore orderStore = new InMemoryOrderStore();
    public final InMemoryPaymentStore paymentStore = new InMemoryPaymentStore();
    public final SignatureVerifier signatureVerifier = new SignatureVerifier();
    public final RazorpayCredentials credentials = new RazorpayCredentials("rzp_test_key", KEY_SECRET, WEBHOOK_SECRET);
    public final PlanCatalog planCatalog = new PlanCatalog(defaultPlans());
    public final OrderIdGenerator orderIdGenerator = new OrderIdGenerator();
    public final OrderLifecycle lifecycle = new OrderLifecycle(
            orderStore, paymentStore, signatureVerifier, credentials, planCatalog, new OrderLocks(), clock);

    public static Map<String, Plan> defaultPlans() {
        Map<String, Plan> plans = new LinkedHashMap<>();
        plans.put("basic", new Plan("basic", 5, 199, "Basic Plan"));
        plans.put("standard", new Plan("standard", 10, 299, "Standard Plan"));
        plans.put("premium", new Plan("premium", 20, 399, "Premium Plan"));
        plans.put("report", new Plan("report", 0, 999, "Full Report"));
        return plans;
    }

    public Order openOrder(String userId, String planType) {
        return openOrder(userId, planType, null);
    }

    public Order openOrder(String userId, String planType, String gatewayOrderId) {
        return lifecycle.open(orderIdGenerator.nextId(), gatewayOrderId, userId,
                planCatalog.require(planType), "INR", UserDetails.of("Asha", "9999999999", "asha@example.com"));
    }

    public String confirmationSignature(String orderId, String paymentId) {
        return signatureVerifier.sign(KEY_SECRET, SignatureVerifier.confirmationMessage(orderId, paymentId));
    }
}
