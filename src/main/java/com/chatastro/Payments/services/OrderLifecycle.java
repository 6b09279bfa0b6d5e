package com.chatastro.Payments.services;

import com.chatastro.Payments.Entities.Plan;
import com.chatastro.Payments.Entities.model.FailureDetail;
import com.chatastro.Payments.Entities.model.Order;
import com.chatastro.Payments.Entities.model.OrderSnapshot;
import com.chatastro.Payments.Entities.model.OrderStatus;
import com.chatastro.Payments.Entities.model.Payment;
import com.chatastro.Payments.Entities.model.PaymentConfirmation;
import com.chatastro.Payments.Entities.model.PaymentSource;
import com.chatastro.Payments.Entities.model.PaymentStatus;
import com.chatastro.Payments.Entities.model.UserDetails;
import com.chatastro.Payments.config.RazorpayCredentials;
import com.chatastro.Payments.exception.InvalidSignatureException;
import com.chatastro.Payments.exception.OrderNotFoundException;
import com.chatastro.Payments.exception.PaymentConflictException;
import com.chatastro.Payments.store.OrderStore;
import com.chatastro.Payments.store.PaymentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Order state machine.
 *
 * <pre>
 *   created --paid--> paid
 *   created --failed--> failed --paid--> paid
 *   failed --failed--> failed
 * </pre>
 *
 * A failure only reflects what the client or gateway reported for one attempt, so a failed
 * order can still be paid later. A paid order never changes again.
 *
 * <p>Transitions of one order run under that order's lock, re-read the stored order inside it
 * and write it back with a compare-and-swap, so concurrent confirmations and webhooks for the
 * same order produce exactly one payment, also across processes sharing a store.
 */
@Service
@Slf4j
public class OrderLifecycle {

    private final OrderStore orderStore;
    private final PaymentStore paymentStore;
    private final SignatureVerifier signatureVerifier;
    private final RazorpayCredentials credentials;
    private final PlanCatalog planCatalog;
    private final OrderLocks orderLocks;
    private final Clock clock;

    public OrderLifecycle(OrderStore orderStore,
                          PaymentStore paymentStore,
                          SignatureVerifier signatureVerifier,
                          RazorpayCredentials credentials,
                          PlanCatalog planCatalog,
                          OrderLocks orderLocks,
                          Clock clock) {
        this.orderStore = orderStore;
        this.paymentStore = paymentStore;
        this.signatureVerifier = signatureVerifier;
        this.credentials = credentials;
        this.planCatalog = planCatalog;
        this.orderLocks = orderLocks;
        this.clock = clock;
    }

    /**
     * Stores a new order in state {@code created}.
     */
    public Order open(String orderId, String gatewayOrderId, String userId, Plan plan, String currency, UserDetails userDetails) {
        Order order = Order.builder()
                .id(orderId)
                .gatewayOrderId(gatewayOrderId)
                .amountMinorUnits(plan.getPriceMinorUnits())
                .currency(currency)
                .status(OrderStatus.CREATED)
                .attempts(0)
                .createdAt(clock.instant())
                .userId(userId)
                .planType(plan.getId())
                .userDetails(userDetails == null ? UserDetails.anonymous() : userDetails)
                .build();
        orderStore.put(order);
        return order;
    }

    /**
     * Client path: authenticates {@code orderId|paymentId} with the key secret, then marks the
     * order paid. The identifiers are signed exactly as submitted, so either the local or the
     * gateway order id works as long as it is the one the signature was made for.
     *
     * @throws IllegalArgumentException when a field is missing
     * @throws OrderNotFoundException when no order matches {@code orderId}
     * @throws InvalidSignatureException when the signature does not match; nothing is written
     * @throws PaymentConflictException when the order was already paid by another payment
     */
    public PaymentConfirmation confirmPayment(String orderId, String paymentId, String signature) {
        if (isBlank(orderId) || isBlank(paymentId) || isBlank(signature)) {
            throw new IllegalArgumentException("Missing payment verification data");
        }

        Order order = resolve(orderId);

        String message = SignatureVerifier.confirmationMessage(orderId, paymentId);
        if (!signatureVerifier.verify(credentials.getKeySecret(), message, signature)) {
            log.warn("Payment signature mismatch | orderId={} | paymentId={}", order.getId(), paymentId);
            throw new InvalidSignatureException(order.getId());
        }

        return capture(order.getId(), paymentId, null, PaymentSource.CLIENT_CONFIRMATION);
    }

    /**
     * Webhook path: marks the order paid without a signature check. Callers must have
     * authenticated the event carrying {@code paymentId} already.
     */
    public PaymentConfirmation applyCapture(String orderReference, String paymentId, String method) {
        if (isBlank(paymentId)) {
            throw new IllegalArgumentException("Missing payment id");
        }
        Order order = resolve(orderReference);
        return capture(order.getId(), paymentId, method, PaymentSource.WEBHOOK);
    }

    /**
     * Records a failed attempt. A paid order is returned unchanged and the report is dropped.
     */
    public Order markFailed(String orderReference, FailureDetail failure) {
        Order resolved = resolve(orderReference);

        return orderLocks.withLock(resolved.getId(), () -> {
            while (true) {
                Order order = reload(resolved.getId());
                if (order.isPaid()) {
                    log.warn("Ignoring failure report for paid order | orderId={} | paymentId={} | error={}",
                            order.getId(), order.getPaymentId(), failure == null ? null : failure.getCode());
                    return order;
                }

                Order failed = order.toBuilder()
                        .status(OrderStatus.FAILED)
                        .attempts(order.getAttempts() + 1)
                        .failure(failure)
                        .failedAt(clock.instant())
                        .build();
                if (!orderStore.replace(order, failed)) {
                    log.debug("Order changed while recording failure, retrying | orderId={}", order.getId());
                    continue;
                }

                log.warn("Payment failed | orderId={} | attempts={} | error={} | user={}",
                        failed.getId(), failed.getAttempts(),
                        failure == null ? "Unknown error" : failure.describe(),
                        failed.getUserDetails().getName());
                return failed;
            }
        });
    }

    public Optional<OrderSnapshot> getStatus(String orderReference) {
        return find(orderReference).map(order -> new OrderSnapshot(
                order,
                order.getPaymentId() == null ? null : paymentStore.get(order.getPaymentId()).orElse(null)));
    }

    /**
     * @return the user's payments, most recent first; equal timestamps keep the later insert first
     */
    public List<Payment> getHistory(String userId) {
        List<Payment> payments = new ArrayList<>(paymentStore.listByUser(userId));
        Collections.reverse(payments);
        payments.sort(Comparator.comparing(Payment::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder())));
        return payments;
    }

    /**
     * The payment id is claimed before the order is swapped to paid, so a paid order always has
     * its payment record and no payment id ever serves two orders. The lock serializes callers in
     * this process; the store's compare-and-swap covers other processes sharing the backend.
     */
    private PaymentConfirmation capture(String orderId, String paymentId, String method, PaymentSource source) {
        return orderLocks.withLock(orderId, () -> {
            while (true) {
                Order order = reload(orderId);

                if (order.isPaid()) {
                    return replay(order, paymentId, source);
                }

                Payment payment = claim(order, paymentId, method, source);
                Order paid = order.toBuilder()
                        .status(OrderStatus.PAID)
                        .paymentId(paymentId)
                        .attempts(order.getAttempts() + 1)
                        .paidAt(payment.getVerifiedAt())
                        .build();

                if (orderStore.replace(order, paid)) {
                    log.info("Payment verified | orderId={} | paymentId={} | amount={} {} | source={} | previousStatus={}",
                            orderId, paymentId, paid.getAmountMinorUnits(), paid.getCurrency(),
                            source.getValue(), order.getStatus().getValue());
                    return new PaymentConfirmation(paid, payment, false);
                }

                Order current = reload(orderId);
                if (current.isPaid() && !paymentId.equals(current.getPaymentId())) {
                    paymentStore.remove(paymentId);
                }
                log.debug("Order changed during paid transition, retrying | orderId={} | paymentId={}", orderId, paymentId);
            }
        });
    }

    private PaymentConfirmation replay(Order order, String paymentId, PaymentSource source) {
        if (!paymentId.equals(order.getPaymentId())) {
            log.warn("Order already paid by another payment | orderId={} | existing={} | incoming={}",
                    order.getId(), order.getPaymentId(), paymentId);
            throw new PaymentConflictException(order.getId(), order.getPaymentId(), paymentId);
        }
        Payment existing = paymentStore.get(paymentId)
                .orElseThrow(() -> new IllegalStateException("Paid order " + order.getId() + " has no payment record"));
        log.info("Payment already verified | orderId={} | paymentId={} | source={}",
                order.getId(), paymentId, source.getValue());
        return new PaymentConfirmation(order, existing, true);
    }

    /**
     * Records the payment for {@code order}, or returns the record an earlier attempt for the
     * same order left behind.
     *
     * @throws PaymentConflictException when the payment id is already recorded for another order
     */
    private Payment claim(Order order, String paymentId, String method, PaymentSource source) {
        while (true) {
            Instant now = clock.instant();
            Optional<Plan> plan = planCatalog.find(order.getPlanType());
            Payment payment = Payment.builder()
                    .id(paymentId)
                    .orderId(order.getId())
                    .amountMinorUnits(order.getAmountMinorUnits())
                    .currency(order.getCurrency())
                    .status(PaymentStatus.CAPTURED)
                    .method(method)
                    .userId(order.getUserId())
                    .planType(order.getPlanType())
                    .planName(plan.map(Plan::getName).orElse(order.getPlanType()))
                    .questionCount(plan.map(Plan::getQuestions).orElse(0))
                    .source(source)
                    .createdAt(now)
                    .verifiedAt(now)
                    .build();
            if (paymentStore.add(payment)) {
                return payment;
            }

            Optional<Payment> existing = paymentStore.get(paymentId);
            if (existing.isEmpty()) {
                // withdrawn in between
                continue;
            }
            if (!order.getId().equals(existing.get().getOrderId())) {
                log.warn("Payment id already used by another order | orderId={} | paymentId={} | owner={}",
                        order.getId(), paymentId, existing.get().getOrderId());
                throw PaymentConflictException.paymentOfAnotherOrder(order.getId(), paymentId, existing.get().getOrderId());
            }
            return existing.get();
        }
    }

    private Optional<Order> find(String orderReference) {
        if (isBlank(orderReference)) {
            return Optional.empty();
        }
        return orderStore.get(orderReference).or(() -> orderStore.findByGatewayOrderId(orderReference));
    }

    private Order resolve(String orderReference) {
        return find(orderReference).orElseThrow(() -> new OrderNotFoundException(orderReference));
    }

    private Order reload(String orderId) {
        return orderStore.get(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
