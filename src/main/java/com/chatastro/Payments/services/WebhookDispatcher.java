package com.chatastro.Payments.services;

import com.chatastro.Payments.Entities.model.FailureDetail;
import com.chatastro.Payments.Entities.model.Order;
import com.chatastro.Payments.Entities.model.PaymentConfirmation;
import com.chatastro.Payments.config.RazorpayCredentials;
import com.chatastro.Payments.exception.InvalidWebhookSignatureException;
import com.chatastro.Payments.exception.MalformedWebhookPayloadException;
import com.chatastro.Payments.exception.OrderNotFoundException;
import com.chatastro.Payments.exception.PaymentConflictException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Authenticates gateway webhooks and routes them into {@link OrderLifecycle}.
 *
 * <p>The signature is checked over the body bytes exactly as received, before anything is
 * parsed. Authentic events that cannot be applied (unknown type, unknown order, order already
 * paid by another payment) are logged and acknowledged, since a redelivery would fail the
 * same way. Anything else that goes wrong propagates so the sender retries.
 */
@Service
@Slf4j
public class WebhookDispatcher {

    static final String PAYMENT_CAPTURED = "payment.captured";
    static final String PAYMENT_FAILED = "payment.failed";
    static final String ORDER_PAID = "order.paid";

    private final SignatureVerifier signatureVerifier;
    private final RazorpayCredentials credentials;
    private final OrderLifecycle orderLifecycle;
    private final ObjectMapper objectMapper;

    public WebhookDispatcher(SignatureVerifier signatureVerifier,
                             RazorpayCredentials credentials,
                             OrderLifecycle orderLifecycle,
                             ObjectMapper objectMapper) {
        this.signatureVerifier = signatureVerifier;
        this.credentials = credentials;
        this.orderLifecycle = orderLifecycle;
        this.objectMapper = objectMapper;
    }

    /**
     * @throws InvalidWebhookSignatureException when the signature header does not match the body
     * @throws MalformedWebhookPayloadException when an authentic body is not a usable event
     */
    public WebhookOutcome handle(byte[] rawBody, String signatureHeader) {
        if (!signatureVerifier.verify(credentials.getWebhookSecret(), rawBody, signatureHeader)) {
            log.warn("Rejected webhook with invalid signature | bytes={}", rawBody == null ? 0 : rawBody.length);
            throw new InvalidWebhookSignatureException();
        }

        JsonNode root = parse(rawBody);
        String event = text(root, "event");
        if (event == null) {
            throw new MalformedWebhookPayloadException("Webhook has no event type");
        }
        JsonNode payload = root.path("payload");

        try {
            switch (event) {
                case PAYMENT_CAPTURED:
                    return onPaymentCaptured(payload);
                case PAYMENT_FAILED:
                    return onPaymentFailed(payload);
                case ORDER_PAID:
                    return onOrderPaid(payload);
                default:
                    log.info("Unhandled webhook event: {}", event);
                    return WebhookOutcome.IGNORED;
            }
        } catch (OrderNotFoundException e) {
            log.warn("Webhook for unknown order | event={} | orderId={}", event, e.getOrderId());
            return WebhookOutcome.IGNORED;
        } catch (PaymentConflictException e) {
            log.warn("Webhook conflicts with recorded payment | event={} | {}", event, e.getMessage());
            return WebhookOutcome.IGNORED;
        }
    }

    private WebhookOutcome onPaymentCaptured(JsonNode payload) {
        JsonNode payment = payload.path("payment").path("entity");
        String orderId = required(payment, "order_id", PAYMENT_CAPTURED);
        String paymentId = required(payment, "id", PAYMENT_CAPTURED);

        PaymentConfirmation result = orderLifecycle.applyCapture(orderId, paymentId, text(payment, "method"));
        return result.isReplay() ? WebhookOutcome.DUPLICATE : WebhookOutcome.PROCESSED;
    }

    private WebhookOutcome onPaymentFailed(JsonNode payload) {
        JsonNode payment = payload.path("payment").path("entity");
        String orderId = required(payment, "order_id", PAYMENT_FAILED);

        FailureDetail failure = FailureDetail.builder()
                .code(text(payment, "error_code"))
                .description(text(payment, "error_description"))
                .source(text(payment, "error_source"))
                .reason(text(payment, "error_reason"))
                .build();

        Order order = orderLifecycle.markFailed(orderId, failure);
        return order.isPaid() ? WebhookOutcome.IGNORED : WebhookOutcome.PROCESSED;
    }

    private WebhookOutcome onOrderPaid(JsonNode payload) {
        JsonNode order = payload.path("order").path("entity");
        JsonNode payment = payload.path("payment").path("entity");

        String orderId = text(order, "id");
        if (orderId == null) {
            orderId = required(payment, "order_id", ORDER_PAID);
        }
        String paymentId = required(payment, "id", ORDER_PAID);

        PaymentConfirmation result = orderLifecycle.applyCapture(orderId, paymentId, text(payment, "method"));
        return result.isReplay() ? WebhookOutcome.DUPLICATE : WebhookOutcome.PROCESSED;
    }

    private JsonNode parse(byte[] rawBody) {
        try {
            JsonNode root = objectMapper.readTree(rawBody);
            if (root == null || !root.isObject()) {
                throw new MalformedWebhookPayloadException("Webhook body is not a JSON object");
            }
            return root;
        } catch (IOException e) {
            throw new MalformedWebhookPayloadException("Webhook body is not valid JSON", e);
        }
    }

    private static String required(JsonNode node, String field, String event) {
        String value = text(node, field);
        if (value == null) {
            throw new MalformedWebhookPayloadException(event + " webhook is missing " + field);
        }
        return value;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
