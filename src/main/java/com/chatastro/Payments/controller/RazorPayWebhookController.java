package com.chatastro.Payments.controller;

import com.chatastro.Payments.services.WebhookDispatcher;
import com.chatastro.Payments.services.WebhookOutcome;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Receives gateway webhooks. The body is bound as raw bytes so the signature is checked
 * against exactly what was sent.
 */
@RestController
@RequestMapping("/api/payment")
public class RazorPayWebhookController {

    static final String SIGNATURE_HEADER = "X-Razorpay-Signature";

    @Autowired
    private WebhookDispatcher webhookDispatcher;

    @PostMapping("/webhook")
    public ResponseEntity<Map<String, Object>> handleWebhook(
            @RequestBody(required = false) byte[] body,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {
        WebhookOutcome outcome = webhookDispatcher.handle(body, signature);
        return ResponseEntity.ok(Map.of("success", true, "outcome", outcome));
    }
}
