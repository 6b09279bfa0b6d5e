package com.chatastro.Payments.controller;

import com.chatastro.Payments.Entities.CheckoutOrderResponse;
import com.chatastro.Payments.Entities.OrderRequest;
import com.chatastro.Payments.Entities.PaymentFailureRequest;
import com.chatastro.Payments.Entities.PaymentHistoryEntry;
import com.chatastro.Payments.Entities.PaymentStatusResponse;
import com.chatastro.Payments.Entities.PaymentVerificationRequest;
import com.chatastro.Payments.Entities.Plan;
import com.chatastro.Payments.Entities.model.Order;
import com.chatastro.Payments.Entities.model.PaymentConfirmation;
import com.chatastro.Payments.exception.OrderNotFoundException;
import com.chatastro.Payments.services.OrderLifecycle;
import com.chatastro.Payments.services.PaymentService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/payment")
@CrossOrigin(origins = "*")
public class RazorPayController {

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private OrderLifecycle orderLifecycle;

    @PostMapping("/create-order")
    public ResponseEntity<Map<String, Object>> createOrder(@RequestBody OrderRequest orderRequest) {
        CheckoutOrderResponse order = paymentService.createOrder(orderRequest);
        return ResponseEntity.ok(Map.of("success", true, "order", order));
    }

    @PostMapping("/verify")
    public ResponseEntity<Map<String, Object>> verifyPayment(@RequestBody PaymentVerificationRequest verificationRequest) {
        PaymentConfirmation confirmation = orderLifecycle.confirmPayment(
                verificationRequest.getRazorpay_order_id(),
                verificationRequest.getRazorpay_payment_id(),
                verificationRequest.getRazorpay_signature());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "payment", confirmation.getPayment(),
                "order", confirmation.getOrder()));
    }

    @PostMapping("/failure")
    public ResponseEntity<Map<String, Object>> reportFailure(@RequestBody PaymentFailureRequest failureRequest) {
        if (failureRequest.getOrderId() == null || failureRequest.getOrderId().isBlank()) {
            throw new IllegalArgumentException("orderId is required");
        }
        Order order = orderLifecycle.markFailed(failureRequest.getOrderId(), failureRequest.toFailureDetail());

        Map<String, Object> body = new HashMap<>();
        body.put("success", false);
        body.put("status", order.getStatus());
        body.put("message", order.isPaid() ? "Order is already paid." : "Payment failed. Please try again.");
        body.put("error", failureRequest.getError());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/status/{orderId}")
    public ResponseEntity<PaymentStatusResponse> getPaymentStatus(@PathVariable String orderId) {
        return orderLifecycle.getStatus(orderId)
                .map(PaymentStatusResponse::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    @GetMapping("/history/{userId}")
    public ResponseEntity<List<PaymentHistoryEntry>> getUserPayments(@PathVariable String userId) {
        List<PaymentHistoryEntry> history = orderLifecycle.getHistory(userId).stream()
                .map(PaymentHistoryEntry::from)
                .toList();
        return ResponseEntity.ok(history);
    }

    @GetMapping("/plans")
    public ResponseEntity<List<Plan>> getAllPlans() {
        return ResponseEntity.ok(paymentService.getAllPlans());
    }

    @GetMapping("/plans/{planType}")
    public ResponseEntity<Plan> getPlan(@PathVariable String planType) {
        return ResponseEntity.ok(paymentService.getPlan(planType));
    }
}
