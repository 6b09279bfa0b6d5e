package com.chatastro.Payments.controller;

import com.chatastro.Payments.Entities.CheckoutOrderResponse;
import com.chatastro.Payments.Entities.OrderRequest;
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
import com.chatastro.Payments.exception.GatewayException;
import com.chatastro.Payments.exception.InvalidPlanException;
import com.chatastro.Payments.exception.InvalidSignatureException;
import com.chatastro.Payments.exception.PaymentConflictException;
import com.chatastro.Payments.exception.StoreUnavailableException;
import com.chatastro.Payments.services.OrderLifecycle;
import com.chatastro.Payments.services.PaymentService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = RazorPayController.class)
class RazorPayControllerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PaymentService paymentService;

    @MockBean
    private OrderLifecycle orderLifecycle;

    private static Order order(OrderStatus status, String paymentId) {
        return Order.builder()
                .id("order_abc")
                .gatewayOrderId("order_remote_1")
                .amountMinorUnits(29900)
                .currency("INR")
                .status(status)
                .attempts(paymentId == null ? 0 : 1)
                .createdAt(NOW)
                .userId("u1")
                .planType("standard")
                .userDetails(UserDetails.anonymous())
                .paymentId(paymentId)
                .build();
    }

    private static Payment payment(String method) {
        return Payment.builder()
                .id("pay_001")
                .orderId("order_abc")
                .amountMinorUnits(29900)
                .currency("INR")
                .status(PaymentStatus.CAPTURED)
                .method(method)
                .userId("u1")
                .planType("standard")
                .planName("Standard Plan")
                .questionCount(10)
                .source(PaymentSource.CLIENT_CONFIRMATION)
                .createdAt(NOW)
                .verifiedAt(NOW)
                .build();
    }

    @Test
    void createOrder_shouldReturnCheckoutDetails() throws Exception {
        when(paymentService.createOrder(any(OrderRequest.class))).thenReturn(CheckoutOrderResponse.builder()
                .id("order_abc")
                .gatewayOrderId("order_remote_1")
                .amount(29900)
                .currency("INR")
                .key("rzp_test_key")
                .build());

        mockMvc.perform(post("/api/payment/create-order")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u1\",\"planType\":\"standard\",\"userDetails\":{\"name\":\"Asha\",\"mobile\":\"9999999999\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.order.id").value("order_abc"))
                .andExpect(jsonPath("$.order.amount").value(29900))
                .andExpect(jsonPath("$.order.key").value("rzp_test_key"));

        ArgumentCaptor<OrderRequest> request = ArgumentCaptor.forClass(OrderRequest.class);
        verify(paymentService).createOrder(request.capture());
        assertEquals("9999999999", request.getValue().getUserDetails().getContact());
    }

    @Test
    void createOrder_shouldReturn400_forInvalidPlan() throws Exception {
        when(paymentService.createOrder(any(OrderRequest.class))).thenThrow(new InvalidPlanException("gold"));

        mockMvc.perform(post("/api/payment/create-order")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u1\",\"planType\":\"gold\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.retry").value("resubmit"));
    }

    @Test
    void createOrder_shouldReturn502_whenGatewayFails() throws Exception {
        when(paymentService.createOrder(any(OrderRequest.class))).thenThrow(new GatewayException("timeout"));

        mockMvc.perform(post("/api/payment/create-order")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u1\",\"planType\":\"standard\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.retry").value("retry"));
    }

    @Test
    void createOrder_shouldReturn400_forUnreadableBody() throws Exception {
        mockMvc.perform(post("/api/payment/create-order")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{oops"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.retry").value("resubmit"));
    }

    @Test
    void verify_shouldReturnPaymentAndOrder() throws Exception {
        when(orderLifecycle.confirmPayment("order_remote_1", "pay_001", "abc123"))
                .thenReturn(new PaymentConfirmation(order(OrderStatus.PAID, "pay_001"), payment(null), false));

        mockMvc.perform(post("/api/payment/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"razorpay_order_id\":\"order_remote_1\",\"razorpay_payment_id\":\"pay_001\",\"razorpay_signature\":\"abc123\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.payment.id").value("pay_001"))
                .andExpect(jsonPath("$.payment.amountMinorUnits").value(29900))
                .andExpect(jsonPath("$.order.status").value("paid"));
    }

    @Test
    void verify_shouldReturn400_forInvalidSignature() throws Exception {
        when(orderLifecycle.confirmPayment(anyString(), anyString(), anyString()))
                .thenThrow(new InvalidSignatureException("order_abc"));

        mockMvc.perform(post("/api/payment/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"razorpay_order_id\":\"order_abc\",\"razorpay_payment_id\":\"pay_001\",\"razorpay_signature\":\"forged\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid payment signature"))
                .andExpect(jsonPath("$.retry").value("do_not_retry"));
    }

    @Test
    void verify_shouldReturn409_whenOrderPaidByAnotherPayment() throws Exception {
        when(orderLifecycle.confirmPayment(anyString(), anyString(), anyString()))
                .thenThrow(new PaymentConflictException("order_abc", "pay_001", "pay_002"));

        mockMvc.perform(post("/api/payment/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"razorpay_order_id\":\"order_abc\",\"razorpay_payment_id\":\"pay_002\",\"razorpay_signature\":\"sig\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void verify_shouldReturn503_whenStoreUnavailable() throws Exception {
        when(orderLifecycle.confirmPayment(anyString(), anyString(), anyString()))
                .thenThrow(new StoreUnavailableException("Failed to load order", new RuntimeException("deadline")));

        mockMvc.perform(post("/api/payment/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"razorpay_order_id\":\"order_abc\",\"razorpay_payment_id\":\"pay_001\",\"razorpay_signature\":\"sig\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.retry").value("retry"));
    }

    @Test
    void failure_shouldRecordFailedAttempt() throws Exception {
        when(orderLifecycle.markFailed(eq("order_abc"), any(FailureDetail.class)))
                .thenReturn(order(OrderStatus.FAILED, null));

        mockMvc.perform(post("/api/payment/failure")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"orderId\":\"order_abc\",\"error\":{\"code\":\"BAD_REQUEST_ERROR\",\"description\":\"Card declined\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST_ERROR"));

        ArgumentCaptor<FailureDetail> failure = ArgumentCaptor.forClass(FailureDetail.class);
        verify(orderLifecycle).markFailed(eq("order_abc"), failure.capture());
        assertEquals("Card declined", failure.getValue().getDescription());
    }

    @Test
    void failure_shouldReturn400_withoutOrderId() throws Exception {
        mockMvc.perform(post("/api/payment/failure")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"error\":{\"code\":\"X\"}}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(orderLifecycle);
    }

    @Test
    void status_shouldReportUnknownMethod() throws Exception {
        when(orderLifecycle.getStatus("order_abc"))
                .thenReturn(Optional.of(new OrderSnapshot(order(OrderStatus.PAID, "pay_001"), payment(null))));

        mockMvc.perform(get("/api/payment/status/order_abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.order.status").value("paid"))
                .andExpect(jsonPath("$.order.amount").value(29900))
                .andExpect(jsonPath("$.payment.id").value("pay_001"))
                .andExpect(jsonPath("$.payment.method").value("unknown"));
    }

    @Test
    void status_shouldReturn404_forUnknownOrder() throws Exception {
        when(orderLifecycle.getStatus("order_missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/payment/status/order_missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.retry").value("do_not_retry"));
    }

    @Test
    void history_shouldReturnAmountsInMajorUnits() throws Exception {
        when(orderLifecycle.getHistory("u1")).thenReturn(List.of(payment("upi")));

        mockMvc.perform(get("/api/payment/history/u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value("pay_001"))
                .andExpect(jsonPath("$[0].amount").value(299.00))
                .andExpect(jsonPath("$[0].planName").value("Standard Plan"));
    }

    @Test
    void plans_shouldListCatalog() throws Exception {
        when(paymentService.getAllPlans()).thenReturn(List.of(
                new Plan("basic", 5, 199, "Basic Plan"),
                new Plan("standard", 10, 299, "Standard Plan")));
        when(paymentService.getPlan("gold")).thenThrow(new InvalidPlanException("gold"));

        mockMvc.perform(get("/api/payment/plans"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].price").value(299));

        mockMvc.perform(get("/api/payment/plans/gold"))
                .andExpect(status().isBadRequest());
    }
}
