package com.chatastro.Payments.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidPlanException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidPlan(InvalidPlanException ex) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getRetryPolicy());
    }

    @ExceptionHandler(OrderNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleOrderNotFound(OrderNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), ex.getRetryPolicy());
    }

    @ExceptionHandler(InvalidSignatureException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidSignature(InvalidSignatureException ex) {
        return build(HttpStatus.BAD_REQUEST, "Invalid payment signature", ex.getRetryPolicy());
    }

    @ExceptionHandler(InvalidWebhookSignatureException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidWebhookSignature(InvalidWebhookSignatureException ex) {
        return build(HttpStatus.UNAUTHORIZED, ex.getMessage(), ex.getRetryPolicy());
    }

    @ExceptionHandler(MalformedWebhookPayloadException.class)
    public ResponseEntity<Map<String, Object>> handleMalformedWebhook(MalformedWebhookPayloadException ex) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getRetryPolicy());
    }

    @ExceptionHandler(PaymentConflictException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(PaymentConflictException ex) {
        return build(HttpStatus.CONFLICT, ex.getMessage(), ex.getRetryPolicy());
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleStoreUnavailable(StoreUnavailableException ex) {
        log.error("Store unavailable: {}", ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), ex.getRetryPolicy());
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<Map<String, Object>> handleGateway(GatewayException ex) {
        log.error("Payment gateway call failed: {}", ex.getMessage(), ex);
        return build(HttpStatus.BAD_GATEWAY, ex.getMessage(), ex.getRetryPolicy());
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        String message = ex instanceof HttpMessageNotReadableException ? "Malformed request body" : ex.getMessage();
        return build(HttpStatus.BAD_REQUEST, message, RetryPolicy.RESUBMIT);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        log.error("Unhandled error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error", RetryPolicy.RETRYABLE);
    }

    private ResponseEntity<Map<String, Object>> build(HttpStatus status, String message, RetryPolicy retryPolicy) {
        Map<String, Object> body = new HashMap<>();
        body.put("success", false);
        body.put("status", status.value());
        body.put("message", message);
        body.put("retry", retryPolicy.getValue());
        body.put("timestamp", Instant.now().toString());
        return new ResponseEntity<>(body, status);
    }
}
