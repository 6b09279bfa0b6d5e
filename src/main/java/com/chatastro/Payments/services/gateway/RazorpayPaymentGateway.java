package com.chatastro.Payments.services.gateway;

import com.chatastro.Payments.config.RazorpayCredentials;
import com.chatastro.Payments.exception.GatewayException;
import com.razorpay.RazorpayClient;
import com.razorpay.RazorpayException;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@Slf4j
public class RazorpayPaymentGateway implements PaymentGateway {

    static final String PROVIDER_ID = "razorpay";
    private static final int MAX_RECEIPT_LENGTH = 40;

    private final RazorpayCredentials credentials;

    public RazorpayPaymentGateway(RazorpayCredentials credentials) {
        this.credentials = credentials;
    }

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public String createRemoteOrder(long amountMinorUnits, String currency, Map<String, String> metadata) {
        if (!credentials.hasApiCredentials()) {
            throw new GatewayException("Razorpay API credentials are not configured");
        }
        try {
            RazorpayClient client = new RazorpayClient(credentials.getKeyId(), credentials.getKeySecret());

            JSONObject orderRequest = new JSONObject();
            orderRequest.put("amount", amountMinorUnits);
            orderRequest.put("currency", currency);

            String receipt = metadata.getOrDefault("receipt", "");
            orderRequest.put("receipt", receipt.length() > MAX_RECEIPT_LENGTH ? receipt.substring(0, MAX_RECEIPT_LENGTH) : receipt);
            orderRequest.put("payment_capture", 1);

            JSONObject notes = new JSONObject();
            for (Map.Entry<String, String> note : metadata.entrySet()) {
                notes.put(note.getKey(), note.getValue());
            }
            orderRequest.put("notes", notes);

            com.razorpay.Order order = client.orders.create(orderRequest);
            String remoteOrderId = order.get("id").toString();
            log.info("Razorpay order created | gatewayOrderId={} | receipt={} | amount={} {}",
                    remoteOrderId, receipt, amountMinorUnits, currency);
            return remoteOrderId;
        } catch (RazorpayException e) {
            throw new GatewayException("Failed to create Razorpay order: " + e.getMessage(), e);
        }
    }
}
