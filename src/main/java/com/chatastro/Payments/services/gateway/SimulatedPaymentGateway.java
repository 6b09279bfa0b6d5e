package com.chatastro.Payments.services.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Map;

/**
 * Offline stand-in for local runs and tests: answers with a generated order id and makes no
 * network call.
 */
@Component
@Slf4j
public class SimulatedPaymentGateway implements PaymentGateway {

    static final String PROVIDER_ID = "simulated";
    static final String ORDER_PREFIX = "sim_order_";

    private final SecureRandom random = new SecureRandom();

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public String createRemoteOrder(long amountMinorUnits, String currency, Map<String, String> metadata) {
        byte[] bytes = new byte[8];
        random.nextBytes(bytes);
        String remoteOrderId = ORDER_PREFIX + HexFormat.of().formatHex(bytes);
        log.info("Simulated gateway order | gatewayOrderId={} | receipt={} | amount={} {}",
                remoteOrderId, metadata.get("receipt"), amountMinorUnits, currency);
        return remoteOrderId;
    }
}
