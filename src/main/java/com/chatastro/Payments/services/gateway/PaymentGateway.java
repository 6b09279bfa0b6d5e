package com.chatastro.Payments.services.gateway;

import java.util.Map;

/**
 * Creates the remote order that the gateway checkout is opened against.
 */
public interface PaymentGateway {

    /** Provider identifier, e.g. "razorpay" or "simulated". */
    String providerId();

    /**
     * Network call to the provider; it is not retried here and must not run while an order lock
     * is held.
     *
     * @param amountMinorUnits amount in the smallest currency unit
     * @param metadata         free-form notes stored with the remote order; {@code receipt} holds the
     *                         local order id
     * @return the provider's order id
     * @throws com.chatastro.Payments.exception.GatewayException when the provider call fails
     */
    String createRemoteOrder(long amountMinorUnits, String currency, Map<String, String> metadata);
}
