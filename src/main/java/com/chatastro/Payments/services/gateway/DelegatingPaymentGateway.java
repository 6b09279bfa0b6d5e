package com.chatastro.Payments.services.gateway;

import com.chatastro.Payments.config.PaymentProperties;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
@Primary
public class DelegatingPaymentGateway implements PaymentGateway {

    private final PaymentGateway delegate;

    public DelegatingPaymentGateway(PaymentProperties properties,
                                    RazorpayPaymentGateway razorpayPaymentGateway,
                                    SimulatedPaymentGateway simulatedPaymentGateway) {
        String provider = properties.getGateway();
        if (PaymentProperties.GATEWAY_RAZORPAY.equalsIgnoreCase(provider)) {
            this.delegate = razorpayPaymentGateway;
        } else if (provider == null || PaymentProperties.GATEWAY_SIMULATED.equalsIgnoreCase(provider)) {
            this.delegate = simulatedPaymentGateway;
        } else {
            throw new IllegalStateException("Unknown payments.gateway: " + provider);
        }
    }

    @Override
    public String providerId() {
        return delegate.providerId();
    }

    @Override
    public String createRemoteOrder(long amountMinorUnits, String currency, Map<String, String> metadata) {
        return delegate.createRemoteOrder(amountMinorUnits, currency, metadata);
    }
}
