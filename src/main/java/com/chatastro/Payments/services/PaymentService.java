package com.chatastro.Payments.services;

import com.chatastro.Payments.Entities.CheckoutOrderResponse;
import com.chatastro.Payments.Entities.OrderRequest;
import com.chatastro.Payments.Entities.Plan;
import com.chatastro.Payments.Entities.model.Order;
import com.chatastro.Payments.Entities.model.UserDetails;
import com.chatastro.Payments.config.PaymentProperties;
import com.chatastro.Payments.config.RazorpayCredentials;
import com.chatastro.Payments.services.gateway.PaymentGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class PaymentService {

    private final PlanCatalog planCatalog;
    private final PaymentGateway paymentGateway;
    private final OrderLifecycle orderLifecycle;
    private final OrderIdGenerator orderIdGenerator;
    private final PaymentProperties properties;
    private final RazorpayCredentials credentials;

    public PaymentService(PlanCatalog planCatalog,
                          PaymentGateway paymentGateway,
                          OrderLifecycle orderLifecycle,
                          OrderIdGenerator orderIdGenerator,
                          PaymentProperties properties,
                          RazorpayCredentials credentials) {
        this.planCatalog = planCatalog;
        this.paymentGateway = paymentGateway;
        this.orderLifecycle = orderLifecycle;
        this.orderIdGenerator = orderIdGenerator;
        this.properties = properties;
        this.credentials = credentials;
    }

    /**
     * Creates the remote gateway order, stores the local order and returns what the client
     * needs to open checkout. The order is only stored once the gateway call succeeded.
     */
    public CheckoutOrderResponse createOrder(OrderRequest request) {
        if (request == null || request.getUserId() == null || request.getUserId().isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        Plan plan = planCatalog.require(request.getPlanType());
        UserDetails details = toUserDetails(request.getUserDetails());

        String orderId = orderIdGenerator.nextId();
        String currency = properties.getCurrency();

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("receipt", orderId);
        metadata.put("userId", request.getUserId());
        metadata.put("planType", plan.getId());
        metadata.put("userName", details.getName());
        metadata.put("userMobile", details.getContact());

        String gatewayOrderId = paymentGateway.createRemoteOrder(plan.getPriceMinorUnits(), currency, metadata);

        Order order = orderLifecycle.open(orderId, gatewayOrderId, request.getUserId(), plan, currency, details);

        log.info("Payment order created | orderId={} | gatewayOrderId={} | provider={} | amount={} | plan={} | userId={}",
                order.getId(), gatewayOrderId, paymentGateway.providerId(), order.getAmountMinorUnits(),
                plan.getName(), order.getUserId());

        return CheckoutOrderResponse.builder()
                .id(order.getId())
                .gatewayOrderId(order.getGatewayOrderId())
                .amount(order.getAmountMinorUnits())
                .currency(order.getCurrency())
                .key(credentials.getKeyId())
                .name(properties.getMerchantName())
                .description(plan.describe())
                .image(properties.getImageUrl())
                .prefill(CheckoutOrderResponse.Prefill.builder()
                        .name(request.getUserDetails() == null || request.getUserDetails().getName() == null
                                ? "" : request.getUserDetails().getName())
                        .contact(details.getContact())
                        .email(details.getEmail())
                        .build())
                .theme(CheckoutOrderResponse.Theme.builder().color(properties.getThemeColor()).build())
                .build();
    }

    public Plan getPlan(String planType) {
        return planCatalog.require(planType);
    }

    public List<Plan> getAllPlans() {
        return planCatalog.all();
    }

    private static UserDetails toUserDetails(OrderRequest.UserDetailsRequest request) {
        if (request == null) {
            return UserDetails.anonymous();
        }
        return UserDetails.of(request.getName(), request.getContact(), request.getEmail());
    }
}
