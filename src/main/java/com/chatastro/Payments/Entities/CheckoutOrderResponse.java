package com.chatastro.Payments.Entities;

import lombok.Builder;
import lombok.Data;

/**
 * Everything the client needs to open the gateway checkout for a freshly created order.
 */
@Data
@Builder
public class CheckoutOrderResponse {
    private String id;
    private String gatewayOrderId;
    private long amount;
    private String currency;
    private String key;
    private String name;
    private String description;
    private String image;
    private Prefill prefill;
    private Theme theme;

    @Data
    @Builder
    public static class Prefill {
        private String name;
        private String contact;
        private String email;
    }

    @Data
    @Builder
    public static class Theme {
        private String color;
    }
}
