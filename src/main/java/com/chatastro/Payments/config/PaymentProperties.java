package com.chatastro.Payments.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "payments")
public class PaymentProperties {
    public static final String STORE_MEMORY = "memory";
    public static final String STORE_FIRESTORE = "firestore";
    public static final String GATEWAY_SIMULATED = "simulated";
    public static final String GATEWAY_RAZORPAY = "razorpay";

    private String currency = "INR";
    private String merchantName = "ChatAstro";
    private String imageUrl = "";
    private String themeColor = "#4a148c";
    private String store = STORE_MEMORY;
    private String gateway = GATEWAY_SIMULATED;
    private Map<String, PlanProperties> plans = new LinkedHashMap<>();

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public String getMerchantName() {
        return merchantName;
    }

    public void setMerchantName(String merchantName) {
        this.merchantName = merchantName;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public void setImageUrl(String imageUrl) {
        this.imageUrl = imageUrl;
    }

    public String getThemeColor() {
        return themeColor;
    }

    public void setThemeColor(String themeColor) {
        this.themeColor = themeColor;
    }

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public String getGateway() {
        return gateway;
    }

    public void setGateway(String gateway) {
        this.gateway = gateway;
    }

    public Map<String, PlanProperties> getPlans() {
        return plans;
    }

    public void setPlans(Map<String, PlanProperties> plans) {
        this.plans = plans;
    }

    public static class PlanProperties {
        private String name;
        private int questions;
        private long price;

        public PlanProperties() {}

        public PlanProperties(String name, int questions, long price) {
            this.name = name;
            this.questions = questions;
            this.price = price;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getQuestions() {
            return questions;
        }

        public void setQuestions(int questions) {
            this.questions = questions;
        }

        public long getPrice() {
            return price;
        }

        public void setPrice(long price) {
            this.price = price;
        }
    }
}
