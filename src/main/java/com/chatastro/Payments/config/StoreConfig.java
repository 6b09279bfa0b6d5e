package com.chatastro.Payments.config;

import com.chatastro.Payments.store.FirestoreOrderStore;
import com.chatastro.Payments.store.FirestorePaymentStore;
import com.chatastro.Payments.store.InMemoryOrderStore;
import com.chatastro.Payments.store.InMemoryPaymentStore;
import com.chatastro.Payments.store.OrderStore;
import com.chatastro.Payments.store.PaymentStore;
import com.google.cloud.firestore.Firestore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the order and payment store backend from {@code payments.store}.
 */
@Configuration
public class StoreConfig {

    @Configuration
    @ConditionalOnProperty(name = "payments.store", havingValue = PaymentProperties.STORE_MEMORY, matchIfMissing = true)
    static class InMemoryStores {

        @Bean
        public OrderStore orderStore() {
            return new InMemoryOrderStore();
        }

        @Bean
        public PaymentStore paymentStore() {
            return new InMemoryPaymentStore();
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "payments.store", havingValue = PaymentProperties.STORE_FIRESTORE)
    static class FirestoreStores {

        @Bean
        public OrderStore orderStore(Firestore firestore) {
            return new FirestoreOrderStore(firestore);
        }

        @Bean
        public PaymentStore paymentStore(Firestore firestore) {
            return new FirestorePaymentStore(firestore);
        }
    }
}
