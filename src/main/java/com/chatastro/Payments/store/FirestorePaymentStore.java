package com.chatastro.Payments.store;

import com.chatastro.Payments.Entities.model.Payment;
import com.chatastro.Payments.Entities.model.PaymentSource;
import com.chatastro.Payments.Entities.model.PaymentStatus;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QuerySnapshot;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.chatastro.Payments.store.FirestoreSupport.await;
import static com.chatastro.Payments.store.FirestoreSupport.instant;
import static com.chatastro.Payments.store.FirestoreSupport.longValue;
import static com.chatastro.Payments.store.FirestoreSupport.toTimestamp;

/**
 * Payments kept in the {@code payments} collection, keyed by gateway payment id.
 */
public class FirestorePaymentStore implements PaymentStore {

    static final String COLLECTION = "payments";

    private final Firestore db;

    public FirestorePaymentStore(Firestore db) {
        this.db = db;
    }

    @Override
    public boolean add(Payment payment) {
        DocumentReference ref = db.collection(COLLECTION).document(payment.getId());
        return await(db.runTransaction(transaction -> {
            if (transaction.get(ref).get().exists()) {
                return false;
            }
            transaction.create(ref, toDocument(payment));
            return true;
        }), "save payment " + payment.getId());
    }

    @Override
    public void remove(String paymentId) {
        await(db.collection(COLLECTION).document(paymentId).delete(), "remove payment " + paymentId);
    }

    @Override
    public Optional<Payment> get(String paymentId) {
        if (paymentId == null) {
            return Optional.empty();
        }
        DocumentSnapshot snapshot = await(db.collection(COLLECTION).document(paymentId).get(), "load payment " + paymentId);
        return snapshot.exists() ? Optional.of(fromDocument(snapshot)) : Optional.empty();
    }

    @Override
    public List<Payment> listByUser(String userId) {
        if (userId == null) {
            return List.of();
        }
        QuerySnapshot query = await(db.collection(COLLECTION).whereEqualTo("userId", userId).get(),
                "list payments of user " + userId);
        if (query == null || query.isEmpty()) {
            return List.of();
        }
        // Firestore keeps no insertion order, the write timestamp stands in for it
        return query.getDocuments().stream()
                .map(FirestorePaymentStore::fromDocument)
                .sorted(Comparator.comparing(Payment::getCreatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder())))
                .toList();
    }

    static Map<String, Object> toDocument(Payment payment) {
        Map<String, Object> data = new HashMap<>();
        data.put("paymentId", payment.getId());
        data.put("orderId", payment.getOrderId());
        data.put("amount", payment.getAmountMinorUnits());
        data.put("currency", payment.getCurrency());
        data.put("status", payment.getStatus().getValue());
        data.put("method", payment.getMethod());
        data.put("userId", payment.getUserId());
        data.put("planType", payment.getPlanType());
        data.put("planName", payment.getPlanName());
        data.put("questions", payment.getQuestionCount());
        data.put("source", payment.getSource().getValue());
        data.put("createdAt", toTimestamp(payment.getCreatedAt()));
        data.put("verifiedAt", toTimestamp(payment.getVerifiedAt()));
        return data;
    }

    static Payment fromDocument(DocumentSnapshot doc) {
        return Payment.builder()
                .id(doc.getId())
                .orderId(doc.getString("orderId"))
                .amountMinorUnits(longValue(doc, "amount"))
                .currency(doc.getString("currency"))
                .status(PaymentStatus.fromValue(doc.getString("status")))
                .method(doc.getString("method"))
                .userId(doc.getString("userId"))
                .planType(doc.getString("planType"))
                .planName(doc.getString("planName"))
                .questionCount((int) longValue(doc, "questions"))
                .source(PaymentSource.fromValue(doc.getString("source")))
                .createdAt(instant(doc, "createdAt"))
                .verifiedAt(instant(doc, "verifiedAt"))
                .build();
    }
}
