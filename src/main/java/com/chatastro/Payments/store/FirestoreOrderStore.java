package com.chatastro.Payments.store;

import com.chatastro.Payments.Entities.model.FailureDetail;
import com.chatastro.Payments.Entities.model.Order;
import com.chatastro.Payments.Entities.model.OrderStatus;
import com.chatastro.Payments.Entities.model.UserDetails;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QuerySnapshot;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static com.chatastro.Payments.store.FirestoreSupport.await;
import static com.chatastro.Payments.store.FirestoreSupport.instant;
import static com.chatastro.Payments.store.FirestoreSupport.longValue;
import static com.chatastro.Payments.store.FirestoreSupport.toTimestamp;

/**
 * Orders kept in the {@code payment_orders} collection, one document per local order id.
 * Nested values are flattened into top-level fields.
 */
public class FirestoreOrderStore implements OrderStore {

    static final String COLLECTION = "payment_orders";

    private final Firestore db;

    public FirestoreOrderStore(Firestore db) {
        this.db = db;
    }

    @Override
    public void put(Order order) {
        await(db.collection(COLLECTION).document(order.getId()).set(toDocument(order)), "save order " + order.getId());
    }

    /**
     * Runs in a Firestore transaction. The stored status and attempt count act as the version:
     * every transition changes the attempt count, so a match means nobody wrote in between.
     */
    @Override
    public boolean replace(Order expected, Order updated) {
        DocumentReference ref = db.collection(COLLECTION).document(expected.getId());
        return await(db.runTransaction(transaction -> {
            DocumentSnapshot current = transaction.get(ref).get();
            if (!current.exists() || !sameVersion(current, expected)) {
                return false;
            }
            transaction.set(ref, toDocument(updated));
            return true;
        }), "update order " + expected.getId());
    }

    @Override
    public Optional<Order> get(String orderId) {
        if (orderId == null) {
            return Optional.empty();
        }
        DocumentSnapshot snapshot = await(db.collection(COLLECTION).document(orderId).get(), "load order " + orderId);
        return snapshot.exists() ? Optional.of(fromDocument(snapshot)) : Optional.empty();
    }

    @Override
    public Optional<Order> findByGatewayOrderId(String gatewayOrderId) {
        if (gatewayOrderId == null) {
            return Optional.empty();
        }
        QuerySnapshot query = await(db.collection(COLLECTION)
                .whereEqualTo("gatewayOrderId", gatewayOrderId)
                .limit(1)
                .get(), "look up gateway order " + gatewayOrderId);
        if (query == null || query.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(fromDocument(query.getDocuments().get(0)));
    }

    private static boolean sameVersion(DocumentSnapshot current, Order expected) {
        return expected.getStatus().getValue().equals(current.getString("status"))
                && expected.getAttempts() == longValue(current, "attempts");
    }

    static Map<String, Object> toDocument(Order order) {
        Map<String, Object> data = new HashMap<>();
        data.put("orderId", order.getId());
        data.put("gatewayOrderId", order.getGatewayOrderId());
        data.put("amount", order.getAmountMinorUnits());
        data.put("currency", order.getCurrency());
        data.put("status", order.getStatus().getValue());
        data.put("attempts", order.getAttempts());
        data.put("createdAt", toTimestamp(order.getCreatedAt()));
        data.put("userId", order.getUserId());
        data.put("planType", order.getPlanType());
        UserDetails details = order.getUserDetails();
        if (details != null) {
            data.put("userName", details.getName());
            data.put("userContact", details.getContact());
            data.put("userEmail", details.getEmail());
        }
        data.put("paymentId", order.getPaymentId());
        data.put("paidAt", toTimestamp(order.getPaidAt()));
        FailureDetail failure = order.getFailure();
        if (failure != null) {
            data.put("errorCode", failure.getCode());
            data.put("errorDescription", failure.getDescription());
            data.put("errorSource", failure.getSource());
            data.put("errorReason", failure.getReason());
        }
        data.put("failedAt", toTimestamp(order.getFailedAt()));
        return data;
    }

    static Order fromDocument(DocumentSnapshot doc) {
        FailureDetail failure = null;
        if (doc.contains("errorCode") || doc.contains("errorDescription")) {
            failure = FailureDetail.builder()
                    .code(doc.getString("errorCode"))
                    .description(doc.getString("errorDescription"))
                    .source(doc.getString("errorSource"))
                    .reason(doc.getString("errorReason"))
                    .build();
        }
        return Order.builder()
                .id(doc.getId())
                .gatewayOrderId(doc.getString("gatewayOrderId"))
                .amountMinorUnits(longValue(doc, "amount"))
                .currency(doc.getString("currency"))
                .status(OrderStatus.fromValue(doc.getString("status")))
                .attempts((int) longValue(doc, "attempts"))
                .createdAt(instant(doc, "createdAt"))
                .userId(doc.getString("userId"))
                .planType(doc.getString("planType"))
                .userDetails(UserDetails.of(doc.getString("userName"), doc.getString("userContact"), doc.getString("userEmail")))
                .paymentId(doc.getString("paymentId"))
                .paidAt(instant(doc, "paidAt"))
                .failure(failure)
                .failedAt(instant(doc, "failedAt"))
                .build();
    }
}
