package com.chatastro.Payments.store;

import com.chatastro.Payments.exception.StoreUnavailableException;
import com.google.api.core.ApiFuture;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentSnapshot;

import java.time.Instant;
import java.util.concurrent.ExecutionException;

final class FirestoreSupport {

    private FirestoreSupport() {}

    static <T> T await(ApiFuture<T> future, String action) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted while trying to " + action, e);
        } catch (ExecutionException e) {
            throw new StoreUnavailableException("Firestore failed to " + action, e.getCause());
        }
    }

    // nanosecond precision, unlike Date
    static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano());
    }

    static Instant instant(DocumentSnapshot snapshot, String field) {
        Timestamp timestamp = snapshot.getTimestamp(field);
        return timestamp == null ? null : Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
    }

    static long longValue(DocumentSnapshot snapshot, String field) {
        Long value = snapshot.getLong(field);
        return value == null ? 0L : value;
    }
}
