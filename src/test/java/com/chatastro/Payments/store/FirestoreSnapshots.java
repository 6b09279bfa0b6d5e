package com.chatastro.Payments.store;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentSnapshot;

import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Snapshot mocks that answer typed getters from a stored document map, the way Firestore
 * reads back what a store wrote.
 */
final class FirestoreSnapshots {

    private FirestoreSnapshots() {}

    static <T extends DocumentSnapshot> T snapshotOf(Class<T> type, String id, Map<String, Object> data) {
        T doc = mock(type);
        when(doc.exists()).thenReturn(true);
        when(doc.getId()).thenReturn(id);
        when(doc.contains(anyString())).thenAnswer(inv -> data.get(inv.<String>getArgument(0)) != null);
        when(doc.getString(anyString())).thenAnswer(inv -> (String) data.get(inv.<String>getArgument(0)));
        when(doc.getLong(anyString())).thenAnswer(inv -> {
            Object value = data.get(inv.<String>getArgument(0));
            return value == null ? null : ((Number) value).longValue();
        });
        when(doc.getTimestamp(anyString())).thenAnswer(inv -> (Timestamp) data.get(inv.<String>getArgument(0)));
        return doc;
    }
}
