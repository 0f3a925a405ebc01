package com.llmregress.snapshot;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InMemorySnapshotStoreTest {

    @Test
    void shouldReturnExistingValueFromPutIfAbsent() {
        InMemorySnapshotStore store = new InMemorySnapshotStore();
        SnapshotKey key = new SnapshotKey("t", 1);

        assertEquals(Optional.empty(), store.putIfAbsent(key, "first"));
        assertEquals(Optional.of("first"), store.putIfAbsent(key, "second"));
        assertEquals(Optional.of("first"), store.get(key));
        assertThrows(IllegalStateException.class, () -> store.put(key, "third"));
    }
}
