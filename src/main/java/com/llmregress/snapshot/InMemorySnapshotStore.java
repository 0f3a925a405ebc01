package com.llmregress.snapshot;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySnapshotStore implements SnapshotStore {
    private final ConcurrentHashMap<SnapshotKey, String> values = new ConcurrentHashMap<>();
    private final boolean updateMode;

    public InMemorySnapshotStore() {
        this(false);
    }

    public InMemorySnapshotStore(boolean updateMode) {
        this.updateMode = updateMode;
    }

    public InMemorySnapshotStore(Map<SnapshotKey, String> initial, boolean updateMode) {
        this(updateMode);
        values.putAll(initial);
    }

    @Override
    public Optional<String> get(SnapshotKey key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public Optional<String> putIfAbsent(SnapshotKey key, String value) {
        return Optional.ofNullable(values.putIfAbsent(key, value));
    }

    @Override
    public void put(SnapshotKey key, String value) {
        if (!updateMode) {
            throw new IllegalStateException("snapshot " + key + " can only be overwritten in update mode");
        }
        values.put(key, value);
    }

    @Override
    public boolean updateMode() {
        return updateMode;
    }

    @Override
    public void flush() {
    }

    public Map<SnapshotKey, String> snapshot() {
        return Map.copyOf(values);
    }
}
