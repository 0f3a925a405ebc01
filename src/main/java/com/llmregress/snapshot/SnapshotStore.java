package com.llmregress.snapshot;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

public interface SnapshotStore extends Closeable {

    Optional<String> get(SnapshotKey key) throws IOException;

    /**
     * Stores {@code value} when no golden value exists yet.
     *
     * @return the value that was already stored, or empty when {@code value} was written
     */
    Optional<String> putIfAbsent(SnapshotKey key, String value) throws IOException;

    void put(SnapshotKey key, String value) throws IOException;

    boolean updateMode();

    void flush() throws IOException;

    @Override
    default void close() throws IOException {
        flush();
    }
}
