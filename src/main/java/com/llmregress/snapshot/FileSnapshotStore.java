package com.llmregress.snapshot;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FileSnapshotStore implements SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(FileSnapshotStore.class);

    private final Path directory;
    private final boolean updateMode;
    private final ConcurrentHashMap<SnapshotKey, Object> locks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<SnapshotKey, String> cache = new ConcurrentHashMap<>();
    private final Set<SnapshotKey> dirty = ConcurrentHashMap.newKeySet();

    private FileSnapshotStore(Path directory, boolean updateMode) {
        this.directory = directory;
        this.updateMode = updateMode;
    }

    public static FileSnapshotStore open(Path directory, boolean updateMode) throws IOException {
        if (Files.exists(directory) && !Files.isDirectory(directory)) {
            throw new IOException("Snapshot path is not a directory: " + directory);
        }
        log.debug("snapshot.open dir={} updateMode={}", directory, updateMode);
        return new FileSnapshotStore(directory, updateMode);
    }

    @Override
    public Optional<String> get(SnapshotKey key) throws IOException {
        synchronized (lock(key)) {
            return Optional.ofNullable(loadLocked(key));
        }
    }

    @Override
    public Optional<String> putIfAbsent(SnapshotKey key, String value) throws IOException {
        synchronized (lock(key)) {
            String existing = loadLocked(key);
            if (existing != null) {
                return Optional.of(existing);
            }
            cache.put(key, value);
            dirty.add(key);
            return Optional.empty();
        }
    }

    @Override
    public void put(SnapshotKey key, String value) {
        if (!updateMode) {
            throw new IllegalStateException("snapshot " + key.fileName() + " can only be overwritten in update mode");
        }
        synchronized (lock(key)) {
            cache.put(key, value);
            dirty.add(key);
        }
    }

    @Override
    public boolean updateMode() {
        return updateMode;
    }

    @Override
    public void flush() throws IOException {
        if (dirty.isEmpty()) {
            return;
        }
        Files.createDirectories(directory);
        int written = 0;
        for (SnapshotKey key : List.copyOf(dirty)) {
            synchronized (lock(key)) {
                String value = cache.get(key);
                if (value != null && dirty.remove(key)) {
                    writeAtomically(directory.resolve(key.fileName()), value);
                    written++;
                }
            }
        }
        log.info("snapshot.flush dir={} written={}", directory, written);
    }

    public Path directory() {
        return directory;
    }

    private Object lock(SnapshotKey key) {
        return locks.computeIfAbsent(key, ignored -> new Object());
    }

    private String loadLocked(SnapshotKey key) throws IOException {
        String cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        Path file = directory.resolve(key.fileName());
        if (!Files.isRegularFile(file)) {
            return null;
        }
        String stored = Files.readString(file, StandardCharsets.UTF_8);
        cache.put(key, stored);
        return stored;
    }

    private void writeAtomically(Path target, String value) throws IOException {
        Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, value, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
