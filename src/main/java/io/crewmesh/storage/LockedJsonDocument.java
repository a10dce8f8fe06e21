package io.crewmesh.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.crewmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A whole JSON document read, mutated and written back under one {@link AdvisoryLock}.
 *
 * <p>Writes go to a sibling temp file followed by a rename, so lock-free readers always see
 * either the previous or the next complete document.
 */
public final class LockedJsonDocument<T> {
    private final Path file;
    private final Path lockFile;
    private final TypeReference<T> type;
    private final Supplier<T> empty;
    private final Duration lockTimeout;

    public LockedJsonDocument(Path file, Path lockFile, TypeReference<T> type, Supplier<T> empty, Duration lockTimeout) {
        this.file = file;
        this.lockFile = lockFile;
        this.type = type;
        this.empty = empty;
        this.lockTimeout = lockTimeout;
    }

    public Path file() {
        return file;
    }

    public T read() {
        if (!Files.exists(file)) {
            return empty.get();
        }
        try {
            String raw = Files.readString(file, StandardCharsets.UTF_8);
            if (raw.isBlank()) {
                return empty.get();
            }
            T value = Jsons.mapper().readValue(raw, type);
            return value == null ? empty.get() : value;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read JSON document: " + file, e);
        }
    }

    /**
     * Applies {@code mutation} to the current document. The document is written back only when
     * the returned {@link Change} is dirty.
     */
    public <R> R update(Function<T, Change<R>> mutation) {
        try (AdvisoryLock ignored = AdvisoryLock.acquire(lockFile, lockTimeout)) {
            T document = read();
            Change<R> change = mutation.apply(document);
            if (change.dirty()) {
                write(document);
            }
            return change.value();
        }
    }

    public void write(T document) {
        writeAtomically(file, Jsons.toJson(document));
    }

    public static void writeAtomically(Path target, String content) {
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write file: " + target, e);
        }
    }

    public record Change<R>(R value, boolean dirty) {
        public static <R> Change<R> write(R value) {
            return new Change<>(value, true);
        }

        public static <R> Change<R> keep(R value) {
            return new Change<>(value, false);
        }
    }
}
