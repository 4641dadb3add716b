package com.kyb.engine.persistence.file;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kyb.core.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Key-value store with one JSON document per key under a directory.
 *
 * Writes go to a temporary file that is then moved over the target, so a
 * reader sees either the previous document or the new one. A document that
 * cannot be parsed is treated as absent.
 */
public class JsonFileStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStore.class);

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonFileStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    public Path directory() {
        return directory;
    }

    public <T> Optional<T> read(String key, TypeReference<T> type) {
        Path file = pathFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new StorageException(key, e);
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(content, type));
        } catch (IOException e) {
            log.warn("Ignoring unreadable stored value {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public void write(String key, Object value) {
        Path file = pathFor(key);
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, key, ".tmp");
            try {
                objectMapper.writeValue(tmp.toFile(), value);
                move(tmp, file);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            log.error("Failed to write stored value {}: {}", key, e.getMessage());
            throw new StorageException(key, e);
        }
    }

    public void delete(String key) {
        try {
            Files.deleteIfExists(pathFor(key));
        } catch (IOException e) {
            throw new StorageException(key, e);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move unsupported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path pathFor(String key) {
        return directory.resolve(key + ".json");
    }
}
