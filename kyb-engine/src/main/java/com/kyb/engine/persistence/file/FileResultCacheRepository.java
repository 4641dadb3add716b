package com.kyb.engine.persistence.file;

import com.fasterxml.jackson.core.type.TypeReference;
import com.kyb.core.model.CachedResult;
import com.kyb.core.repository.ResultCacheRepository;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Result cache that survives restarts. The in-memory slot is only swapped
 * after the file write succeeds.
 */
public class FileResultCacheRepository implements ResultCacheRepository {

    static final String KEY = "last_kyb_result";

    private final JsonFileStore store;
    private final AtomicReference<CachedResult> latest = new AtomicReference<>();

    public FileResultCacheRepository(JsonFileStore store) {
        this.store = store;
        store.read(KEY, new TypeReference<CachedResult>() {}).ifPresent(latest::set);
    }

    @Override
    public synchronized void store(CachedResult result) {
        Objects.requireNonNull(result, "result");
        store.write(KEY, result);
        latest.set(result);
    }

    @Override
    public Optional<CachedResult> findLatest() {
        return Optional.ofNullable(latest.get());
    }
}
