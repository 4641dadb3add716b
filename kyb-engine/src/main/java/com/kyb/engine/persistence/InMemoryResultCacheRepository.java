package com.kyb.engine.persistence;

import com.kyb.core.model.CachedResult;
import com.kyb.core.repository.ResultCacheRepository;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-slot result cache. Each store swaps the whole entry atomically.
 */
public class InMemoryResultCacheRepository implements ResultCacheRepository {

    private final AtomicReference<CachedResult> latest = new AtomicReference<>();

    @Override
    public void store(CachedResult result) {
        latest.set(Objects.requireNonNull(result, "result"));
    }

    @Override
    public Optional<CachedResult> findLatest() {
        return Optional.ofNullable(latest.get());
    }
}
