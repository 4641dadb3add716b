package com.kyb.core.repository;

import com.kyb.core.model.CachedResult;

import java.util.Optional;

/**
 * Single-slot cache of the latest successful payload.
 * Readers observe either the previous or the new value, never a partial write.
 */
public interface ResultCacheRepository {

    /**
     * Replace the cached payload.
     */
    void store(CachedResult result);

    Optional<CachedResult> findLatest();

    /**
     * Find the cached payload if it belongs to the given trace.
     */
    default Optional<CachedResult> findByTraceId(String traceId) {
        return findLatest().filter(cached -> cached.belongsTo(traceId));
    }
}
