package com.kyb.core.repository;

import com.kyb.core.model.RecentCheckRecord;

import java.util.List;

/**
 * Bounded history of successful checks, most recent first.
 */
public interface RecentCheckRepository {

    int MAX_RECENT_CHECKS = 10;

    /**
     * Prepend a record, dropping the oldest entries beyond {@link #MAX_RECENT_CHECKS}.
     *
     * @param record The record to save
     * @throws com.kyb.core.exception.StorageException if the history cannot be written
     */
    void save(RecentCheckRecord record);

    /**
     * Recent checks, most recent first, at most {@link #MAX_RECENT_CHECKS}.
     */
    List<RecentCheckRecord> findRecent();

    /**
     * Remove all history.
     */
    void clear();
}
