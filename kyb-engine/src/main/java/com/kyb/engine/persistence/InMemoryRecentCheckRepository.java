package com.kyb.engine.persistence;

import com.kyb.core.model.RecentCheckRecord;
import com.kyb.core.repository.RecentCheckRepository;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * In-memory implementation of RecentCheckRepository.
 * For tests and sessions that do not need history across restarts.
 */
public class InMemoryRecentCheckRepository implements RecentCheckRepository {

    private final Deque<RecentCheckRecord> records = new ArrayDeque<>();

    @Override
    public synchronized void save(RecentCheckRecord record) {
        records.addFirst(Objects.requireNonNull(record, "record"));
        while (records.size() > MAX_RECENT_CHECKS) {
            records.removeLast();
        }
    }

    @Override
    public synchronized List<RecentCheckRecord> findRecent() {
        return List.copyOf(records);
    }

    @Override
    public synchronized void clear() {
        records.clear();
    }
}
