package com.kyb.engine.persistence.file;

import com.fasterxml.jackson.core.type.TypeReference;
import com.kyb.core.model.RecentCheckRecord;
import com.kyb.core.repository.RecentCheckRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recent-check history stored as one JSON array, most recent first.
 */
public class FileRecentCheckRepository implements RecentCheckRepository {

    static final String KEY = "recent_checks";

    private static final TypeReference<List<RecentCheckRecord>> RECORDS = new TypeReference<>() {};

    private final JsonFileStore store;

    public FileRecentCheckRepository(JsonFileStore store) {
        this.store = store;
    }

    @Override
    public synchronized void save(RecentCheckRecord record) {
        Objects.requireNonNull(record, "record");
        List<RecentCheckRecord> updated = new ArrayList<>(RecentCheckRepository.MAX_RECENT_CHECKS);
        updated.add(record);
        for (RecentCheckRecord existing : findRecent()) {
            if (updated.size() == MAX_RECENT_CHECKS) {
                break;
            }
            updated.add(existing);
        }
        store.write(KEY, updated);
    }

    @Override
    public synchronized List<RecentCheckRecord> findRecent() {
        List<RecentCheckRecord> stored = store.read(KEY, RECORDS).orElse(List.of());
        return stored.size() > MAX_RECENT_CHECKS
            ? List.copyOf(stored.subList(0, MAX_RECENT_CHECKS))
            : List.copyOf(stored);
    }

    @Override
    public synchronized void clear() {
        store.delete(KEY);
    }
}
