package com.kyb.engine.persistence;

import com.kyb.core.model.RecentCheckRecord;
import com.kyb.core.model.RiskBand;
import com.kyb.core.repository.RecentCheckRepository;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InMemoryRecentCheckRepositoryTest {

    private final InMemoryRecentCheckRepository repository = new InMemoryRecentCheckRepository();

    @Test
    void newestRecordComesFirst() {
        repository.save(record("trace-1"));
        repository.save(record("trace-2"));

        assertThat(repository.findRecent())
            .extracting(RecentCheckRecord::traceId)
            .containsExactly("trace-2", "trace-1");
    }

    @Test
    void oldestRecordsAreDroppedBeyondCap() {
        for (int i = 1; i <= 15; i++) {
            repository.save(record("trace-" + i));
        }

        List<RecentCheckRecord> recent = repository.findRecent();
        assertThat(recent).hasSize(RecentCheckRepository.MAX_RECENT_CHECKS);
        assertThat(recent.get(0).traceId()).isEqualTo("trace-15");
        assertThat(recent.get(recent.size() - 1).traceId()).isEqualTo("trace-6");
    }

    @Test
    void clearRemovesHistory() {
        repository.save(record("trace-1"));

        repository.clear();

        assertThat(repository.findRecent()).isEmpty();
    }

    private static RecentCheckRecord record(String traceId) {
        return new RecentCheckRecord("CUST-0001", "ABC Exports Private Limited", RiskBand.GREEN,
            Instant.parse("2025-01-15T10:30:00Z"), traceId);
    }
}
