package com.kyb.api.health;

import com.kyb.core.exception.StorageException;
import com.kyb.core.model.RecentCheckRecord;
import com.kyb.core.repository.RecentCheckRepository;
import com.kyb.core.repository.ResultCacheRepository;
import com.kyb.engine.coordinator.DashboardWorkflowCoordinator;
import com.kyb.engine.coordinator.StepDelay;
import com.kyb.engine.persistence.InMemoryCustomerRepository;
import com.kyb.engine.persistence.InMemoryRecentCheckRepository;
import com.kyb.engine.persistence.InMemoryResultCacheRepository;
import com.kyb.engine.persistence.InMemorySessionPreferencesRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DashboardHealthIndicatorTest {

    private DashboardWorkflowCoordinator coordinator;

    @AfterEach
    void tearDown() {
        if (coordinator != null) {
            coordinator.close();
        }
    }

    @Test
    void reportsIdlePhaseAndEmptyStorage() {
        RecentCheckRepository history = new InMemoryRecentCheckRepository();
        ResultCacheRepository cache = new InMemoryResultCacheRepository();
        coordinator = coordinator(history, cache);

        Health health = new DashboardHealthIndicator(coordinator, history, cache).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
            .containsEntry("runPhase", "IDLE")
            .containsEntry("recentChecks", 0)
            .containsEntry("cachedResult", false)
            .doesNotContainKey("traceId");
    }

    @Test
    void unreadableHistoryReportsDown() {
        RecentCheckRepository history = new InMemoryRecentCheckRepository() {
            @Override
            public List<RecentCheckRecord> findRecent() {
                throw new StorageException("recent_checks", new IOException("disk gone"));
            }
        };
        ResultCacheRepository cache = new InMemoryResultCacheRepository();
        coordinator = coordinator(new InMemoryRecentCheckRepository(), cache);

        Health health = new DashboardHealthIndicator(coordinator, history, cache).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("runPhase", "IDLE").containsKey("error");
    }

    private static DashboardWorkflowCoordinator coordinator(
            RecentCheckRepository history, ResultCacheRepository cache) {
        return DashboardWorkflowCoordinator.builder()
            .customerRepository(new InMemoryCustomerRepository(List.of()))
            .recentCheckRepository(history)
            .preferencesRepository(new InMemorySessionPreferencesRepository())
            .resultCacheRepository(cache)
            .gateway((customerId, traceId) -> {
                throw new IllegalStateException("not called");
            })
            .stepDelay(StepDelay.none())
            .build();
    }
}
