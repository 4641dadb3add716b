package com.kyb.api.health;

import com.kyb.core.repository.RecentCheckRepository;
import com.kyb.core.repository.ResultCacheRepository;
import com.kyb.engine.service.DashboardService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Reports the run phase and whether local storage is readable.
 * A failed run is reported as a detail; the dashboard itself stays up.
 */
@Component
public class DashboardHealthIndicator implements HealthIndicator {

    private final DashboardService dashboardService;
    private final RecentCheckRepository recentCheckRepository;
    private final ResultCacheRepository resultCacheRepository;

    public DashboardHealthIndicator(
            DashboardService dashboardService,
            RecentCheckRepository recentCheckRepository,
            ResultCacheRepository resultCacheRepository) {
        this.dashboardService = dashboardService;
        this.recentCheckRepository = recentCheckRepository;
        this.resultCacheRepository = resultCacheRepository;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("runPhase", dashboardService.currentState().phase().name());
        dashboardService.currentTraceId().ifPresent(traceId -> details.put("traceId", traceId));

        try {
            details.put("recentChecks", recentCheckRepository.findRecent().size());
            details.put("cachedResult", resultCacheRepository.findLatest().isPresent());
            return Health.up()
                .withDetails(details)
                .build();
        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }
}
