package com.kyb.api.lifecycle;

import com.kyb.engine.logging.LoggingContext;
import com.kyb.engine.service.DashboardService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Abandons the in-flight run when the application shuts down, so no
 * transition or storage write happens while beans are being destroyed.
 */
@Component
public class DashboardShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(DashboardShutdownHandler.class);

    private final DashboardService dashboardService;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public DashboardShutdownHandler(DashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        String traceId = dashboardService.currentTraceId().orElse(null);
        try (LoggingContext ignored = LoggingContext.forRun(traceId, null, "Shutdown")) {
            log.info("Shutting down dashboard; run phase {}", dashboardService.currentState().phase());
            dashboardService.cancelRun();
        }
    }
}
