package com.kyb.engine.logging;

import org.slf4j.MDC;

/**
 * MDC helper so every log line of a run carries its trace id.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forRun(traceId, customerId, "Dashboard")) {
 *     log.info("Fetching result"); // includes traceId, customerId, screen
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TRACE_ID = "traceId";
    public static final String CUSTOMER_ID = "customerId";
    public static final String SCREEN = "screen";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for one KYB run.
     */
    public static LoggingContext forRun(String traceId, String customerId, String screen) {
        LoggingContext ctx = new LoggingContext();
        if (traceId != null) {
            MDC.put(TRACE_ID, traceId);
        }
        if (customerId != null) {
            MDC.put(CUSTOMER_ID, customerId);
        }
        if (screen != null) {
            MDC.put(SCREEN, screen);
        }
        return ctx;
    }

    /**
     * Create a logging context for a screen without an active run.
     */
    public static LoggingContext forScreen(String screen) {
        return forRun(null, null, screen);
    }

    @Override
    public void close() {
        MDC.remove(TRACE_ID);
        MDC.remove(CUSTOMER_ID);
        MDC.remove(SCREEN);
    }
}
