package com.kyb.engine.telemetry;

import com.kyb.core.telemetry.EventEmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Writes telemetry events as single structured log lines:
 * {@code eventName=KYB_RUN_STARTED traceId=... customerId=... screen=Dashboard}.
 *
 * Never throws; a formatting problem is logged and the event dropped.
 */
public class Slf4jEventEmitter implements EventEmitter {

    public static final String LOGGER_NAME = "KYB_APP";

    private final Logger eventLog;

    public Slf4jEventEmitter() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    Slf4jEventEmitter(Logger eventLog) {
        this.eventLog = eventLog;
    }

    @Override
    public void emitEvent(String eventName, Map<String, String> fields) {
        try {
            if (eventLog.isInfoEnabled()) {
                eventLog.info(format(eventName, fields, null));
            }
        } catch (RuntimeException e) {
            eventLog.warn("Dropped telemetry event {}", eventName, e);
        }
    }

    @Override
    public void emitError(String eventName, Throwable error, Map<String, String> fields) {
        try {
            if (error != null) {
                eventLog.error(format(eventName, fields, error), error);
            } else {
                eventLog.error(format(eventName, fields, null));
            }
        } catch (RuntimeException e) {
            eventLog.warn("Dropped telemetry error event {}", eventName, e);
        }
    }

    static String format(String eventName, Map<String, String> fields, Throwable error) {
        StringBuilder line = new StringBuilder("eventName=").append(eventName);
        if (fields != null) {
            fields.forEach((key, value) -> {
                if (value != null) {
                    line.append(' ').append(key).append('=').append(value);
                }
            });
        }
        if (error != null && error.getMessage() != null && (fields == null || !fields.containsKey("error"))) {
            line.append(" error=").append(error.getMessage());
        }
        return line.toString();
    }
}
