package com.kyb.core.telemetry;

import java.util.Map;

/**
 * Fire-and-forget structured telemetry.
 * Emission must not block the caller; callers still guard against exceptions.
 */
public interface EventEmitter {

    /**
     * Emit a named event with key-value context (traceId, customerId, screen, ...).
     */
    void emitEvent(String eventName, Map<String, String> fields);

    /**
     * Emit a named error event.
     */
    void emitError(String eventName, Throwable error, Map<String, String> fields);

    /**
     * Emitter that discards everything.
     */
    static EventEmitter noop() {
        return new EventEmitter() {
            @Override
            public void emitEvent(String eventName, Map<String, String> fields) {
            }

            @Override
            public void emitError(String eventName, Throwable error, Map<String, String> fields) {
            }
        };
    }
}
