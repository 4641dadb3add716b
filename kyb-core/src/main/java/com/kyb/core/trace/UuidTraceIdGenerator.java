package com.kyb.core.trace;

import java.util.UUID;

/**
 * Random (v4) UUID trace ids.
 */
public class UuidTraceIdGenerator implements TraceIdGenerator {

    @Override
    public String generate() {
        return UUID.randomUUID().toString();
    }
}
