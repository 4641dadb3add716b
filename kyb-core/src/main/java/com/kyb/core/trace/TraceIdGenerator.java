package com.kyb.core.trace;

/**
 * Factory for globally unique trace ids, one per run.
 */
@FunctionalInterface
public interface TraceIdGenerator {

    String generate();
}
