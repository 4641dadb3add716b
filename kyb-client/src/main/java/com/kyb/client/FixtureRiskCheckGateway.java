package com.kyb.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kyb.core.gateway.RiskCheckGateway;
import com.kyb.core.model.CheckOutcome;
import com.kyb.core.model.result.KybRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Offline gateway that answers every check with a bundled JSON payload.
 */
public class FixtureRiskCheckGateway implements RiskCheckGateway {

    private static final Logger log = LoggerFactory.getLogger(FixtureRiskCheckGateway.class);

    public static final String DEFAULT_RESOURCE = "fixtures/kyb-run-result.json";

    private final String resource;
    private final ObjectMapper objectMapper;
    private volatile KybRunResult cached;

    public FixtureRiskCheckGateway(ObjectMapper objectMapper) {
        this(DEFAULT_RESOURCE, objectMapper);
    }

    public FixtureRiskCheckGateway(String resource, ObjectMapper objectMapper) {
        this.resource = resource;
        this.objectMapper = objectMapper;
    }

    @Override
    public CheckOutcome runCheck(String customerId, String traceId) {
        try {
            KybRunResult result = load();
            log.debug("Serving fixture {} for customer {} (trace {})", resource, customerId, traceId);
            return CheckOutcome.success(result);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load fixture {}: {}", resource, e.getMessage());
            return CheckOutcome.failure(null, new RiskCheckException("Fixture unavailable: " + resource, e));
        }
    }

    private KybRunResult load() throws IOException {
        KybRunResult result = cached;
        if (result != null) {
            return result;
        }
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = FixtureRiskCheckGateway.class.getClassLoader();
        }
        try (InputStream input = loader.getResourceAsStream(resource)) {
            if (input == null) {
                throw new IOException("Resource not found: " + resource);
            }
            result = objectMapper.readValue(input, KybRunResult.class);
        }
        cached = result;
        return result;
    }
}
