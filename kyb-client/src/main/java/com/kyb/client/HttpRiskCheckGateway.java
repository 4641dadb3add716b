package com.kyb.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kyb.core.gateway.RiskCheckGateway;
import com.kyb.core.json.KybJson;
import com.kyb.core.model.CheckOutcome;
import com.kyb.core.model.result.KybRunResult;
import com.kyb.core.telemetry.EventEmitter;
import com.kyb.core.telemetry.EventNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs the KYB check against the remote service.
 *
 * Usage:
 * <pre>
 * RiskCheckGateway gateway = new HttpRiskCheckGateway("http://kyb-service:8080");
 * CheckOutcome outcome = gateway.runCheck("CUST-0001", traceId);
 * </pre>
 *
 * Sends {@code GET {baseUrl}/kyb/mcp/run/{customerId}} with the trace id in the
 * {@value #CORRELATION_HEADER} header. Never throws.
 */
public class HttpRiskCheckGateway implements RiskCheckGateway {

    private static final Logger log = LoggerFactory.getLogger(HttpRiskCheckGateway.class);

    public static final String CORRELATION_HEADER = "correlation-id";
    public static final String RUN_PATH = "/kyb/mcp/run/";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private static final String SCREEN = "RemoteDataSource";

    private final String baseUrl;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final EventEmitter eventEmitter;

    public HttpRiskCheckGateway(String baseUrl) {
        this(baseUrl, DEFAULT_TIMEOUT, DEFAULT_TIMEOUT, KybJson.newObjectMapper(), EventEmitter.noop());
    }

    public HttpRiskCheckGateway(
            String baseUrl,
            Duration connectTimeout,
            Duration requestTimeout,
            ObjectMapper objectMapper,
            EventEmitter eventEmitter) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .build();
        this.objectMapper = objectMapper;
        this.eventEmitter = eventEmitter;
    }

    @Override
    public CheckOutcome runCheck(String customerId, String traceId) {
        emit(EventNames.API_KYB_RUN_REQUEST, customerId, traceId, null);
        try {
            KybRunResult result = fetch(customerId, traceId);
            Map<String, String> extra = new LinkedHashMap<>();
            extra.put("riskBand", result.riskBand().name());
            if (result.riskAssessment() != null) {
                extra.put("score", String.valueOf(result.riskAssessment().score()));
            }
            emit(EventNames.API_KYB_RUN_SUCCESS, customerId, traceId, extra);
            return CheckOutcome.success(result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("KYB request for {} interrupted", customerId);
            return CheckOutcome.failure("Request interrupted", e);
        } catch (HttpTimeoutException e) {
            return failed(customerId, traceId, new RiskCheckException("KYB service timed out", e));
        } catch (IOException e) {
            return failed(customerId, traceId, new RiskCheckException(messageOf(e), e));
        } catch (RiskCheckException e) {
            return failed(customerId, traceId, e);
        } catch (RuntimeException e) {
            return failed(customerId, traceId, new RiskCheckException(messageOf(e), e));
        }
    }

    private KybRunResult fetch(String customerId, String traceId) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + RUN_PATH + encodePathSegment(customerId)))
            .timeout(requestTimeout)
            .header(CORRELATION_HEADER, traceId)
            .header("Accept", "application/json")
            .GET()
            .build();

        log.debug("GET {} [{}={}]", request.uri(), CORRELATION_HEADER, traceId);
        HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            log.warn("KYB service returned status {} for {}", response.statusCode(), customerId);
            throw new RiskCheckException("HTTP " + response.statusCode(), response.statusCode());
        }

        KybRunResult result = objectMapper.readValue(response.body(), KybRunResult.class);
        if (result == null) {
            throw new RiskCheckException("Empty response from KYB service", response.statusCode());
        }
        return result;
    }

    private CheckOutcome failed(String customerId, String traceId, RiskCheckException error) {
        log.warn("KYB check failed for {}: {}", customerId, error.getMessage());
        try {
            eventEmitter.emitError(EventNames.API_KYB_RUN_FAILED, error, fields(customerId, traceId, null));
        } catch (RuntimeException e) {
            log.warn("Telemetry error event {} failed: {}", EventNames.API_KYB_RUN_FAILED, e.getMessage());
        }
        return CheckOutcome.failure(error.getMessage(), error);
    }

    private void emit(String eventName, String customerId, String traceId, Map<String, String> extra) {
        try {
            eventEmitter.emitEvent(eventName, fields(customerId, traceId, extra));
        } catch (RuntimeException e) {
            log.warn("Telemetry event {} failed: {}", eventName, e.getMessage());
        }
    }

    private static Map<String, String> fields(String customerId, String traceId, Map<String, String> extra) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("traceId", traceId);
        fields.put("customerId", customerId);
        fields.put("screen", SCREEN);
        if (extra != null) {
            fields.putAll(extra);
        }
        return fields;
    }

    private static String encodePathSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String messageOf(Throwable error) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : CheckOutcome.DEFAULT_FAILURE_MESSAGE;
    }
}
