package com.kyb.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kyb.client.FixtureRiskCheckGateway;
import com.kyb.client.HttpRiskCheckGateway;
import com.kyb.core.gateway.RiskCheckGateway;
import com.kyb.core.json.KybJson;
import com.kyb.core.model.Customer;
import com.kyb.core.repository.CustomerRepository;
import com.kyb.core.repository.RecentCheckRepository;
import com.kyb.core.repository.ResultCacheRepository;
import com.kyb.core.repository.RiskDecisionRepository;
import com.kyb.core.repository.SessionPreferencesRepository;
import com.kyb.core.telemetry.EventEmitter;
import com.kyb.core.trace.TraceIdGenerator;
import com.kyb.core.trace.UuidTraceIdGenerator;
import com.kyb.engine.coordinator.DashboardWorkflowCoordinator;
import com.kyb.engine.coordinator.StepDelay;
import com.kyb.engine.metrics.KybRunMetrics;
import com.kyb.engine.persistence.InMemoryCustomerRepository;
import com.kyb.engine.persistence.InMemoryRecentCheckRepository;
import com.kyb.engine.persistence.InMemoryResultCacheRepository;
import com.kyb.engine.persistence.InMemoryRiskDecisionRepository;
import com.kyb.engine.persistence.InMemorySessionPreferencesRepository;
import com.kyb.engine.persistence.file.FileRecentCheckRepository;
import com.kyb.engine.persistence.file.FileResultCacheRepository;
import com.kyb.engine.persistence.file.FileSessionPreferencesRepository;
import com.kyb.engine.persistence.file.JsonFileStore;
import com.kyb.engine.service.CustomerDetailService;
import com.kyb.engine.telemetry.Slf4jEventEmitter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Composition root: builds the dashboard engine from configuration.
 */
@Configuration
@EnableConfigurationProperties(KybProperties.class)
public class DashboardConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DashboardConfiguration.class);

    // Wire and storage format stay independent of spring.jackson.* settings
    private final ObjectMapper kybObjectMapper = KybJson.newObjectMapper();

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EventEmitter eventEmitter() {
        return new Slf4jEventEmitter();
    }

    @Bean
    public TraceIdGenerator traceIdGenerator() {
        return new UuidTraceIdGenerator();
    }

    @Bean
    public KybRunMetrics kybRunMetrics(MeterRegistry meterRegistry) {
        return new KybRunMetrics(meterRegistry);
    }

    @Bean
    public CustomerRepository customerRepository(KybProperties properties) {
        List<Customer> customers = properties.getCustomers().stream()
            .map(entry -> new Customer(entry.getId(), entry.getName()))
            .toList();
        log.info("Loaded {} customers", customers.size());
        return new InMemoryCustomerRepository(customers);
    }

    @Bean
    public RiskDecisionRepository riskDecisionRepository() {
        return new InMemoryRiskDecisionRepository();
    }

    @Bean
    public RiskCheckGateway riskCheckGateway(KybProperties properties, EventEmitter eventEmitter) {
        KybProperties.Remote remote = properties.getRemote();
        if (remote.getMode() == KybProperties.Remote.Mode.FIXTURE) {
            log.info("KYB checks served from fixture {}", remote.getFixture());
            return new FixtureRiskCheckGateway(remote.getFixture(), kybObjectMapper);
        }
        log.info("KYB checks sent to {}", remote.getBaseUrl());
        return new HttpRiskCheckGateway(
            remote.getBaseUrl(),
            remote.getConnectTimeout(),
            remote.getRequestTimeout(),
            kybObjectMapper,
            eventEmitter);
    }

    @Bean
    public DashboardWorkflowCoordinator dashboardWorkflowCoordinator(
            KybProperties properties,
            CustomerRepository customerRepository,
            RecentCheckRepository recentCheckRepository,
            SessionPreferencesRepository preferencesRepository,
            ResultCacheRepository resultCacheRepository,
            RiskCheckGateway riskCheckGateway,
            TraceIdGenerator traceIdGenerator,
            EventEmitter eventEmitter,
            KybRunMetrics kybRunMetrics,
            Clock clock) {
        return DashboardWorkflowCoordinator.builder()
            .customerRepository(customerRepository)
            .recentCheckRepository(recentCheckRepository)
            .preferencesRepository(preferencesRepository)
            .resultCacheRepository(resultCacheRepository)
            .gateway(riskCheckGateway)
            .traceIdGenerator(traceIdGenerator)
            .eventEmitter(eventEmitter)
            .metrics(kybRunMetrics)
            .stepDelay(StepDelay.fixed(properties.getRun().getStepDelay()))
            .clock(clock)
            .build();
    }

    @Bean
    public CustomerDetailService customerDetailService(
            ResultCacheRepository resultCacheRepository,
            RiskDecisionRepository riskDecisionRepository,
            EventEmitter eventEmitter,
            Clock clock) {
        return new CustomerDetailService(
            resultCacheRepository, riskDecisionRepository, eventEmitter, kybObjectMapper, clock);
    }

    @Configuration
    @ConditionalOnProperty(prefix = "kyb.storage", name = "mode", havingValue = "MEMORY", matchIfMissing = true)
    static class MemoryStorageConfiguration {

        @Bean
        public RecentCheckRepository recentCheckRepository() {
            return new InMemoryRecentCheckRepository();
        }

        @Bean
        public SessionPreferencesRepository sessionPreferencesRepository() {
            return new InMemorySessionPreferencesRepository();
        }

        @Bean
        public ResultCacheRepository resultCacheRepository() {
            return new InMemoryResultCacheRepository();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "kyb.storage", name = "mode", havingValue = "FILE")
    static class FileStorageConfiguration {

        @Bean
        public JsonFileStore jsonFileStore(KybProperties properties) {
            Path directory = Path.of(properties.getStorage().getDirectory()).toAbsolutePath();
            log.info("Dashboard storage directory: {}", directory);
            return new JsonFileStore(directory, KybJson.newObjectMapper());
        }

        @Bean
        public RecentCheckRepository recentCheckRepository(JsonFileStore store) {
            return new FileRecentCheckRepository(store);
        }

        @Bean
        public SessionPreferencesRepository sessionPreferencesRepository(JsonFileStore store) {
            return new FileSessionPreferencesRepository(store);
        }

        @Bean
        public ResultCacheRepository resultCacheRepository(JsonFileStore store) {
            return new FileResultCacheRepository(store);
        }
    }
}
