package com.kyb.engine.coordinator;

import com.kyb.core.exception.InvalidRunTransitionException;
import com.kyb.core.gateway.RiskCheckGateway;
import com.kyb.core.listener.CompletionNavigator;
import com.kyb.core.listener.RunStateListener;
import com.kyb.core.model.CachedResult;
import com.kyb.core.model.CheckOutcome;
import com.kyb.core.model.Customer;
import com.kyb.core.model.NavigationTarget;
import com.kyb.core.model.RecentCheckRecord;
import com.kyb.core.model.RiskBand;
import com.kyb.core.model.RunPhase;
import com.kyb.core.model.RunState;
import com.kyb.core.model.WorkflowStep;
import com.kyb.core.model.result.KybRunResult;
import com.kyb.core.repository.CustomerRepository;
import com.kyb.core.repository.RecentCheckRepository;
import com.kyb.core.repository.ResultCacheRepository;
import com.kyb.core.repository.SessionPreferencesRepository;
import com.kyb.core.telemetry.EventEmitter;
import com.kyb.core.telemetry.EventNames;
import com.kyb.core.trace.TraceIdGenerator;
import com.kyb.core.trace.UuidTraceIdGenerator;
import com.kyb.engine.logging.LoggingContext;
import com.kyb.engine.metrics.KybRunMetrics;
import com.kyb.engine.service.DashboardService;
import com.kyb.engine.service.DashboardSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Workflow controller behind the dashboard. Owns the run state machine:
 * <pre>
 * Idle -> Running([]) -> Running([s1]) ... -> FetchingResult([s1..s6]) -> Completed | Failed
 * </pre>
 *
 * At most one run is in flight. Runs execute on a single dedicated thread;
 * every transition is published under one lock and only if the run that
 * produced it is still the current one, so a reset or cancelled run can never
 * write state, history or cache.
 */
public class DashboardWorkflowCoordinator implements DashboardService, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DashboardWorkflowCoordinator.class);

    static final String SCREEN = "Dashboard";
    static final String UNKNOWN_ERROR = "Unknown error";

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final CustomerRepository customerRepository;
    private final RecentCheckRepository recentCheckRepository;
    private final SessionPreferencesRepository preferencesRepository;
    private final ResultCacheRepository resultCacheRepository;
    private final RiskCheckGateway gateway;
    private final TraceIdGenerator traceIdGenerator;
    private final EventEmitter eventEmitter;
    private final KybRunMetrics metrics;
    private final StepDelay stepDelay;
    private final Clock clock;
    private final CompletionNavigator navigator;
    private final ExecutorService runExecutor;
    private final List<RunStateListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();

    // Guarded by lock
    private RunState state = RunState.idle();
    private RunTicket activeRun;
    private Future<?> activeTask;
    private long generation;
    private boolean completionDelivered;

    private volatile String selectedCustomerId;

    private DashboardWorkflowCoordinator(Builder builder) {
        this.customerRepository = Objects.requireNonNull(builder.customerRepository, "customerRepository");
        this.recentCheckRepository = Objects.requireNonNull(builder.recentCheckRepository, "recentCheckRepository");
        this.preferencesRepository = Objects.requireNonNull(builder.preferencesRepository, "preferencesRepository");
        this.resultCacheRepository = Objects.requireNonNull(builder.resultCacheRepository, "resultCacheRepository");
        this.gateway = Objects.requireNonNull(builder.gateway, "gateway");
        this.traceIdGenerator = builder.traceIdGenerator;
        this.eventEmitter = builder.eventEmitter;
        this.metrics = builder.metrics;
        this.stepDelay = builder.stepDelay;
        this.clock = builder.clock;
        this.navigator = builder.navigator;
        this.runExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "kyb-run-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Dashboard ==========

    @Override
    public DashboardSnapshot enterDashboard() {
        selectedCustomerId = null;
        try (LoggingContext ignored = LoggingContext.forScreen(SCREEN)) {
            try {
                List<Customer> customers = customerRepository.findAll();
                List<RecentCheckRecord> recent = recentCheckRepository.findRecent();
                emit(EventNames.DASHBOARD_LOADED, fields(currentTraceId().orElse(null), null,
                    "customers", String.valueOf(customers.size()),
                    "recentChecks", String.valueOf(recent.size())));
                return snapshotOf(customers, recent, null);
            } catch (RuntimeException e) {
                log.error("Failed to load dashboard: {}", e.getMessage(), e);
                emitError(EventNames.DASHBOARD_LOAD_FAILED, e, fields(null, null));
                return snapshotOf(List.of(), List.of(), messageOf(e, UNKNOWN_ERROR));
            }
        }
    }

    @Override
    public DashboardSnapshot snapshot() {
        try {
            return snapshotOf(customerRepository.findAll(), recentCheckRepository.findRecent(), null);
        } catch (RuntimeException e) {
            log.error("Failed to read dashboard data: {}", e.getMessage(), e);
            return snapshotOf(List.of(), List.of(), messageOf(e, UNKNOWN_ERROR));
        }
    }

    @Override
    public boolean selectCustomer(String customerId) {
        if (customerId == null || customerId.isBlank()) {
            log.warn("Ignoring selection of blank customer id");
            emit(EventNames.CUSTOMER_SELECTION_REJECTED, fields(null, customerId, "reason", "blank"));
            return false;
        }
        Optional<Customer> customer;
        try {
            customer = customerRepository.findById(customerId);
        } catch (RuntimeException e) {
            log.error("Customer lookup failed for {}: {}", customerId, e.getMessage(), e);
            emitError(EventNames.CUSTOMER_SELECTION_REJECTED, e, fields(null, customerId));
            return false;
        }
        if (customer.isEmpty()) {
            log.warn("Ignoring selection of unknown customer {}", customerId);
            emit(EventNames.CUSTOMER_SELECTION_REJECTED, fields(null, customerId, "reason", "unknown"));
            return false;
        }
        selectedCustomerId = customerId;
        log.debug("Selected customer {}", customerId);
        emit(EventNames.CUSTOMER_SELECTED, fields(currentTraceId().orElse(null), customerId));
        return true;
    }

    @Override
    public Optional<String> selectedCustomerId() {
        return Optional.ofNullable(selectedCustomerId);
    }

    @Override
    public List<RecentCheckRecord> recentChecks() {
        return recentCheckRepository.findRecent();
    }

    @Override
    public Optional<String> lastRunCustomerId() {
        try {
            return preferencesRepository.findSelectedCustomerId();
        } catch (RuntimeException e) {
            log.warn("Could not read last run customer: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // ========== Run lifecycle ==========

    @Override
    public boolean startRun() {
        String customerId = selectedCustomerId;
        if (customerId == null) {
            log.debug("Start ignored: no customer selected");
            metrics.runRejected("no_selection");
            return false;
        }

        synchronized (lock) {
            if (state.phase() != RunPhase.IDLE) {
                log.info("Start ignored: run {} is {}", traceIdOf(activeRun), state.phase());
                metrics.runRejected("not_idle");
                emit(EventNames.KYB_RUN_REJECTED, fields(traceIdOf(activeRun), customerId,
                    "phase", state.phase().name()));
                return false;
            }

            generation++;
            completionDelivered = false;

            String traceId;
            try {
                traceId = traceIdGenerator.generate();
            } catch (RuntimeException e) {
                log.error("Failed to mint trace id for customer {}", customerId, e);
                activeRun = new RunTicket(generation, null, customerId, clock.instant());
                failRun(activeRun, EventNames.KYB_RUN_FAILED, e);
                return true;
            }

            RunTicket ticket = new RunTicket(generation, traceId, customerId, clock.instant());
            activeRun = ticket;

            try (LoggingContext ignored = LoggingContext.forRun(traceId, customerId, SCREEN)) {
                log.info("Starting KYB run for customer {}", customerId);
                try {
                    preferencesRepository.saveSelectedCustomerId(customerId);
                    transition(RunState.running(List.of()));
                    activeTask = runExecutor.submit(() -> execute(ticket));
                } catch (RejectedExecutionException e) {
                    log.error("Run executor is shut down; cannot start run");
                    failRun(ticket, EventNames.KYB_RUN_FAILED, e);
                    return true;
                } catch (RuntimeException e) {
                    failRun(ticket, EventNames.KYB_RUN_FAILED, e);
                    return true;
                }
                metrics.runStarted();
                emit(EventNames.KYB_RUN_STARTED, fields(traceId, customerId));
            }
            return true;
        }
    }

    @Override
    public void resetRun() {
        RunState previous;
        String traceId;
        String customerId;
        synchronized (lock) {
            previous = state;
            traceId = traceIdOf(activeRun);
            customerId = activeRun != null ? activeRun.customerId() : null;
            if (previous.phase().isInFlight() && abandonActiveTask()) {
                metrics.runCancelled();
            } else {
                generation++;
            }
            activeRun = null;
            activeTask = null;
            completionDelivered = false;
            if (previous.phase() != RunPhase.IDLE) {
                transition(RunState.idle());
            }
        }
        if (previous.phase() != RunPhase.IDLE) {
            log.info("Run {} reset from {}", traceId, previous.phase());
            emit(EventNames.KYB_RUN_RESET, fields(traceId, customerId, "from", previous.phase().name()));
        }
    }

    @Override
    public void cancelRun() {
        String traceId;
        String customerId;
        synchronized (lock) {
            if (!state.phase().isInFlight() || !abandonActiveTask()) {
                return;
            }
            traceId = traceIdOf(activeRun);
            customerId = activeRun != null ? activeRun.customerId() : null;
        }
        metrics.runCancelled();
        log.info("Run {} cancelled; state left at {}", traceId, currentState().phase());
        emit(EventNames.KYB_RUN_CANCELLED, fields(traceId, customerId));
    }

    /**
     * Cancel any in-flight run and stop the run thread.
     */
    @Override
    public void close() {
        cancelRun();
        runExecutor.shutdownNow();
        try {
            if (!runExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Run thread did not stop within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping run thread");
        }
    }

    @Override
    public RunState currentState() {
        synchronized (lock) {
            return state;
        }
    }

    @Override
    public Optional<String> currentTraceId() {
        synchronized (lock) {
            return Optional.ofNullable(traceIdOf(activeRun));
        }
    }

    @Override
    public Optional<NavigationTarget> consumeCompletionForNavigation() {
        NavigationTarget target;
        synchronized (lock) {
            target = takeCompletion();
        }
        if (target == null) {
            return Optional.empty();
        }
        emit(EventNames.NAVIGATION_SIGNALLED, fields(target.traceId(), target.customerId(),
            "riskBand", target.riskBand().name()));
        return Optional.of(target);
    }

    @Override
    public Optional<NavigationTarget> consumeCompletionAndReset() {
        NavigationTarget target;
        synchronized (lock) {
            target = takeCompletion();
            if (target == null) {
                return Optional.empty();
            }
            resetRun();
        }
        emit(EventNames.NAVIGATION_SIGNALLED, fields(target.traceId(), target.customerId(),
            "riskBand", target.riskBand().name()));
        return Optional.of(target);
    }

    // Caller holds lock
    private NavigationTarget takeCompletion() {
        if (completionDelivered || activeRun == null || !(state instanceof RunState.Completed)) {
            return null;
        }
        RunState.Completed completed = (RunState.Completed) state;
        completionDelivered = true;
        return new NavigationTarget(activeRun.customerId(), completed.traceId(), completed.riskBand());
    }

    @Override
    public void addListener(RunStateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeListener(RunStateListener listener) {
        listeners.remove(listener);
    }

    // ========== Run execution ==========

    private void execute(RunTicket ticket) {
        try (LoggingContext ignored = LoggingContext.forRun(ticket.traceId(), ticket.customerId(), SCREEN)) {
            List<WorkflowStep> completed = new ArrayList<>();
            for (WorkflowStep step : WorkflowStep.canonicalOrder()) {
                long stepStart = System.nanoTime();
                stepDelay.await(step);
                completed.add(step);
                RunState next = step.isLast()
                    ? RunState.fetchingResult(completed)
                    : RunState.running(completed);
                if (!publish(ticket, next)) {
                    log.debug("Run superseded at step {}", step);
                    return;
                }
                metrics.stepCompleted(step, Duration.ofNanos(System.nanoTime() - stepStart));
                emit(EventNames.WORKFLOW_STEP_COMPLETED, fields(ticket.traceId(), ticket.customerId(),
                    "step", step.displayName()));
            }

            if (!stillCurrent(ticket)) {
                log.debug("Run superseded before remote call");
                return;
            }

            long callStart = System.nanoTime();
            CheckOutcome outcome = gateway.runCheck(ticket.customerId(), ticket.traceId());
            Duration callDuration = Duration.ofNanos(System.nanoTime() - callStart);

            if (outcome instanceof CheckOutcome.Success success) {
                metrics.remoteCallCompleted(true, callDuration);
                completeRun(ticket, success.result());
            } else if (outcome instanceof CheckOutcome.Failure failure) {
                metrics.remoteCallCompleted(false, callDuration);
                failFetch(ticket, failure);
            } else {
                throw new IllegalStateException("Risk check gateway returned no outcome");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Run {} interrupted; no further transitions", ticket.traceId());
        } catch (RuntimeException e) {
            log.error("Run {} failed unexpectedly: {}", ticket.traceId(), e.getMessage(), e);
            failRun(ticket, EventNames.KYB_RUN_FAILED, e);
        }
    }

    private void completeRun(RunTicket ticket, KybRunResult result) {
        RiskBand band = result.riskBand();
        synchronized (lock) {
            if (!isCurrent(ticket)) {
                log.debug("Dropping result of superseded run");
                return;
            }
            Instant now = clock.instant();
            String customerName = result.displayName(customerNameOf(ticket.customerId()));
            List<RecentCheckRecord> previousHistory = recentCheckRepository.findRecent();
            recentCheckRepository.save(new RecentCheckRecord(
                ticket.customerId(), customerName, band, now, ticket.traceId()));
            try {
                resultCacheRepository.store(new CachedResult(ticket.traceId(), ticket.customerId(), result, now));
            } catch (RuntimeException e) {
                restoreHistory(previousHistory, e);
                throw e;
            }
            emit(EventNames.SAVE_RECENT_CHECK, fields(ticket.traceId(), ticket.customerId(),
                "riskBand", band.name()));
            transition(RunState.completed(ticket.traceId(), band));
        }

        log.info("KYB run completed with risk band {}", band);
        metrics.runCompleted(band, elapsedSince(ticket));
        emit(EventNames.KYB_RUN_COMPLETED, fields(ticket.traceId(), ticket.customerId(),
            "riskBand", band.name()));

        if (navigator != null) {
            consumeCompletionForNavigation().ifPresent(this::navigate);
        }
    }

    // Caller holds lock
    private void restoreHistory(List<RecentCheckRecord> previous, RuntimeException cause) {
        log.warn("Result cache write failed; restoring {} history records", previous.size());
        try {
            recentCheckRepository.clear();
            for (int i = previous.size() - 1; i >= 0; i--) {
                recentCheckRepository.save(previous.get(i));
            }
        } catch (RuntimeException e) {
            log.error("Could not restore history after cache failure: {}", e.getMessage(), e);
            cause.addSuppressed(e);
        }
    }

    private void failFetch(RunTicket ticket, CheckOutcome.Failure failure) {
        synchronized (lock) {
            if (!isCurrent(ticket) || state.isTerminal()) {
                return;
            }
            transition(RunState.failed(failure.message()));
        }
        log.warn("KYB data fetch failed: {}", failure.message());
        metrics.runFailed("fetch", elapsedSince(ticket));
        emitError(EventNames.KYB_DATA_FETCH_FAILED, failure.cause(),
            fields(ticket.traceId(), ticket.customerId(), "error", failure.message()));
    }

    private void failRun(RunTicket ticket, String eventName, RuntimeException error) {
        String message = messageOf(error, UNKNOWN_ERROR);
        synchronized (lock) {
            if (!isCurrent(ticket) || state.isTerminal()) {
                return;
            }
            transition(RunState.failed(message));
        }
        metrics.runFailed(error.getClass().getSimpleName(), elapsedSince(ticket));
        emitError(eventName, error, fields(ticket.traceId(), ticket.customerId(), "error", message));
    }

    private void navigate(NavigationTarget target) {
        try {
            navigator.onRunCompleted(target);
        } catch (RuntimeException e) {
            log.error("Completion navigator failed for run {}: {}", target.traceId(), e.getMessage(), e);
            emitError(EventNames.KYB_RUN_FAILED, e, fields(target.traceId(), target.customerId(),
                "stage", "navigation"));
        }
    }

    /**
     * Publish a transition on behalf of a run.
     *
     * @return false if the run is no longer current and must stop
     */
    private boolean publish(RunTicket ticket, RunState next) {
        synchronized (lock) {
            if (!isCurrent(ticket)) {
                return false;
            }
            transition(next);
            // a listener may have reset the run while being notified
            return isCurrent(ticket) && !Thread.currentThread().isInterrupted();
        }
    }

    private boolean stillCurrent(RunTicket ticket) {
        synchronized (lock) {
            return isCurrent(ticket) && !Thread.currentThread().isInterrupted();
        }
    }

    // Caller holds lock
    private void transition(RunState next) {
        RunState previous = state;
        if (next.phase() != RunPhase.IDLE && !previous.phase().canTransitionTo(next.phase())) {
            throw new InvalidRunTransitionException(previous.phase(), next.phase());
        }
        state = next;
        metrics.phaseChanged(next.phase());
        log.debug("Run state {} -> {}", previous, next);
        for (RunStateListener listener : listeners) {
            try {
                listener.onStateChanged(previous, next);
            } catch (RuntimeException e) {
                log.warn("Run state listener failed: {}", e.getMessage(), e);
            }
        }
    }

    // Caller holds lock
    private boolean abandonActiveTask() {
        generation++;
        Future<?> task = activeTask;
        activeTask = null;
        return task != null && task.cancel(true);
    }

    // Caller holds lock
    private boolean isCurrent(RunTicket ticket) {
        return ticket.generation() == generation;
    }

    private DashboardSnapshot snapshotOf(List<Customer> customers, List<RecentCheckRecord> recent, String loadError) {
        RunState runState;
        String traceId;
        synchronized (lock) {
            runState = state;
            traceId = traceIdOf(activeRun);
        }
        return new DashboardSnapshot(customers, selectedCustomerId, recent, runState, traceId, loadError);
    }

    private String customerNameOf(String customerId) {
        try {
            return customerRepository.findById(customerId).map(Customer::displayName).orElse(customerId);
        } catch (RuntimeException e) {
            log.debug("Customer lookup failed for {}: {}", customerId, e.getMessage());
            return customerId;
        }
    }

    private Duration elapsedSince(RunTicket ticket) {
        Duration elapsed = Duration.between(ticket.startedAt(), clock.instant());
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    private void emit(String eventName, Map<String, String> eventFields) {
        try {
            eventEmitter.emitEvent(eventName, eventFields);
        } catch (RuntimeException e) {
            log.warn("Telemetry event {} failed: {}", eventName, e.getMessage());
        }
    }

    private void emitError(String eventName, Throwable error, Map<String, String> eventFields) {
        try {
            eventEmitter.emitError(eventName, error, eventFields);
        } catch (RuntimeException e) {
            log.warn("Telemetry error event {} failed: {}", eventName, e.getMessage());
        }
    }

    private static Map<String, String> fields(String traceId, String customerId, String... extra) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (traceId != null) {
            fields.put("traceId", traceId);
        }
        if (customerId != null) {
            fields.put("customerId", customerId);
        }
        fields.put("screen", SCREEN);
        for (int i = 0; i + 1 < extra.length; i += 2) {
            if (extra[i + 1] != null) {
                fields.put(extra[i], extra[i + 1]);
            }
        }
        return fields;
    }

    private static String traceIdOf(RunTicket ticket) {
        return ticket != null ? ticket.traceId() : null;
    }

    private static String messageOf(Throwable error, String fallback) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : fallback;
    }

    /**
     * Identity of one run. A ticket whose generation is no longer current is stale.
     */
    private record RunTicket(long generation, String traceId, String customerId, Instant startedAt) {}

    /**
     * Builder for the coordinator. Repositories and the gateway are required.
     */
    public static final class Builder {
        private CustomerRepository customerRepository;
        private RecentCheckRepository recentCheckRepository;
        private SessionPreferencesRepository preferencesRepository;
        private ResultCacheRepository resultCacheRepository;
        private RiskCheckGateway gateway;
        private TraceIdGenerator traceIdGenerator = new UuidTraceIdGenerator();
        private EventEmitter eventEmitter = EventEmitter.noop();
        private KybRunMetrics metrics;
        private StepDelay stepDelay = StepDelay.fixed(StepDelay.DEFAULT_INTERVAL);
        private Clock clock = Clock.systemUTC();
        private CompletionNavigator navigator;

        private Builder() {
        }

        public Builder customerRepository(CustomerRepository customerRepository) {
            this.customerRepository = customerRepository;
            return this;
        }

        public Builder recentCheckRepository(RecentCheckRepository recentCheckRepository) {
            this.recentCheckRepository = recentCheckRepository;
            return this;
        }

        public Builder preferencesRepository(SessionPreferencesRepository preferencesRepository) {
            this.preferencesRepository = preferencesRepository;
            return this;
        }

        public Builder resultCacheRepository(ResultCacheRepository resultCacheRepository) {
            this.resultCacheRepository = resultCacheRepository;
            return this;
        }

        public Builder gateway(RiskCheckGateway gateway) {
            this.gateway = gateway;
            return this;
        }

        public Builder traceIdGenerator(TraceIdGenerator traceIdGenerator) {
            this.traceIdGenerator = Objects.requireNonNull(traceIdGenerator);
            return this;
        }

        public Builder eventEmitter(EventEmitter eventEmitter) {
            this.eventEmitter = Objects.requireNonNull(eventEmitter);
            return this;
        }

        public Builder metrics(KybRunMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder stepDelay(StepDelay stepDelay) {
            this.stepDelay = Objects.requireNonNull(stepDelay);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        /**
         * Router to push the navigation target to on completion. Optional;
         * without one, callers poll {@link #consumeCompletionForNavigation()}.
         */
        public Builder navigator(CompletionNavigator navigator) {
            this.navigator = navigator;
            return this;
        }

        public DashboardWorkflowCoordinator build() {
            if (metrics == null) {
                metrics = new KybRunMetrics();
            }
            return new DashboardWorkflowCoordinator(this);
        }
    }
}
