package tech.cids.platform.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.cids.platform.application.RegisteredApplication;
import tech.cids.platform.application.RegisteredApplicationRepository;
import tech.cids.platform.common.UnitOfWork;
import tech.cids.platform.discovery.endpoint.DiscoveredEndpoint;
import tech.cids.platform.discovery.endpoint.DiscoveredEndpointRepository;
import tech.cids.platform.discovery.history.DiscoveryAttempt;
import tech.cids.platform.discovery.history.DiscoveryAttemptRepository;
import tech.cids.platform.discovery.history.DiscoveryHistory;
import tech.cids.platform.discovery.model.CapabilityDescriptor;
import tech.cids.platform.discovery.model.Endpoint;
import tech.cids.platform.discovery.model.ServiceDescriptor;
import tech.cids.platform.discovery.progress.DiscoveryProgress;
import tech.cids.platform.discovery.progress.DiscoveryProgressTracker;
import tech.cids.platform.discovery.progress.DiscoveryStep;
import tech.cids.platform.discovery.retry.AttemptOutcome;
import tech.cids.platform.discovery.retry.BackoffPolicy;
import tech.cids.platform.discovery.retry.RetryExecutor;
import tech.cids.platform.discovery.retry.Sleeper;
import tech.cids.platform.permission.PermissionExpander;
import tech.cids.platform.permission.PermissionMetadata;
import tech.cids.platform.permission.PermissionRegistry;
import tech.cids.platform.shared.EntityType;
import tech.cids.platform.shared.TsidGenerator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Discovers the permission surface of registered applications.
 *
 * <p>One run goes through health check, fetch, validation and permission expansion, retried
 * as a unit by a {@link RetryExecutor}. A successful run replaces the application's permission
 * catalog and endpoint list, records the outcome on the application and caches the result.
 * Every attempt, successful or not, is appended to the application's discovery history.
 *
 * <p>Runs execute on a bounded worker pool. At most one run per application is in flight:
 * a second caller for the same application receives the running future. Failures never
 * escape as exceptions; they come back as a {@link DiscoveryStatus#FAILED} result.
 *
 * <p>The task timeout counts from submission. When it elapses before the run starts
 * storing, the run is failed with {@link DiscoveryErrorType#TIMEOUT_ERROR} and its worker is
 * interrupted. A timed-out run writes nothing afterwards and keeps its in-flight slot until
 * the worker has actually stopped.
 */
@ApplicationScoped
public class DiscoveryService {

    private static final Logger LOG = Logger.getLogger(DiscoveryService.class);

    @Inject
    RegisteredApplicationRepository applicationRepository;

    @Inject
    CapabilitySource capabilitySource;

    @Inject
    CapabilityParser capabilityParser;

    @Inject
    PermissionExpander permissionExpander;

    @Inject
    PermissionRegistry permissionRegistry;

    @Inject
    DiscoveryAttemptRepository attemptRepository;

    @Inject
    DiscoveredEndpointRepository endpointRepository;

    @Inject
    DiscoveryProgressTracker progressTracker;

    @Inject
    UnitOfWork unitOfWork;

    @Inject
    DiscoveryConfig config;

    Clock clock = Clock.systemUTC();
    Sleeper sleeper = Sleeper.SYSTEM;
    Ticker ticker = Ticker.systemTicker();

    private Cache<String, DiscoveryResult> resultCache;
    private RetryExecutor retryExecutor;
    private ExecutorService workers;
    private ScheduledExecutorService timeouts;
    private final Map<String, DiscoveryRun> inFlight = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        resultCache = Caffeine.newBuilder()
            .expireAfterWrite(config.cacheTtl())
            .ticker(ticker)
            .build();

        DiscoveryConfig.Retry retry = config.retry();
        BackoffPolicy backoff = new BackoffPolicy(retry.baseDelay(), retry.factor(), retry.maxDelay(),
            retry.jitterRatio());
        retryExecutor = new RetryExecutor(backoff, retry.maxRetries(), sleeper, clock);

        AtomicInteger threadCount = new AtomicInteger();
        workers = Executors.newFixedThreadPool(config.workerThreads(), runnable -> {
            Thread thread = new Thread(runnable, "cids-discovery-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        timeouts = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "cids-discovery-timeout");
            thread.setDaemon(true);
            return thread;
        });
        LOG.infof("DiscoveryService initialized: cacheTtl=%s, maxRetries=%d, workers=%d, taskTimeout=%s",
            config.cacheTtl(), retry.maxRetries(), config.workerThreads(), config.taskTimeout());
    }

    @PreDestroy
    void shutdown() {
        timeouts.shutdownNow();
        workers.shutdownNow();
    }

    // ========================================================================
    // Discovery
    // ========================================================================

    /**
     * Discover the application and wait for the result.
     */
    public DiscoveryResult discover(String appId, boolean forceRefresh) {
        return discoverAsync(appId, forceRefresh).join();
    }

    /**
     * Discover the application on the worker pool. The returned future always completes
     * normally.
     */
    public CompletableFuture<DiscoveryResult> discoverAsync(String appId, boolean forceRefresh) {
        if (!forceRefresh) {
            DiscoveryResult cached = resultCache.getIfPresent(appId);
            if (cached != null) {
                LOG.debugf("Serving cached discovery result for app %s", appId);
                return CompletableFuture.completedFuture(cached.asCached());
            }
        }
        return submit(appId, false);
    }

    /**
     * Discover the application through the 1.x protocol. Only endpoint-level permissions are
     * registered. Never served from cache.
     */
    public DiscoveryResult discoverLegacy(String appId) {
        return submit(appId, true).join();
    }

    /**
     * Discover every application that allows discovery and has a discovery URL.
     */
    public Map<String, DiscoveryResult> discoverAll(boolean forceRefresh) {
        List<String> appIds = applicationRepository.findDiscoverable().stream()
            .filter(RegisteredApplication::hasDiscoveryUrl)
            .map(app -> app.appId)
            .toList();
        return discoverBatch(appIds, forceRefresh);
    }

    /**
     * Discover the applications in parallel and wait for all of them. A failing application
     * shows up as a failed result in the returned map and does not affect the others.
     *
     * @return results keyed by appId, in request order
     */
    public Map<String, DiscoveryResult> discoverBatch(Collection<String> appIds, boolean forceRefresh) {
        Map<String, CompletableFuture<DiscoveryResult>> futures = new LinkedHashMap<>();
        for (String appId : appIds) {
            futures.putIfAbsent(appId, discoverAsync(appId, forceRefresh));
        }

        Map<String, DiscoveryResult> results = new LinkedHashMap<>();
        futures.forEach((appId, future) -> results.put(appId, future.join()));

        long succeeded = results.values().stream().filter(DiscoveryResult::isSuccessful).count();
        LOG.infof("Batch discovery finished: %d of %d applications succeeded", succeeded, results.size());
        return results;
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public DiscoveryHistory getHistory(String appId) {
        return DiscoveryHistory.of(appId, attemptRepository.findRecent(appId, config.historySize()));
    }

    public Optional<DiscoveryProgress> getProgress(String appId) {
        return progressTracker.latest(appId);
    }

    public Optional<DiscoveryResult> getCachedResult(String appId) {
        return Optional.ofNullable(resultCache.getIfPresent(appId));
    }

    public boolean isInFlight(String appId) {
        return inFlight.containsKey(appId);
    }

    public void invalidateCache(String appId) {
        resultCache.invalidate(appId);
    }

    /**
     * Drop every in-memory trace of the application.
     */
    public void evictApplication(String appId) {
        resultCache.invalidate(appId);
        progressTracker.clear(appId);
    }

    // ========================================================================
    // Run orchestration
    // ========================================================================

    private CompletableFuture<DiscoveryResult> submit(String appId, boolean legacy) {
        Duration taskTimeout = config.taskTimeout();
        DiscoveryRun run = new DiscoveryRun(appId, TsidGenerator.generate(EntityType.DISCOVERY_RUN),
            clock.instant().plus(taskTimeout));
        DiscoveryRun running = inFlight.putIfAbsent(appId, run);
        if (running != null) {
            LOG.debugf("Discovery for app %s already in flight, joining it", appId);
            return running.result;
        }

        try {
            run.timeout = timeouts.schedule(() -> timeOut(run, taskTimeout), taskTimeout.toMillis(),
                TimeUnit.MILLISECONDS);
            workers.execute(() -> work(run, legacy));
        } catch (RejectedExecutionException e) {
            run.cancelTimeout();
            inFlight.remove(appId, run);
            run.result.complete(DiscoveryResult.failed(appId, run.runId, DiscoveryErrorType.UNKNOWN_ERROR,
                "Discovery workers are shut down", 0, clock.instant()));
        }
        return run.result;
    }

    private void work(DiscoveryRun run, boolean legacy) {
        DiscoveryResult result = null;
        try {
            if (run.attach(Thread.currentThread())) {
                result = runDiscovery(run, legacy);
            } else {
                LOG.debugf("Discovery run %s for app %s timed out before it started", run.runId, run.appId);
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Discovery task for app %s failed unexpectedly", run.appId);
            if (run.commit()) {
                DiscoveryException error = new DiscoveryException(DiscoveryErrorType.UNKNOWN_ERROR,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
                result = fail(null, run.appId, run.runId, error, run.attempts.get());
            }
        } finally {
            run.detach();
            run.cancelTimeout();
            inFlight.remove(run.appId, run);
            Thread.interrupted();
        }
        if (result != null) {
            run.result.complete(result);
        }
    }

    /**
     * Fails the run if it has not started storing yet. The history row, status and caller's
     * result are written here; the worker is interrupted and discards whatever it produces.
     */
    private void timeOut(DiscoveryRun run, Duration taskTimeout) {
        if (!run.expire()) {
            return;
        }
        String message = "Discovery did not finish within " + taskTimeout.toMillis() + " ms";
        LOG.warnf("Discovery run %s for app %s exceeded the task timeout of %s", run.runId, run.appId, taskTimeout);
        DiscoveryException error = new DiscoveryException(DiscoveryErrorType.TIMEOUT_ERROR, message);
        // the attempt cut short is the one after the last finished attempt
        int attemptNumber = run.attempts.get() + 1;
        DiscoveryResult result;
        try {
            appendAttempt(run.appId, run.runId, new AttemptOutcome(attemptNumber, false, error.getErrorType(),
                message, taskTimeout, null), 0, 0);
            RegisteredApplication app = applicationRepository.findByAppId(run.appId).orElse(null);
            result = fail(app, run.appId, run.runId, error, attemptNumber);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Could not record the timeout of discovery run %s for app %s", run.runId, run.appId);
            result = DiscoveryResult.failed(run.appId, run.runId, error.getErrorType(), message, attemptNumber,
                clock.instant());
        }
        run.result.complete(result);
    }

    /**
     * @return the run's result, or null when the run timed out and its outcome was discarded
     */
    private DiscoveryResult runDiscovery(DiscoveryRun run, boolean legacy) {
        String appId = run.appId;
        String runId = run.runId;
        progressTracker.report(appId, runId, DiscoveryStep.PENDING, "Discovery queued");

        Optional<RegisteredApplication> found = applicationRepository.findByAppId(appId);
        Optional<String> problem = preconditionProblem(appId, found);
        if (problem.isPresent()) {
            if (!run.commit()) {
                return discarded(run);
            }
            DiscoveryException error = new DiscoveryException(DiscoveryErrorType.CONFIGURATION_ERROR, problem.get());
            appendAttempt(appId, runId, new AttemptOutcome(1, false, error.getErrorType(), error.getMessage(),
                Duration.ZERO, null), 0, 0);
            return fail(found.orElse(null), appId, runId, error, 1);
        }
        RegisteredApplication app = found.get();

        AttemptOutcome[] lastSuccess = new AttemptOutcome[1];
        PreparedDiscovery prepared;
        try {
            prepared = retryExecutor.execute("Discovery of " + appId,
                attemptNumber -> attemptOnce(app, run, legacy, attemptNumber),
                run.deadline,
                outcome -> {
                    run.attempts.set(outcome.attemptNumber());
                    if (outcome.success()) {
                        lastSuccess[0] = outcome;
                    } else if (!run.isExpired()) {
                        appendAttempt(appId, runId, outcome, 0, 0);
                    }
                });
        } catch (DiscoveryException e) {
            return run.commit() ? fail(app, appId, runId, e, run.attempts.get()) : discarded(run);
        }
        if (!run.commit()) {
            return discarded(run);
        }

        int attempts = run.attempts.get();
        progressTracker.report(appId, runId, DiscoveryStep.STORING, "Storing " + prepared.permissions().size()
            + " permissions");
        try {
            store(app, prepared);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Storing discovery results for app %s failed", appId);
            DiscoveryException error = new DiscoveryException(DiscoveryErrorType.UNKNOWN_ERROR,
                "Storing discovery results failed: " + e.getMessage(), e);
            AttemptOutcome outcome = lastSuccess[0];
            appendAttempt(appId, runId, new AttemptOutcome(attempts, false, error.getErrorType(),
                error.getMessage(), outcome != null ? outcome.elapsed() : Duration.ZERO, null), 0, 0);
            return fail(app, appId, runId, error, attempts);
        }

        int endpointCount = prepared.descriptor().allEndpoints().size();
        int permissionCount = prepared.permissions().size();
        appendAttempt(appId, runId, lastSuccess[0], endpointCount, permissionCount);

        DiscoveryResult result = DiscoveryResult.success(appId, runId, prepared.descriptor().version(),
            endpointCount, permissionCount, prepared.descriptor().serviceCount(), attempts, clock.instant());
        resultCache.put(appId, result);
        progressTracker.report(appId, runId, DiscoveryStep.SUCCESS,
            "Discovered " + endpointCount + " endpoints and " + permissionCount + " permissions");
        LOG.infof("Discovery of app %s succeeded after %d attempt(s): version=%s, endpoints=%d, permissions=%d",
            appId, attempts, result.version(), endpointCount, permissionCount);
        return result;
    }

    private DiscoveryResult discarded(DiscoveryRun run) {
        LOG.infof("Discovery run %s for app %s stopped after its timeout, outcome discarded", run.runId, run.appId);
        return null;
    }

    private Optional<String> preconditionProblem(String appId, Optional<RegisteredApplication> found) {
        if (found.isEmpty()) {
            return Optional.of("Application " + appId + " is not registered");
        }
        RegisteredApplication app = found.get();
        if (!app.allowDiscovery) {
            return Optional.of("Discovery is disabled for application " + appId);
        }
        if (!app.hasDiscoveryUrl()) {
            return Optional.of("Application " + appId + " has no discovery URL");
        }
        return Optional.empty();
    }

    /**
     * One attempt: health check, fetch, validate and expand. Nothing is stored here.
     */
    private PreparedDiscovery attemptOnce(RegisteredApplication app, DiscoveryRun run, boolean legacy,
                                          int attemptNumber) throws DiscoveryException {
        if (run.isExpired()) {
            throw new DiscoveryException(DiscoveryErrorType.TIMEOUT_ERROR, "Discovery run " + run.runId + " timed out");
        }
        String appId = app.appId;
        String runId = run.runId;
        if (config.healthCheckEnabled()) {
            progressTracker.report(appId, runId, DiscoveryStep.HEALTH_CHECK, "Checking " + app.discoveryUrl
                + " (attempt " + attemptNumber + ")");
            capabilitySource.checkHealth(app.discoveryUrl);
        }

        progressTracker.report(appId, runId, DiscoveryStep.FETCHING, "Fetching capability document");
        JsonNode document = capabilitySource.fetch(app.discoveryUrl, !legacy);

        progressTracker.report(appId, runId, DiscoveryStep.VALIDATING, "Validating capability document");
        CapabilityDescriptor descriptor = legacy
            ? capabilityParser.parseLegacy(document, appId, app.name)
            : capabilityParser.parse(document);
        if (!appId.equals(descriptor.appId())) {
            LOG.warnf("Capability document at %s reports app_id %s, registering it under %s",
                app.discoveryUrl, descriptor.appId(), appId);
        }

        progressTracker.report(appId, runId, DiscoveryStep.GENERATING_PERMISSIONS, "Expanding permissions");
        List<PermissionMetadata> permissions = permissionExpander.expand(appId, descriptor, runId, clock.instant());
        return new PreparedDiscovery(descriptor, permissions);
    }

    private void store(RegisteredApplication app, PreparedDiscovery prepared) {
        String appId = app.appId;
        permissionRegistry.registerPermissions(appId, prepared.permissions());
        endpointRepository.replaceForApp(appId, toEndpoints(appId, prepared.descriptor()));

        app.discoveryStatus = RegisteredApplication.STATUS_SUCCESS;
        app.lastDiscoveryAt = clock.instant();
        app.discoveryVersion = prepared.descriptor().version();
        app.discoveryRunCount++;
        unitOfWork.inTransaction(() -> applicationRepository.update(app));
    }

    private DiscoveryResult fail(RegisteredApplication app, String appId, String runId, DiscoveryException error,
                                 int attempts) {
        if (app != null) {
            app.discoveryStatus = error.getErrorType().statusValue();
            try {
                unitOfWork.inTransaction(() -> applicationRepository.update(app));
            } catch (RuntimeException e) {
                LOG.errorf(e, "Could not record discovery status for app %s", appId);
            }
        }
        progressTracker.report(appId, runId, DiscoveryStep.FAILED, error.getMessage());
        LOG.warnf("Discovery of app %s failed after %d attempt(s) with %s: %s",
            appId, attempts, error.getErrorType(), error.getMessage());
        return DiscoveryResult.failed(appId, runId, error.getErrorType(), error.getMessage(), attempts,
            clock.instant());
    }

    private void appendAttempt(String appId, String runId, AttemptOutcome outcome, int endpointsFound,
                               int permissionsGenerated) {
        DiscoveryAttempt attempt = new DiscoveryAttempt();
        attempt.id = TsidGenerator.generate(EntityType.DISCOVERY_ATTEMPT);
        attempt.appId = appId;
        attempt.discoveryRunId = runId;
        attempt.timestamp = clock.instant();
        attempt.success = outcome.success();
        attempt.errorType = outcome.errorType();
        attempt.errorMessage = outcome.errorMessage();
        attempt.responseTimeMs = outcome.elapsed() != null ? outcome.elapsed().toMillis() : 0;
        attempt.endpointsFound = endpointsFound;
        attempt.permissionsGenerated = permissionsGenerated;
        attempt.attemptNumber = outcome.attemptNumber();
        try {
            attemptRepository.append(attempt, config.historySize());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Could not record discovery attempt %d for app %s", outcome.attemptNumber(), appId);
        }
    }

    private List<DiscoveredEndpoint> toEndpoints(String appId, CapabilityDescriptor descriptor) {
        List<DiscoveredEndpoint> endpoints = new ArrayList<>();
        if (descriptor.isMultiService()) {
            for (ServiceDescriptor service : descriptor.services()) {
                for (Endpoint endpoint : service.endpoints()) {
                    endpoints.add(toEndpoint(appId, service.name(), endpoint));
                }
            }
        } else {
            for (Endpoint endpoint : descriptor.endpoints()) {
                endpoints.add(toEndpoint(appId, null, endpoint));
            }
        }
        return endpoints;
    }

    private DiscoveredEndpoint toEndpoint(String appId, String serviceName, Endpoint endpoint) {
        DiscoveredEndpoint discovered = new DiscoveredEndpoint();
        discovered.id = TsidGenerator.generate(EntityType.DISCOVERED_ENDPOINT);
        discovered.appId = appId;
        discovered.serviceName = serviceName;
        discovered.method = endpoint.method().name();
        discovered.path = endpoint.path();
        discovered.operationId = endpoint.operationId();
        discovered.description = endpoint.description();
        discovered.tags = new ArrayList<>(endpoint.tags());
        discovered.requiredRoles = new ArrayList<>(endpoint.requiredRoles());
        discovered.discovered = true;
        discovered.discoveredAt = clock.instant();
        return discovered;
    }

    private record PreparedDiscovery(CapabilityDescriptor descriptor, List<PermissionMetadata> permissions) {
    }

    /**
     * One submitted run. Either the worker claims it for storing or the timeout expires it,
     * never both.
     */
    private static final class DiscoveryRun {

        private static final int RUNNING = 0;
        private static final int COMMITTING = 1;
        private static final int EXPIRED = 2;

        final String appId;
        final String runId;
        final Instant deadline;
        final CompletableFuture<DiscoveryResult> result = new CompletableFuture<>();
        final AtomicInteger attempts = new AtomicInteger();
        private final AtomicInteger state = new AtomicInteger(RUNNING);
        private Thread worker;
        volatile ScheduledFuture<?> timeout;

        DiscoveryRun(String appId, String runId, Instant deadline) {
            this.appId = appId;
            this.runId = runId;
            this.deadline = deadline;
        }

        synchronized boolean attach(Thread thread) {
            if (state.get() == EXPIRED) {
                return false;
            }
            worker = thread;
            return true;
        }

        synchronized void detach() {
            worker = null;
        }

        /**
         * @return true if the worker owns the outcome, false if the run already expired
         */
        boolean commit() {
            return state.compareAndSet(RUNNING, COMMITTING) || state.get() == COMMITTING;
        }

        synchronized boolean expire() {
            if (!state.compareAndSet(RUNNING, EXPIRED)) {
                return false;
            }
            if (worker != null) {
                worker.interrupt();
            }
            return true;
        }

        boolean isExpired() {
            return state.get() == EXPIRED;
        }

        void cancelTimeout() {
            ScheduledFuture<?> scheduled = timeout;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }
}
