package io.tabletalk.core.query;

import io.tabletalk.core.client.AnalysisClient;
import io.tabletalk.core.client.AnalysisClientRegistry;
import io.tabletalk.core.client.AnalysisException;
import io.tabletalk.core.client.AnalysisRequest;
import io.tabletalk.core.client.AnalysisResult;
import io.tabletalk.core.dataset.DatasetCache;
import io.tabletalk.core.dataset.DatasetLoadException;
import io.tabletalk.core.dataset.DatasetRepository;
import io.tabletalk.core.dataset.TableLoader;
import io.tabletalk.core.model.Dataset;
import io.tabletalk.core.model.Exchange;
import io.tabletalk.core.model.ExchangeOutcome;
import io.tabletalk.core.model.ExchangeStatus;
import io.tabletalk.core.model.QueryFailure;
import io.tabletalk.core.model.Session;
import io.tabletalk.core.model.Table;
import io.tabletalk.core.observability.ObservabilityService;
import io.tabletalk.core.session.ContextWindowManager;
import io.tabletalk.core.session.SessionStore;
import io.tabletalk.core.session.UnknownSessionException;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one natural-language query against a session's dataset and records the result.
 *
 * <p>Every accepted query ends as exactly one persisted {@link Exchange}, successful or not. Only an
 * unknown session or an invalid prompt is reported by exception. Transient upstream failures
 * ({@link QueryFailure#retryable()}) are retried once, so a query makes at most two upstream calls.
 * The whole query is bounded by {@link QuerySettings#deadline()}: no attempt outlives it, and the
 * retry is skipped when less than one full {@link QuerySettings#invokeTimeout()} would remain.
 */
public final class QueryExecutor implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(QueryExecutor.class);

    public static final int MAX_PROMPT_LENGTH = 2_000;
    public static final String DEFAULT_RESPONSE_TEXT = "Query executed successfully";
    static final int MAX_ATTEMPTS = 2;

    private final SessionStore sessionStore;
    private final DatasetRepository datasetRepository;
    private final DatasetCache datasetCache;
    private final TableLoader tableLoader;
    private final AnalysisClientRegistry clientRegistry;
    private final ContextWindowManager contextWindow;
    private final QuerySettings settings;
    private final ExecutorService workers;
    private final boolean ownsWorkers;
    private final ObservabilityService observability;

    public QueryExecutor(
        SessionStore sessionStore,
        DatasetRepository datasetRepository,
        DatasetCache datasetCache,
        TableLoader tableLoader,
        AnalysisClientRegistry clientRegistry,
        QuerySettings settings
    ) {
        this(sessionStore, datasetRepository, datasetCache, tableLoader, clientRegistry, settings, null, null);
    }

    /**
     * @param workers pool running upstream calls; when {@code null} the executor creates and owns one
     * @param observability optional audit sink
     */
    public QueryExecutor(
        SessionStore sessionStore,
        DatasetRepository datasetRepository,
        DatasetCache datasetCache,
        TableLoader tableLoader,
        AnalysisClientRegistry clientRegistry,
        QuerySettings settings,
        ExecutorService workers,
        ObservabilityService observability
    ) {
        this.sessionStore = Objects.requireNonNull(sessionStore, "sessionStore must not be null");
        this.datasetRepository = Objects.requireNonNull(datasetRepository, "datasetRepository must not be null");
        this.datasetCache = Objects.requireNonNull(datasetCache, "datasetCache must not be null");
        this.tableLoader = Objects.requireNonNull(tableLoader, "tableLoader must not be null");
        this.clientRegistry = Objects.requireNonNull(clientRegistry, "clientRegistry must not be null");
        this.settings = settings == null ? QuerySettings.defaults() : settings;
        this.contextWindow = new ContextWindowManager(sessionStore);
        this.ownsWorkers = workers == null;
        this.workers = workers == null ? Executors.newCachedThreadPool(new WorkerThreadFactory()) : workers;
        this.observability = observability;
    }

    /**
     * @return the recorded exchange; if it could not be persisted, the exchange that would have been
     *     recorded, with sequence {@code 0}
     * @throws UnknownSessionException if the session does not exist
     * @throws IllegalArgumentException if the prompt is blank or longer than {@value #MAX_PROMPT_LENGTH}
     * @throws IOException if the session cannot be looked up
     */
    public Exchange submitQuery(String sessionId, String prompt) throws IOException {
        String queryId = UUID.randomUUID().toString();
        long startedAt = System.nanoTime();
        transition(queryId, QueryState.RECEIVED);

        Session session = sessionStore.find(sessionId).orElseThrow(() -> new UnknownSessionException(sessionId));
        String normalizedPrompt = validatePrompt(prompt);
        audit(ObservabilityService.QUERY_STARTED, attributes(queryId, session));

        Execution execution;
        try {
            execution = execute(queryId, session, normalizedPrompt, startedAt + settings.deadline().toNanos());
        } catch (RuntimeException e) {
            LOG.error("Query {} on session {} failed unexpectedly", queryId, session.id(), e);
            execution = new Execution(ExchangeOutcome.failure(normalizedPrompt, QueryFailure.MALFORMED_OUTPUT), 0);
        }
        return persist(queryId, session, execution, startedAt);
    }

    /**
     * Exchanges of the session, oldest first.
     */
    public List<Exchange> getHistory(String sessionId) throws IOException {
        if (sessionStore.find(sessionId).isEmpty()) {
            throw new UnknownSessionException(sessionId);
        }
        return sessionStore.history(sessionId);
    }

    public QuerySettings settings() {
        return settings;
    }

    private Execution execute(String queryId, Session session, String prompt, long deadlineNanos) {
        transition(queryId, QueryState.RESOLVING_DATASET);
        Optional<Dataset> dataset;
        try {
            dataset = datasetRepository.find(session.datasetId());
        } catch (IOException e) {
            LOG.warn("Could not read dataset {} for query {}: {}", session.datasetId(), queryId, e.getMessage());
            return Execution.failed(prompt, QueryFailure.DATA_UNAVAILABLE, 0);
        }
        if (dataset.isEmpty() || !dataset.get().ready()) {
            LOG.warn(
                "Dataset {} for query {} is not ready (status {})",
                session.datasetId(),
                queryId,
                dataset.map(d -> d.status().name()).orElse("MISSING")
            );
            return Execution.failed(prompt, QueryFailure.DATA_UNAVAILABLE, 0);
        }

        Table table;
        try {
            table = datasetCache.getOrLoad(dataset.get().id(), dataset.get().fingerprint(), tableLoader);
        } catch (DatasetLoadException e) {
            LOG.warn("Could not load dataset {} for query {}: {}", e.datasetId(), queryId, e.getMessage());
            return Execution.failed(prompt, QueryFailure.DATA_UNAVAILABLE, 0);
        }

        AnalysisClient client;
        try {
            client = clientRegistry.get();
        } catch (RuntimeException e) {
            LOG.warn("Analysis client unavailable for query {}: {}", queryId, e.getMessage());
            return Execution.failed(prompt, QueryFailure.UPSTREAM_UNAVAILABLE, 0);
        }

        transition(queryId, QueryState.RESOLVING_CONTEXT);
        List<Exchange> context;
        try {
            context = contextWindow.window(session.id(), settings.maxContextEntries(), settings.contextTokenBudget());
        } catch (IOException e) {
            LOG.error("Could not read context of session {} for query {}", session.id(), queryId, e);
            return Execution.failed(prompt, QueryFailure.MALFORMED_OUTPUT, 0);
        }

        AnalysisRequest request = new AnalysisRequest(table, context, prompt, settings.structuredVisualization());
        int attempt = 1;
        while (true) {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0) {
                LOG.warn("Query {} reached its deadline before attempt {}", queryId, attempt);
                return Execution.failed(prompt, QueryFailure.TIMEOUT, attempt - 1);
            }
            transition(queryId, QueryState.INVOKING);
            try {
                AnalysisResult result = invoke(client, request, Math.min(settings.invokeTimeout().toNanos(), remaining));
                transition(queryId, QueryState.CLASSIFYING);
                return new Execution(success(prompt, result), attempt);
            } catch (AnalysisException e) {
                transition(queryId, QueryState.CLASSIFYING);
                QueryFailure failure = e.failure();
                if (failure.retryable() && attempt < MAX_ATTEMPTS && !roomForRetry(deadlineNanos)) {
                    LOG.warn(
                        "Query {} failed with {} and has no time left for a retry: {}",
                        queryId,
                        failure,
                        e.getMessage()
                    );
                    return Execution.failed(prompt, failure, attempt);
                }
                if (failure.retryable() && attempt < MAX_ATTEMPTS && !Thread.currentThread().isInterrupted()) {
                    LOG.warn(
                        "Query {} attempt {} failed with {}, retrying in {} ms: {}",
                        queryId,
                        attempt,
                        failure,
                        settings.retryBackoff().toMillis(),
                        e.getMessage()
                    );
                    Map<String, Object> retried = attributes(queryId, session);
                    retried.put("failure", failure.name());
                    retried.put("attempt", attempt);
                    audit(ObservabilityService.QUERY_RETRIED, retried);
                    if (!backoff()) {
                        return Execution.failed(prompt, failure, attempt);
                    }
                    attempt++;
                    continue;
                }
                LOG.warn("Query {} failed with {} after {} attempt(s): {}", queryId, failure, attempt, e.getMessage());
                return Execution.failed(prompt, failure, attempt);
            }
        }
    }

    private boolean roomForRetry(long deadlineNanos) {
        long afterBackoff = deadlineNanos - System.nanoTime() - settings.retryBackoff().toNanos();
        return afterBackoff >= settings.invokeTimeout().toNanos();
    }

    private AnalysisResult invoke(AnalysisClient client, AnalysisRequest request, long timeoutNanos) {
        Future<AnalysisResult> call = workers.submit(() -> client.analyze(request));
        try {
            return call.get(timeoutNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new AnalysisException(
                QueryFailure.TIMEOUT,
                "no response within " + TimeUnit.NANOSECONDS.toMillis(timeoutNanos) + " ms",
                e
            );
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new AnalysisException(QueryFailure.TIMEOUT, "interrupted while waiting for the analysis", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("analysis failed", cause);
        }
    }

    private ExchangeOutcome success(String prompt, AnalysisResult result) {
        String text = result.text() == null || result.text().isBlank() ? DEFAULT_RESPONSE_TEXT : result.text();
        return ExchangeOutcome.success(prompt, text, result.visualizationPayload().orElse(null));
    }

    private boolean backoff() {
        long millis = settings.retryBackoff().toMillis();
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Exchange persist(String queryId, Session session, Execution execution, long startedAt) {
        ExchangeOutcome outcome = execution.outcome();
        Exchange exchange;
        try {
            exchange = sessionStore.append(session.id(), outcome);
        } catch (IOException | RuntimeException e) {
            LOG.error("Could not persist exchange of query {} on session {}", queryId, session.id(), e);
            exchange = outcome.toExchange(UUID.randomUUID().toString(), session.id(), 0L, Instant.now());
        }

        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
        Map<String, Object> attributes = attributes(queryId, session);
        attributes.put("duration_ms", durationMs);
        attributes.put("upstream_calls", execution.upstreamCalls());
        if (outcome.status() == ExchangeStatus.SUCCESS) {
            transition(queryId, QueryState.PERSISTED_SUCCESS);
            audit(ObservabilityService.QUERY_SUCCEEDED, attributes);
        } else {
            transition(queryId, QueryState.PERSISTED_ERROR);
            attributes.put("failure", outcome.failure().name());
            audit(ObservabilityService.QUERY_FAILED, attributes);
        }
        return exchange;
    }

    private static String validatePrompt(String prompt) {
        String normalized = prompt == null ? "" : prompt.trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("prompt must not be blank");
        }
        if (normalized.length() > MAX_PROMPT_LENGTH) {
            throw new IllegalArgumentException("prompt must be at most " + MAX_PROMPT_LENGTH + " characters");
        }
        return normalized;
    }

    private Map<String, Object> attributes(String queryId, Session session) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("query_id", queryId);
        attributes.put("session_id", session.id());
        attributes.put("dataset_id", session.datasetId());
        return attributes;
    }

    private void audit(String type, Map<String, Object> attributes) {
        if (observability == null) {
            return;
        }
        try {
            observability.record(type, attributes);
        } catch (IOException e) {
            LOG.warn("Failed to record audit event {}: {}", type, e.getMessage());
        }
    }

    private static void transition(String queryId, QueryState state) {
        LOG.debug("Query {} -> {}", queryId, state);
    }

    @Override
    public void close() {
        if (ownsWorkers) {
            workers.shutdownNow();
        }
    }

    private record Execution(ExchangeOutcome outcome, int upstreamCalls) {
        static Execution failed(String prompt, QueryFailure failure, int upstreamCalls) {
            return new Execution(ExchangeOutcome.failure(prompt, failure), upstreamCalls);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "tabletalk-query-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
