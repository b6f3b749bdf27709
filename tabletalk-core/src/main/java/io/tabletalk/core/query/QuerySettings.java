package io.tabletalk.core.query;

import io.tabletalk.core.config.model.QueryConfig;
import io.tabletalk.core.session.ContextWindowManager;
import java.time.Duration;

public record QuerySettings(
    int maxContextEntries,
    int contextTokenBudget,
    Duration invokeTimeout,
    Duration retryBackoff,
    boolean structuredVisualization,
    Duration deadline
) {
    public static final Duration DEFAULT_INVOKE_TIMEOUT = Duration.ofSeconds(50);
    public static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofSeconds(1);
    public static final Duration DEFAULT_DEADLINE = Duration.ofSeconds(110);
    static final Duration DEADLINE_SLACK = Duration.ofSeconds(1);

    public QuerySettings {
        invokeTimeout = positiveOr(invokeTimeout, DEFAULT_INVOKE_TIMEOUT);
        if (retryBackoff == null) {
            retryBackoff = DEFAULT_RETRY_BACKOFF;
        } else if (retryBackoff.isNegative()) {
            retryBackoff = Duration.ZERO;
        }
        deadline = positiveOr(deadline, fullRetryBudget(invokeTimeout, retryBackoff));
    }

    public QuerySettings(
        int maxContextEntries,
        int contextTokenBudget,
        Duration invokeTimeout,
        Duration retryBackoff,
        boolean structuredVisualization
    ) {
        this(maxContextEntries, contextTokenBudget, invokeTimeout, retryBackoff, structuredVisualization, null);
    }

    public static QuerySettings defaults() {
        return new QuerySettings(
            ContextWindowManager.DEFAULT_MAX_ENTRIES,
            0,
            DEFAULT_INVOKE_TIMEOUT,
            DEFAULT_RETRY_BACKOFF,
            true,
            DEFAULT_DEADLINE
        );
    }

    public static QuerySettings from(QueryConfig config) {
        if (config == null) {
            return defaults();
        }
        return new QuerySettings(
            config.maxContextEntries(),
            config.contextTokenBudget(),
            Duration.ofSeconds(config.invokeTimeoutSeconds()),
            Duration.ofMillis(config.retryBackoffMillis()),
            true,
            Duration.ofSeconds(config.deadlineSeconds())
        );
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }

    private static Duration fullRetryBudget(Duration invokeTimeout, Duration retryBackoff) {
        return invokeTimeout.multipliedBy(QueryExecutor.MAX_ATTEMPTS).plus(retryBackoff).plus(DEADLINE_SLACK);
    }
}
