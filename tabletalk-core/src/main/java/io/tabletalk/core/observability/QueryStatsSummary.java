package io.tabletalk.core.observability;

import java.util.Map;

public record QueryStatsSummary(
    int queriesStarted,
    int queriesSucceeded,
    int queriesFailed,
    double successRate,
    double p50LatencyMs,
    double p95LatencyMs,
    int retries,
    double retryRecoveryRate,
    Map<String, Integer> failuresByCategory,
    int auditEvents
) {
    public QueryStatsSummary {
        failuresByCategory = failuresByCategory == null ? Map.of() : Map.copyOf(failuresByCategory);
    }
}
