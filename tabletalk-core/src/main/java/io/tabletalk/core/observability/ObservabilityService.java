package io.tabletalk.core.observability;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

public final class ObservabilityService {
    public static final String QUERY_STARTED = "query_started";
    public static final String QUERY_SUCCEEDED = "query_succeeded";
    public static final String QUERY_FAILED = "query_failed";
    public static final String QUERY_RETRIED = "query_retried";

    static final int RETAINED_EVENTS = 20_000;
    private static final int TRIM_INTERVAL = 1_000;

    private final AuditStore store;
    private final Clock clock;
    private int appendedSinceTrim;

    public ObservabilityService(AuditStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized AuditEvent record(String type, Map<String, Object> attributes) throws IOException {
        AuditEvent event = new AuditEvent(UUID.randomUUID().toString(), clock.instant(), type, attributes);
        store.append(event);
        if (++appendedSinceTrim >= TRIM_INTERVAL) {
            appendedSinceTrim = 0;
            store.trim(RETAINED_EVENTS);
        }
        return event;
    }

    public synchronized List<AuditEvent> recent(int limit) throws IOException {
        List<AuditEvent> all = store.load();
        List<AuditEvent> tail = new ArrayList<>(all.subList(Math.max(0, all.size() - Math.max(1, limit)), all.size()));
        Collections.reverse(tail);
        return tail;
    }

    public synchronized QueryStatsSummary summary() throws IOException {
        List<AuditEvent> all = store.load();

        int started = 0;
        int succeeded = 0;
        int failed = 0;
        int retries = 0;
        List<Double> latencies = new ArrayList<>();
        Map<String, Integer> failuresByCategory = new TreeMap<>();
        Set<String> retriedQueries = new HashSet<>();
        Set<String> succeededQueries = new HashSet<>();

        for (AuditEvent event : all) {
            switch (event.type()) {
                case QUERY_STARTED -> started++;
                case QUERY_SUCCEEDED -> {
                    succeeded++;
                    addIfPresent(succeededQueries, event.attribute("query_id"));
                    Double duration = toDouble(event.attributes().get("duration_ms"));
                    if (duration != null && duration >= 0) {
                        latencies.add(duration);
                    }
                }
                case QUERY_FAILED -> {
                    failed++;
                    String failure = event.attribute("failure");
                    failuresByCategory.merge(failure.isBlank() ? "UNKNOWN" : failure, 1, Integer::sum);
                }
                case QUERY_RETRIED -> {
                    retries++;
                    addIfPresent(retriedQueries, event.attribute("query_id"));
                }
                default -> {
                }
            }
        }
        Collections.sort(latencies);

        int recovered = (int) retriedQueries.stream().filter(succeededQueries::contains).count();
        return new QueryStatsSummary(
            started,
            succeeded,
            failed,
            round2(percentage(succeeded, started)),
            round2(nearestRank(latencies, 50)),
            round2(nearestRank(latencies, 95)),
            retries,
            round2(percentage(recovered, retriedQueries.size())),
            failuresByCategory,
            all.size()
        );
    }

    private static void addIfPresent(Set<String> ids, String id) {
        if (!id.isBlank()) {
            ids.add(id);
        }
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value == null) {
            return null;
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static double nearestRank(List<Double> sorted, int percentile) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        int rank = (int) Math.ceil(percentile / 100.0 * sorted.size());
        return sorted.get(Math.max(0, Math.min(sorted.size() - 1, rank - 1)));
    }

    private static double percentage(int numerator, int denominator) {
        return denominator <= 0 ? 0.0 : numerator * 100.0 / denominator;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
