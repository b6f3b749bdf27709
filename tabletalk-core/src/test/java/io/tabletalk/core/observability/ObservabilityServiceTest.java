package io.tabletalk.core.observability;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ObservabilityServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldComputeQuerySummary() throws Exception {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        ObservabilityService service = new ObservabilityService(
            new FileAuditStore(tempDir.resolve("audit.jsonl")),
            clock
        );

        service.record(ObservabilityService.QUERY_STARTED, Map.of("query_id", "q1"));
        service.record(ObservabilityService.QUERY_SUCCEEDED, Map.of("query_id", "q1", "duration_ms", 420));
        service.record(ObservabilityService.QUERY_STARTED, Map.of("query_id", "q2"));
        service.record(ObservabilityService.QUERY_RETRIED, Map.of("query_id", "q2", "failure", "RATE_LIMITED"));
        service.record(ObservabilityService.QUERY_FAILED, Map.of("query_id", "q2", "duration_ms", 900, "failure", "RATE_LIMITED"));
        service.record(ObservabilityService.QUERY_STARTED, Map.of("query_id", "q3"));
        service.record(ObservabilityService.QUERY_RETRIED, Map.of("query_id", "q3", "failure", "TIMEOUT"));
        service.record(ObservabilityService.QUERY_SUCCEEDED, Map.of("query_id", "q3", "duration_ms", 1800));

        QueryStatsSummary summary = service.summary();

        assertThat(summary.queriesStarted()).isEqualTo(3);
        assertThat(summary.queriesSucceeded()).isEqualTo(2);
        assertThat(summary.queriesFailed()).isEqualTo(1);
        assertThat(summary.successRate()).isEqualTo(66.67);
        assertThat(summary.p50LatencyMs()).isEqualTo(420.0);
        assertThat(summary.p95LatencyMs()).isEqualTo(1800.0);
        assertThat(summary.retries()).isEqualTo(2);
        assertThat(summary.retryRecoveryRate()).isEqualTo(50.0);
        assertThat(summary.failuresByCategory()).containsExactly(Map.entry("RATE_LIMITED", 1));
        assertThat(summary.auditEvents()).isEqualTo(8);
        assertThat(service.recent(3))
            .extracting(AuditEvent::type)
            .containsExactly(
                ObservabilityService.QUERY_SUCCEEDED,
                ObservabilityService.QUERY_RETRIED,
                ObservabilityService.QUERY_STARTED
            );
    }

    @Test
    void shouldTreatCorruptAuditLogAsEmpty() throws Exception {
        Path log = tempDir.resolve("audit.jsonl");
        Files.writeString(log, "{ not json\n");
        ObservabilityService service = new ObservabilityService(new FileAuditStore(log), Clock.systemUTC());

        assertThat(service.summary().auditEvents()).isZero();

        service.record(ObservabilityService.QUERY_STARTED, Map.of("query_id", "q1"));
        assertThat(service.summary().queriesStarted()).isEqualTo(1);
    }

    @Test
    void shouldKeepNewestEventsWhenTrimming() throws Exception {
        Path log = tempDir.resolve("audit.jsonl");
        FileAuditStore store = new FileAuditStore(log);
        Files.writeString(log, "garbage\n");
        for (int i = 0; i < 5; i++) {
            store.append(new AuditEvent("e" + i, Instant.EPOCH, ObservabilityService.QUERY_STARTED, Map.of()));
        }

        store.trim(2);

        assertThat(store.load()).extracting(AuditEvent::id).containsExactly("e3", "e4");
        assertThat(Files.readAllLines(log)).hasSize(2);
    }
}
