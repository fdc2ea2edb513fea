package com.lpgcert.auditservice.domain.retention;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.lpgcert.auditmodel.AuditActions;
import com.lpgcert.auditmodel.AuditLogEntry;
import com.lpgcert.auditmodel.LogLevel;
import com.lpgcert.auditmodel.LogType;
import com.lpgcert.auditservice.domain.emit.AuditLogger;
import com.lpgcert.auditservice.testing.InMemoryAuditLogStore;
import com.lpgcert.observability.MetricFactory;
import com.lpgcert.security.testing.InMemoryUserDirectory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("AuditRetentionSweeper")
class AuditRetentionSweeperTest {

    private static final Instant NOW = Instant.parse("2025-06-01T03:30:00Z");

    private InMemoryAuditLogStore store;
    private AuditLogger auditLogger;
    private SimpleMeterRegistry registry;
    private AuditRetentionSweeper sweeper;

    @BeforeEach
    void setUp() {
        store = new InMemoryAuditLogStore(new InMemoryUserDirectory());
        auditLogger = mock(AuditLogger.class);
        registry = new SimpleMeterRegistry();
        sweeper =
                new AuditRetentionSweeper(
                        store,
                        auditLogger,
                        Clock.fixed(NOW, ZoneOffset.UTC),
                        730,
                        new MetricFactory(registry, "audit-service"));
    }

    private void append(String id, Duration age, boolean sensitive, Integer retentionDays) {
        store.append(
                AuditLogEntry.builder(LogType.USER_ACTIVITY, LogLevel.INFO)
                        .id(id)
                        .createdAt(NOW.minus(age))
                        .sensitive(sensitive)
                        .retentionDays(retentionDays)
                        .build());
    }

    @Test
    @DisplayName("deletes expired non-sensitive entries and records the cleanup")
    @SuppressWarnings("unchecked")
    void deletesExpired() {
        append("old", Duration.ofDays(800), false, null);
        append("recent", Duration.ofDays(10), false, null);
        append("old-sensitive", Duration.ofDays(800), true, null);
        append("short-lived", Duration.ofDays(40), false, 30);

        int deleted = sweeper.sweep();

        assertThat(deleted).isEqualTo(2);
        assertThat(store.entries())
                .extracting(AuditLogEntry::id)
                .containsExactlyInAnyOrder("recent", "old-sensitive");
        assertThat(registry.find("audit.retention.deleted").counter().count()).isEqualTo(2.0);

        ArgumentCaptor<Map<String, Object>> details = ArgumentCaptor.forClass(Map.class);
        verify(auditLogger)
                .logSystemEvent(
                        eq(LogLevel.INFO),
                        eq("Cleaned up 2 old audit log entries"),
                        eq(AuditActions.LOG_CLEANUP),
                        eq(AuditRetentionSweeper.MODULE),
                        details.capture(),
                        any());
        assertThat(details.getValue()).containsEntry("deleted_count", 2);
    }

    @Test
    @DisplayName("a failing store is logged as an error event")
    void storeFailure() {
        store.failWith(new IllegalStateException("lock timeout"));

        assertThat(sweeper.sweep()).isEqualTo(-1);

        verify(auditLogger)
                .logSystemEvent(
                        eq(LogLevel.ERROR),
                        startsWith("Audit log cleanup failed"),
                        eq(AuditActions.LOG_CLEANUP),
                        eq(AuditRetentionSweeper.MODULE),
                        any(),
                        any());
    }
}
