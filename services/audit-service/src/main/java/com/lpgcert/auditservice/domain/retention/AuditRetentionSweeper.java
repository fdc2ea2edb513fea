package com.lpgcert.auditservice.domain.retention;

import com.lpgcert.auditmodel.AuditActions;
import com.lpgcert.auditmodel.LogLevel;
import com.lpgcert.auditservice.domain.AuditLogStore;
import com.lpgcert.auditservice.domain.emit.AuditLogger;
import com.lpgcert.auditservice.domain.emit.EmitOptions;
import com.lpgcert.observability.MetricFactory;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodically deletes non-sensitive entries past their retention horizon and records the
 * cleanup as a {@code LOG_CLEANUP} system event.
 */
public class AuditRetentionSweeper {

    static final String MODULE = "audit-retention";

    private static final Logger log = LoggerFactory.getLogger(AuditRetentionSweeper.class);

    private final AuditLogStore store;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final int defaultRetentionDays;
    private final MetricFactory metrics;

    public AuditRetentionSweeper(
            AuditLogStore store,
            AuditLogger auditLogger,
            Clock clock,
            int defaultRetentionDays,
            MetricFactory metrics) {
        if (defaultRetentionDays < 1) {
            throw new IllegalArgumentException("defaultRetentionDays must be >= 1");
        }
        this.store = store;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.defaultRetentionDays = defaultRetentionDays;
        this.metrics = metrics;
    }

    /**
     * Runs one sweep.
     *
     * @return number of deleted entries, or -1 if the store failed
     */
    @Scheduled(cron = "${lpgcert.audit.retention.cron:0 30 3 * * *}")
    public int sweep() {
        int deleted;
        try {
            deleted = store.deleteExpired(clock.instant(), defaultRetentionDays);
        } catch (RuntimeException e) {
            log.error("Audit retention sweep failed", e);
            auditLogger.logSystemEvent(
                    LogLevel.ERROR,
                    "Audit log cleanup failed: " + e.getMessage(),
                    AuditActions.LOG_CLEANUP,
                    MODULE,
                    null,
                    EmitOptions.none());
            return -1;
        }
        metrics.counter("audit.retention.deleted", "Audit entries removed by the retention sweep")
                .increment(deleted);
        log.info("Audit retention sweep deleted {} entries", deleted);
        auditLogger.logSystemEvent(
                LogLevel.INFO,
                "Cleaned up " + deleted + " old audit log entries",
                AuditActions.LOG_CLEANUP,
                MODULE,
                Map.of("deleted_count", deleted, "default_retention_days", defaultRetentionDays),
                EmitOptions.none());
        return deleted;
    }
}
