package com.lpgcert.auditservice.domain.query;

import com.lpgcert.auditmodel.LogLevel;
import com.lpgcert.auditmodel.LogType;
import com.lpgcert.auditservice.domain.AuditLogStore;
import com.lpgcert.observability.MetricFactory;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read side of the audit log.
 *
 * <p>A failing store never surfaces as an exception: the failure is logged, counted in {@code
 * audit.queries.failed} and answered with an empty page flagged unavailable.
 */
public class AuditQueryService {

    private static final Logger log = LoggerFactory.getLogger(AuditQueryService.class);

    private final AuditLogStore store;
    private final PageLimits limits;
    private final MetricFactory metrics;

    public AuditQueryService(AuditLogStore store, PageLimits limits, MetricFactory metrics) {
        this.store = store;
        this.limits = limits;
        this.metrics = metrics;
    }

    public AuditLogPage<AuditLogView> query(AuditLogQuery query) {
        AuditLogQuery normalized = query.normalized(limits);
        try {
            List<AuditLogView> items = store.search(normalized);
            return new AuditLogPage<>(items, normalized.limit(), normalized.offset(), true);
        } catch (RuntimeException e) {
            log.error("Audit log query failed: {}", normalized, e);
            metrics.counter("audit.queries.failed", "Audit log queries that could not be served")
                    .increment();
            return AuditLogPage.unavailable(normalized.limit(), normalized.offset());
        }
    }

    /** Email entries, optionally restricted to one delivery status, newest first. */
    public AuditLogPage<EmailLogView> emailLogs(String status, Integer limit, Integer offset) {
        return query(
                        AuditLogQuery.builder()
                                .logType(LogType.EMAIL)
                                .status(status)
                                .limit(limit)
                                .offset(offset)
                                .build())
                .map(EmailLogView::from);
    }

    /** System entries, optionally restricted to one level, newest first. */
    public AuditLogPage<AuditLogView> systemLogs(LogLevel level, Integer limit, Integer offset) {
        return query(
                AuditLogQuery.builder()
                        .logType(LogType.SYSTEM)
                        .level(level)
                        .limit(limit)
                        .offset(offset)
                        .build());
    }

    /** Every entry of one causal chain, up to the maximum page size, newest first. */
    public AuditLogPage<AuditLogView> byCorrelationId(String correlationId) {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
        return query(
                AuditLogQuery.builder()
                        .correlationId(correlationId)
                        .limit(limits.maxLimit())
                        .build());
    }
}
