package com.lpgcert.auditservice.domain.write;

import com.lpgcert.auditmodel.AuditLogEntry;
import com.lpgcert.auditmodel.AuditLogEntryValidator;
import com.lpgcert.auditmodel.ValidationResult;
import com.lpgcert.auditservice.domain.AuditLogStore;
import com.lpgcert.auditservice.domain.enrichment.ContextEnricher;
import com.lpgcert.auditservice.domain.enrichment.RequestSnapshot;
import com.lpgcert.observability.MetricFactory;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates, completes and appends a single entry.
 *
 * <p>{@link #write} never throws. Every failure (rejected entry, enrichment bug, storage error or
 * timeout) is reported on the {@value #OPERATIONAL_LOGGER} logger, counted in {@code
 * audit.entries.failed} and returned as {@link Optional#empty()}. Failed writes are not retried.
 */
public class AuditLogWriter {

    /** Logger dedicated to failures of the audit pipeline itself. */
    public static final String OPERATIONAL_LOGGER = "lpgcert.audit.operational";

    private static final Logger operational = LoggerFactory.getLogger(OPERATIONAL_LOGGER);

    private final AuditLogStore store;
    private final ContextEnricher enricher;
    private final Clock clock;
    private final MetricFactory metrics;

    public AuditLogWriter(
            AuditLogStore store, ContextEnricher enricher, Clock clock, MetricFactory metrics) {
        this.store = store;
        this.enricher = enricher;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Writes the entry.
     *
     * @param entry partial entry from an emitter; its id and created_at are replaced
     * @param request snapshot of the triggering request, nullable
     * @return the id of the stored entry, or empty if nothing was stored
     */
    public Optional<String> write(AuditLogEntry entry, RequestSnapshot request) {
        ValidationResult validation = AuditLogEntryValidator.validate(entry);
        if (!validation.valid()) {
            operational.error("Rejected audit entry: {}", validation.errors());
            countFailure("invalid");
            return Optional.empty();
        }
        try {
            String id = UUID.randomUUID().toString();
            AuditLogEntry complete =
                    enricher.enrich(entry, request).toBuilder()
                            .id(id)
                            .createdAt(clock.instant().truncatedTo(ChronoUnit.MICROS))
                            .build();
            store.append(complete);
            metrics.counter(
                            "audit.entries.written",
                            "Audit entries persisted",
                            "log_type",
                            complete.logType().value())
                    .increment();
            return Optional.of(id);
        } catch (RuntimeException e) {
            operational.error(
                    "Failed to write audit entry log_type={} action={}",
                    entry.logType().value(),
                    entry.action(),
                    e);
            countFailure("storage");
            return Optional.empty();
        }
    }

    private void countFailure(String reason) {
        metrics.counter("audit.entries.failed", "Audit entries that could not be written", "reason", reason)
                .increment();
    }
}
