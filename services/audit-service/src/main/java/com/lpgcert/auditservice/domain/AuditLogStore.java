package com.lpgcert.auditservice.domain;

import com.lpgcert.auditmodel.AuditLogEntry;
import com.lpgcert.auditservice.domain.query.AuditLogQuery;
import com.lpgcert.auditservice.domain.query.AuditLogView;
import java.time.Instant;
import java.util.List;

/**
 * Append-only storage of audit entries.
 *
 * <p>There is no update operation. Implementations throw unchecked exceptions on failure; the
 * writer and query service turn those into degraded results.
 */
public interface AuditLogStore {

    /** Appends a fully populated entry (id and created_at already assigned). */
    void append(AuditLogEntry entry);

    /**
     * Returns the entries matching every filter of {@code query}, joined with the current user
     * projection, newest first (ties broken by id), windowed by the query's limit and offset.
     *
     * @param query a query whose limit and offset are already normalized
     */
    List<AuditLogView> search(AuditLogQuery query);

    /**
     * Deletes non-sensitive entries older than their retention horizon.
     *
     * @param now reference instant
     * @param defaultRetentionDays horizon for entries without {@code retention_days}
     * @return number of deleted entries
     */
    int deleteExpired(Instant now, int defaultRetentionDays);
}
