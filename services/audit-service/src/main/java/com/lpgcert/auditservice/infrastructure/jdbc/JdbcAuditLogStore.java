package com.lpgcert.auditservice.infrastructure.jdbc;

import com.lpgcert.auditmodel.AuditLogEntry;
import com.lpgcert.auditservice.domain.AuditLogStore;
import com.lpgcert.auditservice.domain.query.AuditLogQuery;
import com.lpgcert.auditservice.domain.query.AuditLogView;
import java.time.Instant;
import java.util.List;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * PostgreSQL {@link AuditLogStore}. Writes go to {@code audit_logs}, reads come from the {@code
 * audit_logs_with_users} view. Spring's {@code DataAccessException}s propagate to the writer and
 * query service.
 */
public class JdbcAuditLogStore implements AuditLogStore {

    private final NamedParameterJdbcTemplate jdbc;
    private final AuditLogRowMapper rowMapper = new AuditLogRowMapper();

    public JdbcAuditLogStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void append(AuditLogEntry entry) {
        jdbc.update(AuditLogSql.INSERT, AuditLogSql.insertParameters(entry));
    }

    @Override
    public List<AuditLogView> search(AuditLogQuery query) {
        AuditLogSql.Statement statement = AuditLogSql.search(query);
        return jdbc.query(statement.sql(), statement.parameters(), rowMapper);
    }

    @Override
    public int deleteExpired(Instant now, int defaultRetentionDays) {
        return jdbc.update(
                AuditLogSql.DELETE_EXPIRED, AuditLogSql.deleteExpiredParameters(now, defaultRetentionDays));
    }
}
