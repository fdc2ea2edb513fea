package com.lpgcert.auditservice.infrastructure.jdbc;

import com.lpgcert.auditmodel.AuditJson;
import com.lpgcert.auditmodel.AuditLogEntry;
import com.lpgcert.auditservice.domain.query.AuditLogQuery;
import com.lpgcert.auditservice.domain.query.SearchScope;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/** SQL text and parameter binding for the {@code audit_logs} table and its read view. */
final class AuditLogSql {

    static final String INSERT =
            """
            INSERT INTO audit_logs (
                id, created_at, log_type, level, action, message,
                user_id, user_email, user_name, user_role, session_id,
                ip_address, user_agent, request_method, request_path, request_headers,
                resource_type, resource_id, resource_name, details,
                module, correlation_id, tenant_id,
                is_sensitive, is_system_generated, retention_days)
            VALUES (
                CAST(:id AS uuid), :created_at, :log_type, :level, :action, :message,
                :user_id, :user_email, :user_name, :user_role, :session_id,
                :ip_address, :user_agent, :request_method, :request_path, CAST(:request_headers AS jsonb),
                :resource_type, :resource_id, :resource_name, CAST(:details AS jsonb),
                :module, :correlation_id, :tenant_id,
                :is_sensitive, :is_system_generated, :retention_days)
            """;

    static final String DELETE_EXPIRED =
            """
            DELETE FROM audit_logs
            WHERE is_sensitive = FALSE
              AND created_at < :now - make_interval(days => COALESCE(retention_days, :default_days))
            """;

    static final String SELECT_FROM_VIEW = "SELECT * FROM audit_logs_with_users";
    static final String ORDER_AND_PAGE = " ORDER BY created_at DESC, id LIMIT :limit OFFSET :offset";

    private AuditLogSql() {
        // utility class
    }

    /** Statement text with its bound parameters. */
    record Statement(String sql, MapSqlParameterSource parameters) {}

    static MapSqlParameterSource insertParameters(AuditLogEntry entry) {
        return new MapSqlParameterSource()
                .addValue("id", entry.id())
                .addValue("created_at", timestamp(entry.createdAt()), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("log_type", entry.logType().value())
                .addValue("level", entry.level().value())
                .addValue("action", entry.action())
                .addValue("message", entry.message())
                .addValue("user_id", entry.userId())
                .addValue("user_email", entry.userEmail())
                .addValue("user_name", entry.userName())
                .addValue("user_role", entry.userRole())
                .addValue("session_id", entry.sessionId())
                .addValue("ip_address", entry.ipAddress())
                .addValue("user_agent", entry.userAgent())
                .addValue("request_method", entry.requestMethod())
                .addValue("request_path", entry.requestPath())
                .addValue("request_headers", AuditJson.writeHeaders(entry.requestHeaders()), Types.VARCHAR)
                .addValue("resource_type", entry.resourceType())
                .addValue("resource_id", entry.resourceId())
                .addValue("resource_name", entry.resourceName())
                .addValue("details", AuditJson.writeDetails(entry.details()), Types.VARCHAR)
                .addValue("module", entry.module())
                .addValue("correlation_id", entry.correlationId())
                .addValue("tenant_id", entry.tenantId())
                .addValue("is_sensitive", entry.sensitive())
                .addValue("is_system_generated", entry.systemGenerated())
                .addValue("retention_days", entry.retentionDays(), Types.INTEGER);
    }

    static MapSqlParameterSource deleteExpiredParameters(Instant now, int defaultRetentionDays) {
        return new MapSqlParameterSource()
                .addValue("now", timestamp(now), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("default_days", defaultRetentionDays);
    }

    /**
     * Builds the filtered, ordered and paged select over {@code audit_logs_with_users}.
     *
     * @param query a query whose limit and offset are already normalized
     */
    static Statement search(AuditLogQuery query) {
        List<String> conditions = new ArrayList<>();
        MapSqlParameterSource parameters = new MapSqlParameterSource();
        if (query.logType() != null) {
            conditions.add("log_type = :log_type");
            parameters.addValue("log_type", query.logType().value());
        }
        if (query.level() != null) {
            conditions.add("level = :level");
            parameters.addValue("level", query.level().value());
        }
        equality(conditions, parameters, "user_id", query.userId());
        equality(conditions, parameters, "action", query.action());
        equality(conditions, parameters, "correlation_id", query.correlationId());
        if (query.status() != null) {
            conditions.add("details ->> 'status' = :status");
            parameters.addValue("status", query.status());
        }
        if (query.start() != null) {
            conditions.add("created_at >= :start_date");
            parameters.addValue("start_date", timestamp(query.start()), Types.TIMESTAMP_WITH_TIMEZONE);
        }
        if (query.end() != null) {
            conditions.add("created_at <= :end_date");
            parameters.addValue("end_date", timestamp(query.end()), Types.TIMESTAMP_WITH_TIMEZONE);
        }
        if (query.search() != null) {
            conditions.add(searchCondition(query.searchScope()));
            parameters.addValue("search", likePattern(query.search()));
        }
        parameters.addValue("limit", query.limit());
        parameters.addValue("offset", query.offset());

        StringBuilder sql = new StringBuilder(SELECT_FROM_VIEW);
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        sql.append(ORDER_AND_PAGE);
        return new Statement(sql.toString(), parameters);
    }

    /** Wraps {@code term} in {@code %} after escaping LIKE wildcards. */
    static String likePattern(String term) {
        String escaped =
                term.toLowerCase(Locale.ROOT)
                        .replace("\\", "\\\\")
                        .replace("%", "\\%")
                        .replace("_", "\\_");
        return "%" + escaped + "%";
    }

    private static String searchCondition(SearchScope scope) {
        if (scope == SearchScope.ADMIN) {
            return "(message ILIKE :search OR action ILIKE :search"
                    + " OR username ILIKE :search OR user_email ILIKE :search)";
        }
        return "message ILIKE :search";
    }

    private static void equality(
            List<String> conditions, MapSqlParameterSource parameters, String column, String value) {
        if (value != null) {
            conditions.add(column + " = :" + column);
            parameters.addValue(column, value);
        }
    }

    private static OffsetDateTime timestamp(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
