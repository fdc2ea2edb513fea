package com.lpgcert.auditservice.infrastructure.jdbc;

import com.lpgcert.auditmodel.AuditJson;
import com.lpgcert.auditmodel.AuditLogEntry;
import com.lpgcert.auditmodel.LogLevel;
import com.lpgcert.auditmodel.LogType;
import com.lpgcert.auditservice.domain.query.AuditLogView;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import org.springframework.jdbc.core.RowMapper;

/** Maps a row of {@code audit_logs_with_users} to an {@link AuditLogView}. */
class AuditLogRowMapper implements RowMapper<AuditLogView> {

    @Override
    public AuditLogView mapRow(ResultSet rs, int rowNum) throws SQLException {
        LogType logType = LogType.fromValue(rs.getString("log_type"));
        OffsetDateTime createdAt = rs.getObject("created_at", OffsetDateTime.class);
        AuditLogEntry entry =
                AuditLogEntry.builder(logType, LogLevel.fromValue(rs.getString("level")))
                        .id(rs.getString("id"))
                        .createdAt(createdAt == null ? null : createdAt.toInstant())
                        .action(rs.getString("action"))
                        .message(rs.getString("message"))
                        .userId(rs.getString("user_id"))
                        .userEmail(rs.getString("user_email"))
                        .userName(rs.getString("user_name"))
                        .userRole(rs.getString("user_role"))
                        .sessionId(rs.getString("session_id"))
                        .ipAddress(rs.getString("ip_address"))
                        .userAgent(rs.getString("user_agent"))
                        .requestMethod(rs.getString("request_method"))
                        .requestPath(rs.getString("request_path"))
                        .requestHeaders(AuditJson.readHeaders(rs.getString("request_headers")))
                        .resourceType(rs.getString("resource_type"))
                        .resourceId(rs.getString("resource_id"))
                        .resourceName(rs.getString("resource_name"))
                        .details(AuditJson.readDetails(logType, rs.getString("details")))
                        .module(rs.getString("module"))
                        .correlationId(rs.getString("correlation_id"))
                        .tenantId(rs.getString("tenant_id"))
                        .sensitive(rs.getBoolean("is_sensitive"))
                        .systemGenerated(rs.getBoolean("is_system_generated"))
                        .retentionDays(rs.getObject("retention_days", Integer.class))
                        .build();
        String joinedEmail = rs.getString("joined_user_email");
        return new AuditLogView(
                entry,
                rs.getString("username"),
                joinedEmail != null ? joinedEmail : entry.userEmail(),
                rs.getString("user_display_name"));
    }
}
