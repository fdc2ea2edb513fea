package com.lpgcert.auditservice.api;

import com.lpgcert.auditmodel.AuditLogEntry;
import com.lpgcert.auditservice.domain.query.AuditLogView;
import java.time.Instant;
import java.util.Map;

/** Wire form of an audit entry joined with its user. Serialized in snake_case. */
public record AuditLogResponse(
        String id,
        Instant createdAt,
        String logType,
        String level,
        String action,
        String message,
        String userId,
        String userEmail,
        String userName,
        String userRole,
        String username,
        String userDisplayName,
        String sessionId,
        String ipAddress,
        String userAgent,
        String requestMethod,
        String requestPath,
        Map<String, String> requestHeaders,
        String resourceType,
        String resourceId,
        String resourceName,
        Map<String, Object> details,
        String module,
        String correlationId,
        String tenantId,
        boolean isSensitive,
        boolean isSystemGenerated,
        Integer retentionDays) {

    public static AuditLogResponse from(AuditLogView view) {
        AuditLogEntry e = view.entry();
        return new AuditLogResponse(
                e.id(),
                e.createdAt(),
                e.logType().value(),
                e.level().value(),
                e.action(),
                e.message(),
                e.userId(),
                view.userEmail(),
                e.userName(),
                e.userRole(),
                view.username(),
                view.userDisplayName(),
                e.sessionId(),
                e.ipAddress(),
                e.userAgent(),
                e.requestMethod(),
                e.requestPath(),
                e.requestHeaders(),
                e.resourceType(),
                e.resourceId(),
                e.resourceName(),
                e.detailsMap(),
                e.module(),
                e.correlationId(),
                e.tenantId(),
                e.sensitive(),
                e.systemGenerated(),
                e.retentionDays());
    }
}
