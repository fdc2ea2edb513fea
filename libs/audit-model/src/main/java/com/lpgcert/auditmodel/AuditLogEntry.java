package com.lpgcert.auditmodel;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One immutable record of something that happened, tagged with a category and a severity.
 *
 * <p>Entries are assembled by the domain emitters, completed (id, timestamp, request and user
 * context) by the writer, and never modified after they are stored. Only {@link #logType()} and
 * {@link #level()} are mandatory; see {@link AuditLogEntryValidator}.
 *
 * @param id opaque unique identifier, assigned at write time
 * @param createdAt write timestamp, assigned at write time
 * @param logType immutable classification
 * @param level severity
 * @param action machine-readable verb, see {@link AuditActions}
 * @param message human-readable summary
 * @param userId acting user, null for system-generated events
 * @param userEmail acting user's email at write time
 * @param userName acting user's display name at write time
 * @param userRole acting user's role at write time
 * @param sessionId session of the acting user
 * @param ipAddress client address derived from the request
 * @param userAgent client user agent
 * @param requestMethod HTTP method of the triggering request
 * @param requestPath path of the triggering request, without query string
 * @param requestHeaders redacted request headers, null unless header capture is enabled
 * @param resourceType kind of object the event concerns (e.g. "file", "app_settings")
 * @param resourceId identifier of that object
 * @param resourceName display name of that object
 * @param details category-specific payload
 * @param module emitting module for system events
 * @param correlationId groups entries from one causal chain
 * @param tenantId tenant the event belongs to
 * @param sensitive requires stricter access and is exempt from the retention sweep
 * @param systemGenerated true for automated events, false for user-triggered ones
 * @param retentionDays advisory expiry horizon, null means the configured default
 */
public record AuditLogEntry(
        String id,
        Instant createdAt,
        LogType logType,
        LogLevel level,
        String action,
        String message,
        String userId,
        String userEmail,
        String userName,
        String userRole,
        String sessionId,
        String ipAddress,
        String userAgent,
        String requestMethod,
        String requestPath,
        Map<String, String> requestHeaders,
        String resourceType,
        String resourceId,
        String resourceName,
        AuditDetails details,
        String module,
        String correlationId,
        String tenantId,
        boolean sensitive,
        boolean systemGenerated,
        Integer retentionDays) {

    public AuditLogEntry {
        if (requestHeaders != null) {
            requestHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(requestHeaders));
        }
    }

    public static Builder builder(LogType logType, LogLevel level) {
        return new Builder().logType(logType).level(level);
    }

    /** Returns a builder pre-populated with every field of this entry. */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .createdAt(createdAt)
                .logType(logType)
                .level(level)
                .action(action)
                .message(message)
                .userId(userId)
                .userEmail(userEmail)
                .userName(userName)
                .userRole(userRole)
                .sessionId(sessionId)
                .ipAddress(ipAddress)
                .userAgent(userAgent)
                .requestMethod(requestMethod)
                .requestPath(requestPath)
                .requestHeaders(requestHeaders)
                .resourceType(resourceType)
                .resourceId(resourceId)
                .resourceName(resourceName)
                .details(details)
                .module(module)
                .correlationId(correlationId)
                .tenantId(tenantId)
                .sensitive(sensitive)
                .systemGenerated(systemGenerated)
                .retentionDays(retentionDays);
    }

    /** Flattened details, empty when the entry carries none. */
    public Map<String, Object> detailsMap() {
        return details == null ? Map.of() : details.toMap();
    }

    public static final class Builder {
        private String id;
        private Instant createdAt;
        private LogType logType;
        private LogLevel level;
        private String action;
        private String message;
        private String userId;
        private String userEmail;
        private String userName;
        private String userRole;
        private String sessionId;
        private String ipAddress;
        private String userAgent;
        private String requestMethod;
        private String requestPath;
        private Map<String, String> requestHeaders;
        private String resourceType;
        private String resourceId;
        private String resourceName;
        private AuditDetails details;
        private String module;
        private String correlationId;
        private String tenantId;
        private boolean sensitive;
        private boolean systemGenerated;
        private Integer retentionDays;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder logType(LogType logType) {
            this.logType = logType;
            return this;
        }

        public Builder level(LogLevel level) {
            this.level = level;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder userEmail(String userEmail) {
            this.userEmail = userEmail;
            return this;
        }

        public Builder userName(String userName) {
            this.userName = userName;
            return this;
        }

        public Builder userRole(String userRole) {
            this.userRole = userRole;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder requestMethod(String requestMethod) {
            this.requestMethod = requestMethod;
            return this;
        }

        public Builder requestPath(String requestPath) {
            this.requestPath = requestPath;
            return this;
        }

        public Builder requestHeaders(Map<String, String> requestHeaders) {
            this.requestHeaders = requestHeaders;
            return this;
        }

        public Builder resourceType(String resourceType) {
            this.resourceType = resourceType;
            return this;
        }

        public Builder resourceId(String resourceId) {
            this.resourceId = resourceId;
            return this;
        }

        public Builder resourceName(String resourceName) {
            this.resourceName = resourceName;
            return this;
        }

        public Builder details(AuditDetails details) {
            this.details = details;
            return this;
        }

        public Builder module(String module) {
            this.module = module;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder sensitive(boolean sensitive) {
            this.sensitive = sensitive;
            return this;
        }

        public Builder systemGenerated(boolean systemGenerated) {
            this.systemGenerated = systemGenerated;
            return this;
        }

        public Builder retentionDays(Integer retentionDays) {
            this.retentionDays = retentionDays;
            return this;
        }

        public AuditLogEntry build() {
            return new AuditLogEntry(
                    id,
                    createdAt,
                    logType,
                    level,
                    action,
                    message,
                    userId,
                    userEmail,
                    userName,
                    userRole,
                    sessionId,
                    ipAddress,
                    userAgent,
                    requestMethod,
                    requestPath,
                    requestHeaders,
                    resourceType,
                    resourceId,
                    resourceName,
                    details,
                    module,
                    correlationId,
                    tenantId,
                    sensitive,
                    systemGenerated,
                    retentionDays);
        }
    }
}
