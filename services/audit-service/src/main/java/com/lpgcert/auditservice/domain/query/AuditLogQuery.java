package com.lpgcert.auditservice.domain.query;

import com.lpgcert.auditmodel.LogLevel;
import com.lpgcert.auditmodel.LogType;
import java.time.Instant;

/**
 * Filters over the audit log. Every filter is optional; present filters are AND-combined.
 *
 * @param logType exact category
 * @param level exact level
 * @param userId exact acting user
 * @param action exact action
 * @param correlationId exact correlation id
 * @param status exact {@code details.status} (email delivery status)
 * @param start inclusive lower bound on created_at
 * @param end inclusive upper bound on created_at
 * @param search case-insensitive substring over the columns of {@code searchScope}
 * @param searchScope defaults to {@link SearchScope#MESSAGE}
 * @param limit page size, normalized by {@link PageLimits}
 * @param offset entries to skip, normalized by {@link PageLimits}
 */
public record AuditLogQuery(
        LogType logType,
        LogLevel level,
        String userId,
        String action,
        String correlationId,
        String status,
        Instant start,
        Instant end,
        String search,
        SearchScope searchScope,
        Integer limit,
        Integer offset) {

    public AuditLogQuery {
        userId = blankToNull(userId);
        action = blankToNull(action);
        correlationId = blankToNull(correlationId);
        status = blankToNull(status);
        search = blankToNull(search);
        if (searchScope == null) {
            searchScope = SearchScope.MESSAGE;
        }
        if (start != null && end != null && end.isBefore(start)) {
            throw new IllegalArgumentException("end_date must not be before start_date");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Query with no filters and default paging. */
    public static AuditLogQuery all() {
        return builder().build();
    }

    /** Copy with the paging normalized by {@code limits}. */
    public AuditLogQuery normalized(PageLimits limits) {
        return new AuditLogQuery(
                logType,
                level,
                userId,
                action,
                correlationId,
                status,
                start,
                end,
                search,
                searchScope,
                limits.limit(limit),
                limits.offset(offset));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public static final class Builder {
        private LogType logType;
        private LogLevel level;
        private String userId;
        private String action;
        private String correlationId;
        private String status;
        private Instant start;
        private Instant end;
        private String search;
        private SearchScope searchScope;
        private Integer limit;
        private Integer offset;

        private Builder() {}

        public Builder logType(LogType logType) {
            this.logType = logType;
            return this;
        }

        public Builder level(LogLevel level) {
            this.level = level;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder start(Instant start) {
            this.start = start;
            return this;
        }

        public Builder end(Instant end) {
            this.end = end;
            return this;
        }

        public Builder search(String search, SearchScope scope) {
            this.search = search;
            this.searchScope = scope;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code end} is before {@code start}
         */
        public AuditLogQuery build() {
            return new AuditLogQuery(
                    logType,
                    level,
                    userId,
                    action,
                    correlationId,
                    status,
                    start,
                    end,
                    search,
                    searchScope,
                    limit,
                    offset);
        }
    }
}
