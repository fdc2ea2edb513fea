package com.lpgcert.auditmodel;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Payload of {@code api} events.
 *
 * @param responseStatus HTTP status returned to the client
 * @param durationMs wall-clock handling time in milliseconds
 * @param extra extension fields
 */
public record ApiRequestDetails(int responseStatus, long durationMs, Map<String, Object> extra)
        implements AuditDetails {

    public static final String RESPONSE_STATUS = "response_status";
    public static final String DURATION_MS = "duration_ms";

    private static final Set<String> TYPED_KEYS = Set.of(RESPONSE_STATUS, DURATION_MS);

    public ApiRequestDetails {
        extra = DetailMaps.copyOf(extra);
    }

    public static ApiRequestDetails of(int responseStatus, long durationMs) {
        return new ApiRequestDetails(responseStatus, durationMs, Map.of());
    }

    /** Severity implied by the response status: 5xx is ERROR, 4xx is WARNING, anything else INFO. */
    public LogLevel impliedLevel() {
        if (responseStatus >= 500) {
            return LogLevel.ERROR;
        }
        if (responseStatus >= 400) {
            return LogLevel.WARNING;
        }
        return LogLevel.INFO;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(RESPONSE_STATUS, responseStatus);
        map.put(DURATION_MS, durationMs);
        return DetailMaps.withExtra(map, extra);
    }

    static ApiRequestDetails fromMap(Map<String, Object> values) {
        Long status = DetailMaps.number(values, RESPONSE_STATUS);
        Long duration = DetailMaps.number(values, DURATION_MS);
        return new ApiRequestDetails(
                status == null ? 0 : status.intValue(),
                duration == null ? 0L : duration,
                DetailMaps.remaining(values, TYPED_KEYS));
    }
}
