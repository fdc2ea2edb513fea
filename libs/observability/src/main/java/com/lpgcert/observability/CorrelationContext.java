package com.lpgcert.observability;

/**
 * Immutable correlation context that flows through a request and every audit entry it emits.
 * <p>
 * Each inbound HTTP request establishes a {@code CorrelationContext}. Its values are injected into
 * the SLF4J MDC for log correlation and are captured by the audit emitters so that all entries
 * written on behalf of one request share a {@code correlation_id}.
 *
 * @param correlationId unique ID for the causal chain (e.g. a report submission and its emails)
 * @param tenantId      tenant the request belongs to (nullable for single-tenant deployments)
 * @param userId        acting user forwarded by the gateway (nullable for anonymous and system work)
 * @param requestId     unique ID for this specific request (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String userId,
        String requestId
) {

    /**
     * MDC key for correlation ID.
     */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /**
     * MDC key for tenant ID.
     */
    public static final String MDC_TENANT_ID = "tenantId";

    /**
     * MDC key for user ID.
     */
    public static final String MDC_USER_ID = "userId";

    /**
     * MDC key for request ID.
     */
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Context carrying only a correlation ID.
     */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null);
    }

    /**
     * Returns a copy with the given user ID.
     */
    public CorrelationContext withUserId(String newUserId) {
        return new CorrelationContext(correlationId, tenantId, newUserId, requestId);
    }
}
