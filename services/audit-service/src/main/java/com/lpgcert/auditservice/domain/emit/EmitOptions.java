package com.lpgcert.auditservice.domain.emit;

import com.lpgcert.auditmodel.LogLevel;
import com.lpgcert.auditservice.domain.enrichment.RequestSnapshot;

/**
 * Optional cross-cutting inputs of an emitter call.
 *
 * <p>A null correlation or tenant id falls back to the calling thread's correlation context.
 *
 * @param level overrides the emitter's default level
 * @param request snapshot of the triggering request
 * @param correlationId groups this entry with related ones
 * @param sessionId session of the acting user
 * @param tenantId tenant of the event
 */
public record EmitOptions(
        LogLevel level,
        RequestSnapshot request,
        String correlationId,
        String sessionId,
        String tenantId) {

    private static final EmitOptions NONE = new EmitOptions(null, null, null, null, null);

    public static EmitOptions none() {
        return NONE;
    }

    public static EmitOptions of(RequestSnapshot request) {
        return NONE.withRequest(request);
    }

    public EmitOptions withLevel(LogLevel newLevel) {
        return new EmitOptions(newLevel, request, correlationId, sessionId, tenantId);
    }

    public EmitOptions withRequest(RequestSnapshot newRequest) {
        return new EmitOptions(level, newRequest, correlationId, sessionId, tenantId);
    }

    public EmitOptions withCorrelationId(String newCorrelationId) {
        return new EmitOptions(level, request, newCorrelationId, sessionId, tenantId);
    }

    public EmitOptions withSessionId(String newSessionId) {
        return new EmitOptions(level, request, correlationId, newSessionId, tenantId);
    }

    public EmitOptions withTenantId(String newTenantId) {
        return new EmitOptions(level, request, correlationId, sessionId, newTenantId);
    }

    LogLevel levelOr(LogLevel fallback) {
        return level != null ? level : fallback;
    }
}
