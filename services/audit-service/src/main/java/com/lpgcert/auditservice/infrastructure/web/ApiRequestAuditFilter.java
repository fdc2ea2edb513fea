package com.lpgcert.auditservice.infrastructure.web;

import com.lpgcert.auditservice.domain.emit.AuditLogger;
import com.lpgcert.auditservice.domain.emit.EmitOptions;
import com.lpgcert.auditservice.domain.enrichment.RequestSnapshot;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Records one {@code api} entry per {@code /api/**} request with its status and duration.
 *
 * <p>Enabled by {@code lpgcert.audit.api-request-logging=true}. Runs right after {@link
 * CorrelationIdFilter} so the entry shares the request's correlation id.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@ConditionalOnProperty(prefix = "lpgcert.audit", name = "api-request-logging", havingValue = "true")
public class ApiRequestAuditFilter extends OncePerRequestFilter {

    static final String API_PREFIX = "/api/";

    private final AuditLogger auditLogger;

    public ApiRequestAuditFilter(AuditLogger auditLogger) {
        this.auditLogger = auditLogger;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(API_PREFIX);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        RequestSnapshot snapshot = ServletRequestSnapshots.from(request);
        long started = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long durationMs = (System.nanoTime() - started) / 1_000_000;
            auditLogger.logApiRequest(
                    snapshot,
                    response.getStatus(),
                    durationMs,
                    snapshot.header(CorrelationIdFilter.USER_ID_HEADER),
                    EmitOptions.none());
        }
    }
}
