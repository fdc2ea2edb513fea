package com.lpgcert.auditservice.api;

import com.lpgcert.auditservice.domain.query.AuditLogPage;
import com.lpgcert.auditservice.domain.query.AuditLogQuery;
import com.lpgcert.auditservice.domain.query.AuditQueryService;
import com.lpgcert.auditservice.domain.query.EmailLogView;
import com.lpgcert.auditservice.domain.query.SearchScope;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administrative read surface of the audit log. Access is gated by {@link
 * com.lpgcert.auditservice.infrastructure.web.AdminAccessInterceptor}.
 *
 * <p>When the store cannot be read the endpoints answer 200 with an empty page, {@code
 * available=false} and the {@value #DEGRADED_HEADER} header.
 */
@RestController
@RequestMapping("/api/v1/audit-logs")
public class AuditLogController {

    public static final String DEGRADED_HEADER = "X-Audit-Query-Degraded";

    private final AuditQueryService queryService;

    public AuditLogController(AuditQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping
    public ResponseEntity<PageResponse<AuditLogResponse>> search(
            @RequestParam(name = "log_type", required = false) String logType,
            @RequestParam(name = "level", required = false) String level,
            @RequestParam(name = "user_id", required = false) String userId,
            @RequestParam(name = "action", required = false) String action,
            @RequestParam(name = "correlation_id", required = false) String correlationId,
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "offset", required = false) Integer offset) {
        AuditLogQuery query =
                AuditLogQuery.builder()
                        .logType(QueryParameters.logType(logType))
                        .level(QueryParameters.level(level))
                        .userId(userId)
                        .action(action)
                        .correlationId(correlationId)
                        .start(QueryParameters.startDate(startDate))
                        .end(QueryParameters.endDate(endDate))
                        .search(search, SearchScope.ADMIN)
                        .limit(limit)
                        .offset(offset)
                        .build();
        var page = queryService.query(query);
        return respond(page, PageResponse.from(page, AuditLogResponse::from));
    }

    @GetMapping("/email")
    public ResponseEntity<PageResponse<EmailLogView>> emailLogs(
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "offset", required = false) Integer offset) {
        AuditLogPage<EmailLogView> page = queryService.emailLogs(status, limit, offset);
        return respond(page, PageResponse.from(page, view -> view));
    }

    @GetMapping("/system")
    public ResponseEntity<PageResponse<AuditLogResponse>> systemLogs(
            @RequestParam(name = "level", required = false) String level,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "offset", required = false) Integer offset) {
        var page = queryService.systemLogs(QueryParameters.level(level), limit, offset);
        return respond(page, PageResponse.from(page, AuditLogResponse::from));
    }

    @GetMapping("/correlation/{correlationId}")
    public ResponseEntity<PageResponse<AuditLogResponse>> byCorrelationId(
            @PathVariable("correlationId") String correlationId) {
        var page = queryService.byCorrelationId(correlationId);
        return respond(page, PageResponse.from(page, AuditLogResponse::from));
    }

    private static <T> ResponseEntity<PageResponse<T>> respond(AuditLogPage<?> page, PageResponse<T> body) {
        ResponseEntity.BodyBuilder response = ResponseEntity.ok();
        if (!page.available()) {
            response.header(DEGRADED_HEADER, "true");
        }
        return response.body(body);
    }
}
