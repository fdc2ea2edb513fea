package com.lpgcert.auditservice.api;

import com.lpgcert.auditservice.config.ServiceProperties;
import com.lpgcert.auditservice.domain.write.AuditDispatcher;
import com.lpgcert.auditservice.domain.write.DispatcherStats;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Service info endpoint with the audit dispatcher's queue statistics.
 *
 * <p>Actuator provides {@code /actuator/info} for build metadata; this endpoint adds
 * service-specific runtime information.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final ServiceProperties properties;
    private final AuditDispatcher dispatcher;

    public ServiceInfoController(ServiceProperties properties, AuditDispatcher dispatcher) {
        this.properties = properties;
        this.dispatcher = dispatcher;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        DispatcherStats stats = dispatcher.stats();
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description() != null ? properties.description() : "",
                "status", "running",
                "timestamp", Instant.now().toString(),
                "audit_dispatcher",
                        Map.of(
                                "queued", stats.queued(),
                                "remaining_capacity", stats.remainingCapacity(),
                                "active_workers", stats.activeWorkers(),
                                "completed", stats.completed(),
                                "dropped", stats.dropped()));
    }
}
