package com.lpgcert.auditservice.infrastructure.lifecycle;

import com.lpgcert.auditmodel.AuditActions;
import com.lpgcert.auditmodel.LogLevel;
import com.lpgcert.auditservice.config.ServiceProperties;
import com.lpgcert.auditservice.domain.emit.AuditLogger;
import com.lpgcert.auditservice.domain.emit.EmitOptions;
import java.util.Map;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Records service startup and shutdown as system events. */
@Component
public class AuditLifecycleListener {

    static final String MODULE = "audit-service";

    private final AuditLogger auditLogger;
    private final ServiceProperties service;

    public AuditLifecycleListener(AuditLogger auditLogger, ServiceProperties service) {
        this.auditLogger = auditLogger;
        this.service = service;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        auditLogger.logSystemEvent(
                LogLevel.INFO,
                "Service " + service.name() + " started",
                AuditActions.SYSTEM_STARTUP,
                MODULE,
                Map.of("environment", service.environment()),
                EmitOptions.none());
    }

    /** Emitted before the dispatcher is closed, so the entry is drained with the rest of the queue. */
    @EventListener(ContextClosedEvent.class)
    public void onShutdown() {
        auditLogger.logSystemEvent(
                LogLevel.INFO,
                "Service " + service.name() + " stopping",
                AuditActions.SYSTEM_SHUTDOWN,
                MODULE,
                Map.of("environment", service.environment()),
                EmitOptions.none());
    }
}
