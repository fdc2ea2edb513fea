package com.lpgcert.auditservice;

import com.lpgcert.auditservice.config.AuditProperties;
import com.lpgcert.auditservice.config.ServiceProperties;
import com.lpgcert.database.migration.FlywayAuditDatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * Audit service: the unified audit/event log of the LPG cylinder test-certificate application.
 *
 * <p>Collaborators record events through {@link com.lpgcert.auditservice.domain.emit.AuditLogger};
 * administrators read them through the {@code /api/v1/audit-logs} endpoints.
 *
 * <ul>
 *   <li>Graceful shutdown drains the audit dispatcher queue
 *   <li>Actuator health, metrics, Prometheus endpoints
 *   <li>Correlation ID propagation into the MDC and every emitted entry
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties({ServiceProperties.class, AuditProperties.class})
@Import(FlywayAuditDatabaseConfig.class)
public class AuditServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AuditServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuditServiceApplication.class, args);
        log.info("LPG Cert audit service started successfully");
    }
}
