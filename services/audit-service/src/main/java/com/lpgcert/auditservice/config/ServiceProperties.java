package com.lpgcert.auditservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code lpgcert.service.*}.
 *
 * <pre>
 * lpgcert:
 *   service:
 *     name: audit-service
 *     environment: production
 *     description: Unified audit log
 * </pre>
 *
 * @param name Service name used for logging and the metrics {@code service} tag. Required.
 * @param environment Deployment environment (development, staging, production).
 * @param description Human-readable service description for /api/v1/info.
 */
@ConfigurationProperties(prefix = "lpgcert.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment, String description) {

    /** Defaults run before Bean Validation, so they satisfy the constraints. */
    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
