package com.lpgcert.auditservice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Audit subsystem settings, bound from {@code lpgcert.audit.*}.
 *
 * <pre>
 * lpgcert:
 *   audit:
 *     store: jdbc
 *     queue-capacity: 10000
 *     worker-threads: 2
 *     drain-timeout: 10s
 *     default-page-size: 50
 *     max-page-size: 100
 *     capture-request-headers: false
 *     api-request-logging: false
 *     retention:
 *       enabled: false
 *       default-days: 730
 *       cron: "0 30 3 * * *"
 * </pre>
 *
 * @param store backing store for entries and the user projection
 * @param queueCapacity pending entries held by the dispatcher before new ones are dropped
 * @param workerThreads dispatcher threads writing entries
 * @param drainTimeout how long shutdown waits for queued entries to be written
 * @param defaultPageSize page size when a query names none
 * @param maxPageSize upper bound a query's page size is clamped to
 * @param captureRequestHeaders whether redacted request headers are stored with each entry
 * @param apiRequestLogging whether every /api request is recorded as an {@code api} entry
 * @param retention retention sweep settings
 */
@ConfigurationProperties(prefix = "lpgcert.audit")
@Validated
public record AuditProperties(
        StoreType store,
        @Min(1) int queueCapacity,
        @Min(1) @Max(64) int workerThreads,
        Duration drainTimeout,
        @Min(1) int defaultPageSize,
        @Min(1) @Max(1000) int maxPageSize,
        boolean captureRequestHeaders,
        boolean apiRequestLogging,
        @Valid Retention retention) {

    public AuditProperties {
        if (store == null) {
            store = StoreType.JDBC;
        }
        if (queueCapacity <= 0) {
            queueCapacity = 10_000;
        }
        if (workerThreads <= 0) {
            workerThreads = 2;
        }
        if (drainTimeout == null || drainTimeout.isNegative()) {
            drainTimeout = Duration.ofSeconds(10);
        }
        if (defaultPageSize <= 0) {
            defaultPageSize = 50;
        }
        if (maxPageSize <= 0) {
            maxPageSize = 100;
        }
        if (retention == null) {
            retention = new Retention(false, 0, null);
        }
    }

    /** Where entries are stored. */
    public enum StoreType {
        JDBC,
        MEMORY
    }

    /**
     * @param enabled whether the scheduled sweep runs
     * @param defaultDays retention for entries that carry no {@code retention_days}
     * @param cron Spring cron expression of the sweep
     */
    public record Retention(boolean enabled, @Min(1) int defaultDays, @NotBlank String cron) {

        public Retention {
            if (defaultDays <= 0) {
                defaultDays = 730;
            }
            if (cron == null || cron.isBlank()) {
                cron = "0 30 3 * * *";
            }
        }
    }
}
