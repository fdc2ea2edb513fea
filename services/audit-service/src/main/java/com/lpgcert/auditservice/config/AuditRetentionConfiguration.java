package com.lpgcert.auditservice.config;

import com.lpgcert.auditservice.domain.AuditLogStore;
import com.lpgcert.auditservice.domain.emit.AuditLogger;
import com.lpgcert.auditservice.domain.retention.AuditRetentionSweeper;
import com.lpgcert.observability.MetricFactory;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Schedules the retention sweep when {@code lpgcert.audit.retention.enabled=true}. */
@Configuration(proxyBeanMethods = false)
@EnableScheduling
@ConditionalOnProperty(prefix = "lpgcert.audit.retention", name = "enabled", havingValue = "true")
public class AuditRetentionConfiguration {

    @Bean
    public AuditRetentionSweeper auditRetentionSweeper(
            AuditLogStore store,
            AuditLogger auditLogger,
            Clock clock,
            AuditProperties audit,
            MetricFactory metrics) {
        return new AuditRetentionSweeper(
                store, auditLogger, clock, audit.retention().defaultDays(), metrics);
    }
}
