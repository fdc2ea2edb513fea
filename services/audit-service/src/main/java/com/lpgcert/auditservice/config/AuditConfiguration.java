package com.lpgcert.auditservice.config;

import com.lpgcert.auditservice.domain.AuditLogStore;
import com.lpgcert.auditservice.domain.emit.AuditLogger;
import com.lpgcert.auditservice.domain.enrichment.ContextEnricher;
import com.lpgcert.auditservice.domain.query.AuditQueryService;
import com.lpgcert.auditservice.domain.query.PageLimits;
import com.lpgcert.auditservice.domain.write.AuditDispatcher;
import com.lpgcert.auditservice.domain.write.AuditLogWriter;
import com.lpgcert.observability.MetricFactory;
import com.lpgcert.observability.SensitiveDataRedactor;
import com.lpgcert.security.UserDirectory;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the audit pipeline: enricher, writer, dispatcher, emitters and query service.
 *
 * <p>The store and the user directory come from {@link AuditStoreConfiguration}.
 */
@Configuration(proxyBeanMethods = false)
public class AuditConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock auditClock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    @Bean
    public ContextEnricher contextEnricher(
            UserDirectory userDirectory, SensitiveDataRedactor redactor, AuditProperties audit) {
        return new ContextEnricher(userDirectory, redactor, audit.captureRequestHeaders());
    }

    @Bean
    public AuditLogWriter auditLogWriter(
            AuditLogStore store, ContextEnricher enricher, Clock clock, MetricFactory metrics) {
        return new AuditLogWriter(store, enricher, clock, metrics);
    }

    /** Closed on shutdown, which drains queued entries for up to the configured timeout. */
    @Bean(destroyMethod = "close")
    public AuditDispatcher auditDispatcher(
            AuditLogWriter writer, AuditProperties audit, MetricFactory metrics) {
        return new AuditDispatcher(
                writer, audit.queueCapacity(), audit.workerThreads(), audit.drainTimeout(), metrics);
    }

    @Bean
    public AuditLogger auditLogger(AuditDispatcher dispatcher, SensitiveDataRedactor redactor) {
        return new AuditLogger(dispatcher, redactor);
    }

    @Bean
    public PageLimits pageLimits(AuditProperties audit) {
        return new PageLimits(audit.defaultPageSize(), audit.maxPageSize());
    }

    @Bean
    public AuditQueryService auditQueryService(
            AuditLogStore store, PageLimits limits, MetricFactory metrics) {
        return new AuditQueryService(store, limits, metrics);
    }
}
