package com.lpgcert.auditservice.config;

import com.lpgcert.auditservice.domain.AuditLogStore;
import com.lpgcert.auditservice.infrastructure.jdbc.JdbcAuditLogStore;
import com.lpgcert.auditservice.infrastructure.jdbc.JdbcUserDirectory;
import com.lpgcert.auditservice.testing.InMemoryAuditLogStore;
import com.lpgcert.security.UserDirectory;
import com.lpgcert.security.testing.InMemoryUserDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** Selects the store backing the audit log from {@code lpgcert.audit.store}. */
public final class AuditStoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AuditStoreConfiguration.class);

    private AuditStoreConfiguration() {
        // holder for the nested configurations
    }

    /** PostgreSQL through Spring JDBC. The default. */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "lpgcert.audit", name = "store", havingValue = "jdbc", matchIfMissing = true)
    public static class Jdbc {

        @Bean
        public UserDirectory userDirectory(NamedParameterJdbcTemplate jdbc) {
            return new JdbcUserDirectory(jdbc);
        }

        @Bean
        public AuditLogStore auditLogStore(NamedParameterJdbcTemplate jdbc) {
            log.info("Audit log store: PostgreSQL (audit_logs)");
            return new JdbcAuditLogStore(jdbc);
        }
    }

    /** Process-local store for tests and local runs without a database. Entries are lost on exit. */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "lpgcert.audit", name = "store", havingValue = "memory")
    public static class Memory {

        @Bean
        public InMemoryUserDirectory userDirectory() {
            return new InMemoryUserDirectory();
        }

        @Bean
        public InMemoryAuditLogStore auditLogStore(InMemoryUserDirectory userDirectory) {
            log.warn("Audit log store: in-memory, entries are not persisted");
            return new InMemoryAuditLogStore(userDirectory);
        }
    }
}
