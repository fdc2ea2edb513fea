package com.lpgcert.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the Flyway instance for the audit database and migrates it on startup.
 *
 * <p>Spring Boot's own Flyway auto-configuration should be disabled in services that import this
 * class ({@code spring.flyway.enabled: false}), so that only this instance touches the schema.
 *
 * <p>Active only when {@code lpgcert.flyway.audit.enabled=true}.
 *
 * @see FlywayConfigProperties
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(prefix = "lpgcert.flyway.audit", name = "enabled", havingValue = "true")
public class FlywayAuditDatabaseConfig {

    /** Bean name for the audit database Flyway instance. */
    public static final String AUDIT_FLYWAY_BEAN = "auditFlyway";

    /**
     * Flyway instance for the audit database. {@code migrate} runs when the bean is initialized.
     */
    @Bean(name = AUDIT_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway auditFlyway(FlywayConfigProperties properties) {
        return createFlyway(properties.audit());
    }

    static Flyway createFlyway(FlywayConfigProperties.DatabaseConfig config) {
        DataSource dataSource =
                DataSourceBuilder.create()
                        .url(config.url())
                        .username(config.username())
                        .password(config.password())
                        .build();

        return Flyway.configure()
                .dataSource(dataSource)
                .locations(config.locations())
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}
