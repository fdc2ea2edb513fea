package com.lpgcert.database.migration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized Flyway configuration for the audit database.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * lpgcert:
 *   flyway:
 *     audit:
 *       url: jdbc:postgresql://localhost:5432/lpgcert
 *       username: lpgcert
 *       password: lpgcert_dev_password
 *       locations: classpath:db/migration/audit
 *       enabled: true
 * }</pre>
 *
 * @param audit audit database configuration
 */
@Validated
@ConfigurationProperties(prefix = "lpgcert.flyway")
public record FlywayConfigProperties(@NotNull @Valid DatabaseConfig audit) {

    /** Default classpath location of the audit migrations. */
    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/audit";

    /**
     * Configuration for a single database's Flyway instance.
     *
     * @param url JDBC connection URL (e.g., {@code jdbc:postgresql://localhost:5432/lpgcert})
     * @param username Database username
     * @param password Database password
     * @param locations Flyway migration locations, defaults to {@link #DEFAULT_LOCATIONS}
     * @param enabled Whether to run migrations for this database on startup
     */
    public record DatabaseConfig(
            @NotBlank String url,
            @NotBlank String username,
            String password,
            String locations,
            boolean enabled) {

        public DatabaseConfig {
            if (locations == null || locations.isBlank()) {
                locations = DEFAULT_LOCATIONS;
            }
        }
    }
}
