package com.lpgcert.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import org.flywaydb.core.api.Location;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

@DisplayName("FlywayAuditDatabaseConfig")
class FlywayAuditDatabaseConfigTest {

    private final ApplicationContextRunner runner =
            new ApplicationContextRunner().withUserConfiguration(FlywayAuditDatabaseConfig.class);

    @Test
    @DisplayName("creates no Flyway bean unless enabled")
    void disabledByDefault() {
        runner.run(context -> assertThat(context).doesNotHaveBean(FlywayAuditDatabaseConfig.AUDIT_FLYWAY_BEAN));
    }

    @Test
    @DisplayName("configured Flyway points at the audit migrations and forbids clean")
    void configuresFlyway() {
        var flyway =
                FlywayAuditDatabaseConfig.createFlyway(
                        new FlywayConfigProperties.DatabaseConfig(
                                "jdbc:postgresql://localhost:5432/lpgcert", "lpgcert", "pw", null, true));

        assertThat(flyway.getConfiguration().getLocations())
                .extracting(Location::getDescriptor)
                .containsExactly("classpath:db/migration/audit");
        assertThat(flyway.getConfiguration().isCleanDisabled()).isTrue();
        assertThat(flyway.getConfiguration().isBaselineOnMigrate()).isTrue();
    }
}
