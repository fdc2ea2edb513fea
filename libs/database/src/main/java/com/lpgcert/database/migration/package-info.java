/**
 * Flyway configuration for the audit database.
 *
 * <ul>
 *   <li>{@link com.lpgcert.database.migration.FlywayConfigProperties} binds {@code lpgcert.flyway.*}
 *   <li>{@link com.lpgcert.database.migration.FlywayAuditDatabaseConfig} creates and migrates the
 *       audit Flyway instance
 * </ul>
 */
package com.lpgcert.database.migration;
