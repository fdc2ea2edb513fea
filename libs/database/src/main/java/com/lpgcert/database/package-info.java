/**
 * Database schema for the audit store.
 *
 * <p>Flyway owns the schema: a projection of application users, the append-only {@code audit_logs}
 * table and the {@code audit_logs_with_users} read view used by the query engine.
 *
 * @see com.lpgcert.database.migration.FlywayAuditDatabaseConfig
 */
package com.lpgcert.database;
