/**
 * Durable side of the authorization core.
 *
 * <p>Flyway owns the {@code authorization_rule} schema ({@code db/migration/authz}); {@link
 * com.tessera.database.store.JdbcAssignmentStore} reads and writes it with plain JDBC.
 *
 * @see com.tessera.database.migration.AuthorizationDatabaseConfig
 * @see com.tessera.database.migration.DatabaseProperties
 */
package com.tessera.database;
