package com.tessera.database.migration;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;

/**
 * Reports the schema state of the authorization database, for health checks.
 *
 * <p>Reads Flyway's history table on every call; nothing is cached.
 */
public class MigrationStatusService {

    /**
     * Schema state at the time of the call.
     *
     * @param url JDBC connection URL
     * @param appliedMigrations number of successfully applied migrations
     * @param pendingMigrations number of migrations waiting to be applied
     * @param currentVersion current schema version, null if nothing was applied
     */
    public record DatabaseStatus(
            String url, int appliedMigrations, int pendingMigrations, String currentVersion) {

        public boolean upToDate() {
            return pendingMigrations == 0 && currentVersion != null;
        }
    }

    private final Flyway flyway;
    private final String url;

    public MigrationStatusService(Flyway flyway, String url) {
        this.flyway = flyway;
        this.url = url;
    }

    public DatabaseStatus status() {
        MigrationInfoService info = flyway.info();
        MigrationInfo current = info.current();
        return new DatabaseStatus(
                url,
                info.applied().length,
                info.pending().length,
                current == null || current.getVersion() == null ? null : current.getVersion().getVersion());
    }
}
