package com.tessera.authzservice.infrastructure.health;

import com.tessera.authorization.AuthorizationService;
import com.tessera.database.migration.MigrationStatusService;
import com.tessera.database.migration.MigrationStatusService.DatabaseStatus;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports DOWN until policy facts are loaded; adds the schema state when the database module is
 * active.
 */
@Component("authorization")
public class AuthorizationHealthIndicator implements HealthIndicator {

    private final AuthorizationService authorizationService;
    private final ObjectProvider<MigrationStatusService> migrationStatus;

    public AuthorizationHealthIndicator(
            AuthorizationService authorizationService,
            ObjectProvider<MigrationStatusService> migrationStatus) {
        this.authorizationService = authorizationService;
        this.migrationStatus = migrationStatus;
    }

    @Override
    public Health health() {
        if (!authorizationService.isReady()) {
            return Health.down().withDetail("reason", "policy facts not loaded").build();
        }
        Health.Builder builder =
                Health.up()
                        .withDetail("tenants", authorizationService.loadedTenants())
                        .withDetail("roles", authorizationService.getAvailableRoles());

        MigrationStatusService statusService = migrationStatus.getIfAvailable();
        if (statusService != null) {
            DatabaseStatus status = statusService.status();
            builder.withDetail("schemaVersion", String.valueOf(status.currentVersion()))
                    .withDetail("pendingMigrations", status.pendingMigrations());
            if (!status.upToDate()) {
                builder.down();
            }
        }
        return builder.build();
    }
}
