package com.tessera.database.migration;

import com.tessera.authorization.assignment.AssignmentStore;
import com.tessera.database.store.JdbcAssignmentStore;
import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

/**
 * Wires the authorization database: one pooled {@link DataSource}, one {@link Flyway} instance
 * that migrates it on startup, and the {@link JdbcAssignmentStore} on top.
 *
 * <p>Spring Boot's own Flyway auto-configuration must stay off so the schema is migrated exactly
 * once, by {@link #FLYWAY_BEAN}:
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * }</pre>
 *
 * @see DatabaseProperties
 */
@Configuration
@EnableConfigurationProperties(DatabaseProperties.class)
@ConditionalOnProperty(prefix = "tessera.database", name = "enabled", havingValue = "true")
public class AuthorizationDatabaseConfig {

    /** Bean name of the authorization database Flyway instance. */
    public static final String FLYWAY_BEAN = "authorizationFlyway";

    @Bean
    public DataSource authorizationDataSource(DatabaseProperties properties) {
        HikariDataSource dataSource =
                DataSourceBuilder.create()
                        .type(HikariDataSource.class)
                        .url(properties.url())
                        .username(properties.username())
                        .password(properties.password())
                        .build();
        dataSource.setConnectionTimeout(properties.connectionTimeout().toMillis());
        dataSource.setPoolName("tessera-authz");
        return dataSource;
    }

    /** Migrates on bean initialization, before the store can be created. */
    @Bean(name = FLYWAY_BEAN, initMethod = "migrate")
    public Flyway authorizationFlyway(DataSource authorizationDataSource, DatabaseProperties properties) {
        return createFlyway(authorizationDataSource, properties);
    }

    @Bean
    @DependsOn(FLYWAY_BEAN)
    public AssignmentStore assignmentStore(
            DataSource authorizationDataSource, DatabaseProperties properties) {
        return new JdbcAssignmentStore(authorizationDataSource, properties.queryTimeout());
    }

    @Bean
    public MigrationStatusService migrationStatusService(
            Flyway authorizationFlyway, DatabaseProperties properties) {
        return new MigrationStatusService(authorizationFlyway, properties.url());
    }

    // ── Private Helpers ──

    static Flyway createFlyway(DataSource dataSource, DatabaseProperties properties) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations())
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}
