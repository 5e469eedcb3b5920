package com.tessera.database.migration;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection and migration settings for the authorization database.
 *
 * <pre>{@code
 * tessera:
 *   database:
 *     url: jdbc:postgresql://localhost:5432/tessera
 *     username: tessera
 *     password: tessera_dev_password
 *     locations: classpath:db/migration/authz
 *     query-timeout: 5s
 *     connection-timeout: 5s
 *     enabled: true
 * }</pre>
 *
 * @param url JDBC connection URL
 * @param username database user
 * @param password database password
 * @param locations Flyway migration locations (default {@value #DEFAULT_LOCATIONS})
 * @param queryTimeout upper bound for every statement the store issues (default 5s)
 * @param connectionTimeout upper bound for acquiring a pooled connection (default 5s)
 * @param enabled whether the datasource, migrations and store are created at all
 */
@Validated
@ConfigurationProperties(prefix = "tessera.database")
public record DatabaseProperties(
        @NotBlank String url,
        @NotBlank String username,
        String password,
        String locations,
        Duration queryTimeout,
        Duration connectionTimeout,
        boolean enabled) {

    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/authz";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    public DatabaseProperties {
        if (locations == null || locations.isBlank()) {
            locations = DEFAULT_LOCATIONS;
        }
        if (queryTimeout == null || queryTimeout.isNegative() || queryTimeout.isZero()) {
            queryTimeout = DEFAULT_TIMEOUT;
        }
        if (connectionTimeout == null || connectionTimeout.isNegative() || connectionTimeout.isZero()) {
            connectionTimeout = DEFAULT_TIMEOUT;
        }
    }
}
