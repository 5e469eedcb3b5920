package com.tessera.authzservice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Tessera authorization service.
 *
 * <p>Hosts one {@link com.tessera.authorization.AuthorizationService} built from the configured
 * policy document and tenant list, the administrative REST API under {@code
 * /api/v1/authorization}, and the gRPC interceptors that enforce endpoint permissions for
 * co-hosted services.
 *
 * <p>Configuration classes live in {@code com.tessera.authzservice.config}; the database module is
 * picked up by component scanning of {@code com.tessera.database}.
 */
@SpringBootApplication(scanBasePackages = {"com.tessera.authzservice", "com.tessera.database"})
public class AuthzServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AuthzServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuthzServiceApplication.class, args);
        log.info("Tessera authorization service started");
    }
}
