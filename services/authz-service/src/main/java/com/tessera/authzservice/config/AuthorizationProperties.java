package com.tessera.authzservice.config;

import com.tessera.authorization.interceptor.EndpointPermissions;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the authorization core hosted by this service.
 *
 * <pre>
 * tessera:
 *   authorization:
 *     policy-location: classpath:policies.yaml
 *     tenants: [acme, globex]
 *     public-endpoints:
 *       - /grpc.health.v1.Health/Check
 *     endpoints:
 *       "[/classroom.v1.AssignmentService/CreateAssignment]": assignment:create
 * </pre>
 *
 * <p>Endpoint keys contain {@code /} and must use bracket notation to survive relaxed binding.
 *
 * @param policyLocation Spring resource location of the policy document
 * @param tenants tenants the catalog is compiled for at startup and on reload. Required.
 * @param endpoints endpoint name to {@code resource:action}
 * @param publicEndpoints endpoints that bypass enforcement
 */
@ConfigurationProperties(prefix = "tessera.authorization")
@Validated
public record AuthorizationProperties(
        String policyLocation,
        @NotEmpty List<@NotBlank String> tenants,
        Map<String, String> endpoints,
        List<String> publicEndpoints) {

    public static final String DEFAULT_POLICY_LOCATION = "classpath:policies.yaml";

    public AuthorizationProperties {
        if (policyLocation == null || policyLocation.isBlank()) {
            policyLocation = DEFAULT_POLICY_LOCATION;
        }
        tenants = tenants == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(tenants));
        endpoints = endpoints == null ? Map.of() : Map.copyOf(endpoints);
        publicEndpoints = publicEndpoints == null ? List.of() : List.copyOf(publicEndpoints);
    }

    /**
     * Builds the endpoint table.
     *
     * @throws IllegalArgumentException if a mapping is not of the form {@code resource:action}
     */
    public EndpointPermissions toEndpointPermissions() {
        EndpointPermissions.Builder builder = EndpointPermissions.builder();
        endpoints.forEach(
                (endpoint, resourceAction) -> {
                    int separator = resourceAction == null ? -1 : resourceAction.indexOf(':');
                    if (separator <= 0 || separator == resourceAction.length() - 1) {
                        throw new IllegalArgumentException(
                                "endpoint '%s' must map to resource:action, got '%s'"
                                        .formatted(endpoint, resourceAction));
                    }
                    builder.map(
                            endpoint,
                            resourceAction.substring(0, separator).trim(),
                            resourceAction.substring(separator + 1).trim());
                });
        publicEndpoints.forEach(builder::publicEndpoint);
        return builder.build();
    }
}
