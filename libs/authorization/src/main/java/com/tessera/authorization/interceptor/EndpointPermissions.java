package com.tessera.authorization.interceptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static table mapping endpoint names to the {@link ResourceAction} they require, plus the
 * allow-list of public endpoints that skip enforcement.
 *
 * <p>Endpoint names are transport-specific; for gRPC they are full method names such as {@code
 * /auth.v1.AuthService/Signup} (see {@link #methodName(String, String)}).
 */
public final class EndpointPermissions {

    private final Map<String, ResourceAction> mappings;
    private final Set<String> publicEndpoints;

    private EndpointPermissions(Map<String, ResourceAction> mappings, Set<String> publicEndpoints) {
        this.mappings = Collections.unmodifiableMap(new LinkedHashMap<>(mappings));
        this.publicEndpoints = Collections.unmodifiableSet(new LinkedHashSet<>(publicEndpoints));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builds a gRPC full method name: {@code /service/method}. */
    public static String methodName(String service, String method) {
        return "/" + service + "/" + method;
    }

    public boolean isPublic(String endpoint) {
        return publicEndpoints.contains(endpoint);
    }

    public Optional<ResourceAction> lookup(String endpoint) {
        return Optional.ofNullable(mappings.get(endpoint));
    }

    public Map<String, ResourceAction> mappings() {
        return mappings;
    }

    public Set<String> publicEndpoints() {
        return publicEndpoints;
    }

    /** Mutable builder; the resulting table is immutable. */
    public static final class Builder {

        private final Map<String, ResourceAction> mappings = new LinkedHashMap<>();
        private final Set<String> publicEndpoints = new LinkedHashSet<>();

        private Builder() {}

        public Builder map(String endpoint, String resource, String action) {
            mappings.put(requireText(endpoint, "endpoint"),
                    new ResourceAction(requireText(resource, "resource"), requireText(action, "action")));
            return this;
        }

        public Builder publicEndpoint(String endpoint) {
            publicEndpoints.add(requireText(endpoint, "endpoint"));
            return this;
        }

        public EndpointPermissions build() {
            return new EndpointPermissions(mappings, publicEndpoints);
        }

        private static String requireText(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
            return value;
        }
    }
}
