package com.tessera.authorization.interceptor;

import com.tessera.authorization.AuthorizationException;
import com.tessera.authorization.AuthorizationService;
import com.tessera.authorization.engine.Decision;
import com.tessera.authorization.engine.EnforcementQuery;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transport-neutral {@link RequestInterceptor} backed by an {@link EndpointPermissions} table and
 * an {@link AuthorizationService}.
 */
public class EndpointAuthorizationInterceptor implements RequestInterceptor {

    private static final Logger log = LoggerFactory.getLogger(EndpointAuthorizationInterceptor.class);

    private final AuthorizationService authorizationService;
    private final EndpointPermissions permissions;

    public EndpointAuthorizationInterceptor(
            AuthorizationService authorizationService, EndpointPermissions permissions) {
        this.authorizationService = authorizationService;
        this.permissions = permissions;
    }

    @Override
    public InterceptionResult intercept(
            String endpoint, Supplier<Optional<RequestIdentity>> identity) {
        if (permissions.isPublic(endpoint)) {
            log.debug("Public endpoint accessed: {}", endpoint);
            return InterceptionResult.publicEndpoint();
        }

        Optional<RequestIdentity> caller = identity.get();
        if (caller.isEmpty() || isBlank(caller.get().userId()) || isBlank(caller.get().tenantId())) {
            log.info("Missing user or tenant for {}", endpoint);
            return InterceptionResult.rejected(InterceptionResult.Outcome.UNAUTHENTICATED);
        }
        RequestIdentity who = caller.get();

        Optional<ResourceAction> required = permissions.lookup(endpoint);
        if (required.isEmpty()) {
            log.warn("No authorization mapping for endpoint: {}", endpoint);
            return InterceptionResult.rejected(InterceptionResult.Outcome.UNMAPPED);
        }
        ResourceAction resourceAction = required.get();

        Decision decision;
        try {
            decision =
                    authorizationService.evaluate(
                            new EnforcementQuery(
                                    who.userId(),
                                    resourceAction.resource(),
                                    resourceAction.action(),
                                    who.tenantId()));
        } catch (AuthorizationException e) {
            log.error("Failed to check authorization for {}", endpoint, e);
            return InterceptionResult.error(e);
        }

        if (decision.error() != null) {
            return InterceptionResult.error(decision.error());
        }
        if (!decision.allowed()) {
            log.info(
                    "Access denied: user={}, resource={}, action={}, tenant={}",
                    who.userId(),
                    resourceAction.resource(),
                    resourceAction.action(),
                    who.tenantId());
            return InterceptionResult.rejected(InterceptionResult.Outcome.DENIED);
        }

        log.debug(
                "Access granted: user={}, resource={}, action={}, tenant={}",
                who.userId(),
                resourceAction.resource(),
                resourceAction.action(),
                who.tenantId());
        return InterceptionResult.granted(
                new AuthorizationContext(
                        who.userId(),
                        who.tenantId(),
                        resourceAction.resource(),
                        resourceAction.action()));
    }

    public EndpointPermissions permissions() {
        return permissions;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
