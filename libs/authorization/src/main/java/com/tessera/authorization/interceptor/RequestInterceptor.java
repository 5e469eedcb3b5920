package com.tessera.authorization.interceptor;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Contract between a transport and the authorization core.
 *
 * <p>Implementations must, in this order:
 *
 * <ol>
 *   <li>let endpoints on the public allow-list through without reading any identity
 *   <li>obtain (user, tenant) from {@code identity}; reject if either is missing
 *   <li>map the endpoint to a {@link ResourceAction}; reject unmapped endpoints
 *   <li>ask the authorization service and reject on deny or on error
 * </ol>
 */
public interface RequestInterceptor {

    /**
     * Authorizes one inbound call before it is dispatched.
     *
     * @param endpoint transport-specific endpoint name
     * @param identity lazily extracts the caller identity; not invoked for public endpoints
     */
    InterceptionResult intercept(String endpoint, Supplier<Optional<RequestIdentity>> identity);
}
