package com.tessera.authorization.interceptor;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Thread-local holder for the {@link AuthorizationContext} of the request being handled, with an
 * SLF4J MDC bridge so every log line written while handling it carries the user and tenant.
 *
 * <p>Transport adapters bind the context around each piece of work done for a granted call and
 * restore the previous binding afterwards, usually through {@link
 * #runWithContext(AuthorizationContext, Runnable)}. Thread pools must hand the context over the same
 * way.
 */
public final class AuthorizationContextHolder {

    private static final ThreadLocal<AuthorizationContext> CONTEXT = new ThreadLocal<>();

    private AuthorizationContextHolder() {
        // utility class
    }

    /**
     * Binds the context to the current thread and populates MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(AuthorizationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        MDC.put(AuthorizationContext.MDC_USER_ID, context.userId());
        MDC.put(AuthorizationContext.MDC_TENANT_ID, context.tenantId());
        MDC.put(AuthorizationContext.MDC_RESOURCE, context.resource());
        MDC.put(AuthorizationContext.MDC_ACTION, context.action());
    }

    public static Optional<AuthorizationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Removes the context and its MDC keys from the current thread. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(AuthorizationContext.MDC_USER_ID);
        MDC.remove(AuthorizationContext.MDC_TENANT_ID);
        MDC.remove(AuthorizationContext.MDC_RESOURCE);
        MDC.remove(AuthorizationContext.MDC_ACTION);
    }

    /**
     * Runs {@code runnable} with {@code context} bound, then restores whatever was bound before.
     */
    public static void runWithContext(AuthorizationContext context, Runnable runnable) {
        AuthorizationContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }
}
