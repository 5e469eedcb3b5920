package com.tessera.authorization.interceptor;

import java.util.Optional;

/**
 * Verdict of a {@link RequestInterceptor} for one inbound call. Transport adapters translate the
 * {@link Outcome} into their own status codes.
 *
 * @param outcome what happened
 * @param context the authorized context, present only for {@link Outcome#GRANTED}
 * @param cause the failure behind {@link Outcome#ERROR}, otherwise null
 */
public record InterceptionResult(Outcome outcome, AuthorizationContext context, Throwable cause) {

    public enum Outcome {
        /** Endpoint is on the public allow-list; no identity was read. */
        PUBLIC,
        /** Caller is allowed. */
        GRANTED,
        /** User or tenant could not be established. */
        UNAUTHENTICATED,
        /** Endpoint has no resource/action mapping; rejected. */
        UNMAPPED,
        /** Caller is not allowed. */
        DENIED,
        /** No decision could be made; rejected. */
        ERROR
    }

    public static InterceptionResult publicEndpoint() {
        return new InterceptionResult(Outcome.PUBLIC, null, null);
    }

    public static InterceptionResult granted(AuthorizationContext context) {
        return new InterceptionResult(Outcome.GRANTED, context, null);
    }

    public static InterceptionResult rejected(Outcome outcome) {
        return new InterceptionResult(outcome, null, null);
    }

    public static InterceptionResult error(Throwable cause) {
        return new InterceptionResult(Outcome.ERROR, null, cause);
    }

    /** True for {@link Outcome#PUBLIC} and {@link Outcome#GRANTED}. */
    public boolean proceed() {
        return outcome == Outcome.PUBLIC || outcome == Outcome.GRANTED;
    }

    public Optional<AuthorizationContext> authorizationContext() {
        return Optional.ofNullable(context);
    }
}
