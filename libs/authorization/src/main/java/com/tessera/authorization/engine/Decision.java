package com.tessera.authorization.engine;

import com.tessera.authorization.EnforcementException;
import java.util.Optional;

/**
 * Outcome of evaluating an {@link EnforcementQuery}.
 *
 * <p>Callers check {@link #failure()} first, then {@link #allowed()}. A failed decision is always a
 * deny.
 *
 * @param allowed whether the request is permitted
 * @param error why no decision could be made, or null
 */
public record Decision(boolean allowed, EnforcementException error) {

    private static final Decision ALLOW = new Decision(true, null);
    private static final Decision DENY = new Decision(false, null);

    public Decision {
        if (allowed && error != null) {
            throw new IllegalArgumentException("a failed decision cannot allow");
        }
    }

    public static Decision allow() {
        return ALLOW;
    }

    public static Decision deny() {
        return DENY;
    }

    public static Decision of(boolean allowed) {
        return allowed ? ALLOW : DENY;
    }

    public static Decision failed(EnforcementException error) {
        return new Decision(false, error);
    }

    public Optional<EnforcementException> failure() {
        return Optional.ofNullable(error);
    }
}
