package com.tessera.authorization.engine;

import com.tessera.authorization.policy.Permission;

/**
 * Pattern matching for the resource and action positions of a policy fact.
 *
 * <p>Tenants are never matched through here: tenant comparison is always exact.
 */
public final class WildcardMatcher {

    private WildcardMatcher() {
        // utility class
    }

    /**
     * Returns true if {@code pattern} is {@link Permission#WILDCARD} or equals {@code value}.
     * A null or blank value never matches, not even the wildcard.
     */
    public static boolean matches(String pattern, String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        return Permission.WILDCARD.equals(pattern) || value.equals(pattern);
    }
}
