package com.tessera.authorization.policy;

/**
 * A (resource, action) pair granted by a role. Either side may be {@link #WILDCARD}.
 *
 * @param resource literal resource name or {@link #WILDCARD}
 * @param action literal action name or {@link #WILDCARD}
 */
public record Permission(String resource, String action) {

    /** Internal sentinel meaning "every value in this position". */
    public static final String WILDCARD = "*";

    /** Human-facing token in policy documents that is translated to {@link #WILDCARD}. */
    public static final String ALL_TOKEN = "all";

    public Permission {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource must not be null or blank");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action must not be null or blank");
        }
    }

    public boolean hasWildcardResource() {
        return WILDCARD.equals(resource);
    }

    public boolean hasWildcardAction() {
        return WILDCARD.equals(action);
    }
}
