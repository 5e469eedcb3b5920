package com.tessera.authorization.assignment;

/**
 * Durable binding of a user to a role within a tenant. Unique per triple.
 *
 * @param userId subject the role is granted to
 * @param role role name; must exist in the catalog at assignment time
 * @param tenantId tenant the binding is scoped to
 */
public record Assignment(String userId, String role, String tenantId) {

    /** The storage-boundary form of this assignment. */
    public AuthorizationRule toRule() {
        return AuthorizationRule.assignment(this);
    }
}
