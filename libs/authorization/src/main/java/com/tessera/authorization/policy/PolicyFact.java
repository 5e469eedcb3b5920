package com.tessera.authorization.policy;

/**
 * A compiled permission: {@code role} may perform {@code action} on {@code resource} inside
 * {@code tenant}. Lives in memory only and is never written to the assignment store.
 *
 * @param role role name from the catalog
 * @param resource literal resource or {@link Permission#WILDCARD}
 * @param action literal action or {@link Permission#WILDCARD}
 * @param tenant concrete tenant id, never a wildcard
 */
public record PolicyFact(String role, String resource, String action, String tenant) {}
