package com.tessera.authorization.policy;

import java.util.List;
import java.util.Map;

/**
 * Raw shape of a policy document, exactly as written by the author:
 *
 * <pre>{@code
 * roles:
 *   instructor:
 *     permissions:
 *       assignment: [create, view]
 *   admin:
 *     permissions:
 *       all: [all]
 * }</pre>
 *
 * <p>No token translation has happened yet; see {@link PolicySource#normalize(PolicyDocument)}.
 *
 * @param roles role name to role body, in document order
 */
public record PolicyDocument(Map<String, RoleDocument> roles) {

    /**
     * Body of a single role.
     *
     * @param permissions resource name to the actions allowed on it
     */
    public record RoleDocument(Map<String, List<String>> permissions) {}
}
