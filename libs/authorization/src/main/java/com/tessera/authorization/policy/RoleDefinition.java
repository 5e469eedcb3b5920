package com.tessera.authorization.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A named bundle of permissions after token normalization.
 *
 * @param name role name as declared in the document
 * @param grants resource to allowed actions; wildcards already translated
 */
public record RoleDefinition(String name, Map<String, Set<String>> grants) {

    public RoleDefinition {
        var copy = new LinkedHashMap<String, Set<String>>();
        grants.forEach(
                (resource, actions) ->
                        copy.put(resource, Collections.unmodifiableSet(new LinkedHashSet<>(actions))));
        grants = Collections.unmodifiableMap(copy);
    }

    /**
     * Flattens {@link #grants()} into permissions. Only meaningful on a validated catalog.
     */
    public Set<Permission> permissions() {
        var permissions = new LinkedHashSet<Permission>();
        grants.forEach(
                (resource, actions) ->
                        actions.forEach(action -> permissions.add(new Permission(resource, action))));
        return Collections.unmodifiableSet(permissions);
    }
}
