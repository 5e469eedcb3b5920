package com.tessera.authorization.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The static role catalog: every role the platform knows and what each one grants.
 *
 * <p>Tenant-independent. A catalog only changes by replacing it wholesale.
 *
 * @param roles role name to definition, in document order
 */
public record PolicyCatalog(Map<String, RoleDefinition> roles) {

    public PolicyCatalog {
        roles = Collections.unmodifiableMap(new LinkedHashMap<>(roles));
    }

    /** Role names in document order. */
    public List<String> roleNames() {
        return List.copyOf(roles.keySet());
    }

    public boolean containsRole(String name) {
        return name != null && roles.containsKey(name);
    }

    public Optional<RoleDefinition> role(String name) {
        return Optional.ofNullable(roles.get(name));
    }
}
