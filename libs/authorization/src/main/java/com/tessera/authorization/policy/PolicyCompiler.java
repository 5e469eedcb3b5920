package com.tessera.authorization.policy;

import com.tessera.authorization.ArgumentValidator;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands a validated {@link PolicyCatalog} into per-tenant {@link PolicyFact}s.
 *
 * <p>One fact is emitted for every role x permission x tenant. Resource and action wildcards are
 * independent of each other; the tenant component is always the literal tenant id.
 */
public final class PolicyCompiler {

    private static final Logger log = LoggerFactory.getLogger(PolicyCompiler.class);

    private PolicyCompiler() {
        // utility class
    }

    /**
     * Compiles the catalog for the given tenants.
     *
     * @param catalog a catalog that passed {@link PolicySource#validate(PolicyCatalog)}
     * @param tenants tenant ids to scope facts to; must be non-empty with no blank ids
     * @return an unmodifiable set of facts, in catalog then tenant order
     * @throws com.tessera.authorization.InvalidArgumentException if {@code tenants} is empty
     */
    public static Set<PolicyFact> compile(PolicyCatalog catalog, Collection<String> tenants) {
        ArgumentValidator.requireTenants(tenants);

        var facts = new LinkedHashSet<PolicyFact>();
        for (RoleDefinition role : catalog.roles().values()) {
            Set<Permission> permissions = role.permissions();
            for (String tenant : tenants) {
                for (Permission permission : permissions) {
                    facts.add(
                            new PolicyFact(
                                    role.name(), permission.resource(), permission.action(), tenant));
                }
            }
        }

        log.debug(
                "Compiled {} policy facts for {} roles across {} tenants",
                facts.size(),
                catalog.roles().size(),
                tenants.size());
        return Collections.unmodifiableSet(facts);
    }
}
