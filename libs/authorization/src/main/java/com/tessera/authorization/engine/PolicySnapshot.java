package com.tessera.authorization.engine;

import com.tessera.authorization.assignment.Assignment;
import com.tessera.authorization.policy.PolicyFact;
import java.util.List;
import java.util.Set;

/**
 * Point-in-time copy of the engine's tables, for diagnostics.
 *
 * @param tenants tenants that currently have compiled facts
 * @param facts every compiled fact
 * @param assignments every live assignment
 */
public record PolicySnapshot(Set<String> tenants, List<PolicyFact> facts, List<Assignment> assignments) {

    public PolicySnapshot {
        tenants = Set.copyOf(tenants);
        facts = List.copyOf(facts);
        assignments = List.copyOf(assignments);
    }
}
