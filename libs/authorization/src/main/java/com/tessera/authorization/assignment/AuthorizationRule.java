package com.tessera.authorization.assignment;

import com.tessera.authorization.policy.PolicyFact;
import java.util.List;

/**
 * Tagged record crossing the storage boundary.
 *
 * <p>Column layout follows the rule table: {@code subject}, {@code role}, {@code tenant} and
 * free-form {@code reserved} values. For an {@link RuleType#ASSIGNMENT} the subject is the user
 * id; {@link RuleType#POLICY} rules exist only so the store can demonstrably refuse them.
 *
 * @param type discriminant
 * @param subject user id for assignments, role name for policy facts
 * @param role role name for assignments, resource for policy facts
 * @param tenant tenant id
 * @param reserved extra positional values (the action of a policy fact)
 */
public record AuthorizationRule(
        RuleType type, String subject, String role, String tenant, List<String> reserved) {

    public AuthorizationRule {
        reserved = reserved == null ? List.of() : List.copyOf(reserved);
    }

    public static AuthorizationRule assignment(Assignment assignment) {
        return new AuthorizationRule(
                RuleType.ASSIGNMENT,
                assignment.userId(),
                assignment.role(),
                assignment.tenantId(),
                List.of());
    }

    public static AuthorizationRule policy(PolicyFact fact) {
        return new AuthorizationRule(
                RuleType.POLICY,
                fact.role(),
                fact.resource(),
                fact.tenant(),
                List.of(fact.action()));
    }

    public boolean isAssignment() {
        return type == RuleType.ASSIGNMENT;
    }

    /**
     * Converts back to an {@link Assignment}.
     *
     * @throws IllegalStateException if this rule is not an assignment
     */
    public Assignment toAssignment() {
        if (!isAssignment()) {
            throw new IllegalStateException("Rule of type " + type + " is not an assignment");
        }
        return new Assignment(subject, role, tenant);
    }
}
