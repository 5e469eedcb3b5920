package com.tessera.authorization.engine;

import com.tessera.authorization.EnforcementException;
import com.tessera.authorization.assignment.Assignment;
import com.tessera.authorization.policy.PolicyFact;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory evaluator over compiled policy facts and live assignments.
 *
 * <p>Both tables sit behind one {@link ReentrantReadWriteLock}. Queries share the read lock; every
 * mutation takes the write lock. A replacement fact index is built before the write lock is taken
 * and swapped in as a single assignment, so a query sees either the old set or the new one.
 *
 * <p>This class does no argument validation and no I/O; {@link
 * com.tessera.authorization.AuthorizationService} owns both.
 */
public class EnforcementEngine {

    private static final Logger log = LoggerFactory.getLogger(EnforcementEngine.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // tenant -> role -> facts; null until the first load
    private Map<String, Map<String, List<PolicyFact>>> factIndex;
    private int factCount;

    // user -> tenant -> roles
    private final Map<String, Map<String, Set<String>>> assignmentIndex = new HashMap<>();

    // ── Policy facts ──

    /**
     * Replaces every policy fact. Assignments are not touched.
     *
     * @param facts the complete new fact set
     */
    public void replacePolicyFacts(Collection<PolicyFact> facts) {
        Map<String, Map<String, List<PolicyFact>>> index = indexFacts(facts);

        lock.writeLock().lock();
        try {
            factIndex = index;
            factCount = facts.size();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Loaded {} policy facts for tenants {}", facts.size(), index.keySet());
    }

    /** Whether {@link #replacePolicyFacts(Collection)} has been called at least once. */
    public boolean isLoaded() {
        lock.readLock().lock();
        try {
            return factIndex != null;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Tenants that currently have compiled facts. */
    public Set<String> tenants() {
        lock.readLock().lock();
        try {
            return factIndex == null ? Set.of() : Set.copyOf(factIndex.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    // ── Assignments ──

    /** Replaces every assignment. Policy facts are not touched. */
    public void replaceAssignments(Collection<Assignment> assignments) {
        lock.writeLock().lock();
        try {
            assignmentIndex.clear();
            assignments.forEach(this::indexAssignment);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** @return true if the assignment was not already present */
    public boolean addAssignment(Assignment assignment) {
        lock.writeLock().lock();
        try {
            return indexAssignment(assignment);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** @return true if the assignment was present */
    public boolean removeAssignment(Assignment assignment) {
        lock.writeLock().lock();
        try {
            Map<String, Set<String>> byTenant = assignmentIndex.get(assignment.userId());
            if (byTenant == null) {
                return false;
            }
            Set<String> roles = byTenant.get(assignment.tenantId());
            if (roles == null || !roles.remove(assignment.role())) {
                return false;
            }
            if (roles.isEmpty()) {
                byTenant.remove(assignment.tenantId());
            }
            if (byTenant.isEmpty()) {
                assignmentIndex.remove(assignment.userId());
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean hasAssignment(Assignment assignment) {
        lock.readLock().lock();
        try {
            return rolesOf(assignment.userId(), assignment.tenantId()).contains(assignment.role());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Roles the user holds in exactly this tenant. */
    public Set<String> rolesFor(String userId, String tenantId) {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new TreeSet<>(rolesOf(userId, tenantId)));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Every tenant in which the user holds {@code role}. Crosses tenant boundaries. */
    public Set<String> tenantsFor(String userId, String role) {
        lock.readLock().lock();
        try {
            var tenants = new TreeSet<String>();
            assignmentIndex
                    .getOrDefault(userId, Map.of())
                    .forEach(
                            (tenant, roles) -> {
                                if (roles.contains(role)) {
                                    tenants.add(tenant);
                                }
                            });
            return Collections.unmodifiableSet(tenants);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ── Evaluation ──

    /**
     * Answers whether the query is allowed.
     *
     * <p>Allowed iff the user holds some role R in the query tenant and a fact (R, r', a', tenant)
     * exists where r' and a' match the query literally or by wildcard. Never throws; when the
     * tables are unusable the result is {@link Decision#failed(EnforcementException)}.
     */
    public Decision evaluate(EnforcementQuery query) {
        lock.readLock().lock();
        try {
            if (factIndex == null) {
                return Decision.failed(new EnforcementException("Policy facts have not been loaded"));
            }
            Set<String> roles = rolesOf(query.userId(), query.tenantId());
            if (roles.isEmpty()) {
                return Decision.deny();
            }
            Map<String, List<PolicyFact>> factsByRole =
                    factIndex.getOrDefault(query.tenantId(), Map.of());
            for (String role : roles) {
                for (PolicyFact fact : factsByRole.getOrDefault(role, List.of())) {
                    if (WildcardMatcher.matches(fact.resource(), query.resource())
                            && WildcardMatcher.matches(fact.action(), query.action())) {
                        return Decision.allow();
                    }
                }
            }
            return Decision.deny();
        } catch (RuntimeException e) {
            log.error("Enforcement failed for user {} in tenant {}", query.userId(), query.tenantId(), e);
            return Decision.failed(
                    new EnforcementException(
                            "Failed to evaluate authorization for user " + query.userId(), e));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Copies both tables for diagnostics. */
    public PolicySnapshot snapshot() {
        lock.readLock().lock();
        try {
            var facts = new ArrayList<PolicyFact>(factCount);
            if (factIndex != null) {
                factIndex.values().forEach(byRole -> byRole.values().forEach(facts::addAll));
            }
            var assignments = new ArrayList<Assignment>();
            assignmentIndex.forEach(
                    (user, byTenant) ->
                            byTenant.forEach(
                                    (tenant, roles) ->
                                            roles.forEach(
                                                    role ->
                                                            assignments.add(
                                                                    new Assignment(user, role, tenant)))));
            Set<String> tenants = factIndex == null ? Set.of() : factIndex.keySet();
            return new PolicySnapshot(tenants, facts, assignments);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ── Private Helpers ──

    private Set<String> rolesOf(String userId, String tenantId) {
        return assignmentIndex.getOrDefault(userId, Map.of()).getOrDefault(tenantId, Set.of());
    }

    private boolean indexAssignment(Assignment assignment) {
        return assignmentIndex
                .computeIfAbsent(assignment.userId(), user -> new HashMap<>())
                .computeIfAbsent(assignment.tenantId(), tenant -> new LinkedHashSet<>())
                .add(assignment.role());
    }

    private static Map<String, Map<String, List<PolicyFact>>> indexFacts(Collection<PolicyFact> facts) {
        var index = new HashMap<String, Map<String, List<PolicyFact>>>();
        for (PolicyFact fact : facts) {
            index.computeIfAbsent(fact.tenant(), tenant -> new HashMap<>())
                    .computeIfAbsent(fact.role(), role -> new ArrayList<>())
                    .add(fact);
        }
        return index;
    }
}
