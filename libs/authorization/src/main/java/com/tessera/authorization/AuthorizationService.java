package com.tessera.authorization;

import com.tessera.authorization.assignment.AddOutcome;
import com.tessera.authorization.assignment.Assignment;
import com.tessera.authorization.assignment.AssignmentStore;
import com.tessera.authorization.assignment.RemoveOutcome;
import com.tessera.authorization.engine.Decision;
import com.tessera.authorization.engine.EnforcementEngine;
import com.tessera.authorization.engine.EnforcementQuery;
import com.tessera.authorization.engine.PolicySnapshot;
import com.tessera.authorization.policy.PolicyCatalog;
import com.tessera.authorization.policy.PolicyCompiler;
import com.tessera.authorization.policy.PolicyFact;
import com.tessera.authorization.policy.PolicySource;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the authorization core.
 *
 * <p>Owns the current {@link PolicyCatalog}, the {@link EnforcementEngine} and the {@link
 * AssignmentStore}. Reads go straight to the engine. Writes (assign, remove, reload) are
 * serialized by a mutation lock, hit the store first and only then change memory, so a storage
 * failure leaves the engine exactly as it was.
 *
 * <p>Every operation validates its identifiers before touching the engine or the store.
 */
public class AuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationService.class);

    private final EnforcementEngine engine;
    private final AssignmentStore store;
    private final ReentrantLock mutationLock = new ReentrantLock();
    private volatile PolicyCatalog catalog;

    public AuthorizationService(PolicyCatalog catalog, AssignmentStore store, EnforcementEngine engine) {
        this.catalog = PolicySource.requireValid(catalog);
        this.store = store;
        this.engine = engine;
    }

    /**
     * Builds a ready-to-serve service: compiles the catalog for {@code tenants}, then loads every
     * stored assignment.
     *
     * @throws InvalidArgumentException if {@code tenants} is empty
     * @throws StorageException if the stored assignments cannot be read
     */
    public static AuthorizationService start(
            PolicyCatalog catalog, Collection<String> tenants, AssignmentStore store) {
        var service = new AuthorizationService(catalog, store, new EnforcementEngine());
        service.reloadPolicies(tenants);
        int assignments = service.loadAssignments();
        log.info(
                "AuthorizationService initialized with {} roles for {} tenants and {} assignments",
                catalog.roles().size(),
                tenants.size(),
                assignments);
        return service;
    }

    // ── Enforcement ──

    /**
     * Whether {@code userId} may perform {@code action} on {@code resource} in {@code tenantId}.
     *
     * @throws InvalidArgumentException if any argument is blank
     * @throws EnforcementException if no decision could be made; the request must be denied
     */
    public boolean canDo(String userId, String resource, String action, String tenantId) {
        Decision decision = evaluate(new EnforcementQuery(userId, resource, action, tenantId));
        if (decision.error() != null) {
            throw decision.error();
        }
        return decision.allowed();
    }

    /**
     * Non-throwing form of {@link #canDo}: engine failures come back as a failed, denying {@link
     * Decision}.
     *
     * @throws InvalidArgumentException if any query field is blank
     */
    public Decision evaluate(EnforcementQuery query) {
        ArgumentValidator.requireNonBlank(
                "userId", query.userId(),
                "resource", query.resource(),
                "action", query.action(),
                "tenantId", query.tenantId());

        Decision decision = engine.evaluate(query);
        if (decision.error() != null) {
            log.error("Authorization could not be decided for {}", query, decision.error());
        } else {
            log.debug("Authorization {} for {}", decision.allowed() ? "granted" : "denied", query);
        }
        return decision;
    }

    // ── Assignments ──

    /**
     * Grants {@code role} to {@code userId} within {@code tenantId} and persists it.
     *
     * @return true if the assignment is new, false if it already existed
     * @throws InvalidArgumentException if an argument is blank or the role is not in the catalog
     * @throws StorageException if the store rejects the write; memory is left unchanged
     */
    public boolean assignRole(String userId, String role, String tenantId) {
        ArgumentValidator.requireNonBlank("userId", userId, "role", role, "tenantId", tenantId);

        mutationLock.lock();
        try {
            if (!catalog.containsRole(role)) {
                throw new InvalidArgumentException(
                        "role '%s' is not available in the policy catalog".formatted(role));
            }
            var assignment = new Assignment(userId, role, tenantId);
            AddOutcome outcome = store.add(assignment);
            engine.addAssignment(assignment);

            boolean added = outcome == AddOutcome.ADDED;
            if (added) {
                log.info("Role assigned: user={}, role={}, tenant={}", userId, role, tenantId);
            } else {
                log.info(
                        "Role assignment skipped (already exists): user={}, role={}, tenant={}",
                        userId,
                        role,
                        tenantId);
            }
            return added;
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Revokes {@code role} from {@code userId} within {@code tenantId}. Removing an absent
     * assignment is not an error.
     *
     * @return true if something was removed
     * @throws StorageException if the store rejects the delete; memory is left unchanged
     */
    public boolean removeRole(String userId, String role, String tenantId) {
        ArgumentValidator.requireNonBlank("userId", userId, "role", role, "tenantId", tenantId);

        mutationLock.lock();
        try {
            var assignment = new Assignment(userId, role, tenantId);
            RemoveOutcome outcome = store.remove(assignment);
            boolean removedFromMemory = engine.removeAssignment(assignment);

            boolean removed = outcome == RemoveOutcome.REMOVED || removedFromMemory;
            if (removed) {
                log.info("Role removed: user={}, role={}, tenant={}", userId, role, tenantId);
            } else {
                log.info(
                        "Role removal skipped (not found): user={}, role={}, tenant={}",
                        userId,
                        role,
                        tenantId);
            }
            return removed;
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Replaces the engine's assignments with whatever the store holds.
     *
     * @return number of assignments loaded
     */
    public int loadAssignments() {
        mutationLock.lock();
        try {
            Set<Assignment> loaded = store.load();
            engine.replaceAssignments(loaded);
            log.info("Loaded {} role assignments from store", loaded.size());
            return loaded.size();
        } finally {
            mutationLock.unlock();
        }
    }

    // ── Queries ──

    /** Roles held by the user within {@code tenantId} only. */
    public Set<String> getUserRoles(String userId, String tenantId) {
        ArgumentValidator.requireNonBlank("userId", userId, "tenantId", tenantId);
        return engine.rolesFor(userId, tenantId);
    }

    /**
     * Every tenant in which the user holds {@code role}.
     *
     * <p>This is the one query that is not tenant-scoped. It exists for administrative tooling
     * and must not be reachable from a tenant-scoped request path.
     */
    public Set<String> getUserTenantsForRole(String userId, String role) {
        ArgumentValidator.requireNonBlank("userId", userId, "role", role);
        return engine.tenantsFor(userId, role);
    }

    public boolean hasRole(String userId, String role, String tenantId) {
        ArgumentValidator.requireNonBlank("userId", userId, "role", role, "tenantId", tenantId);
        return engine.hasAssignment(new Assignment(userId, role, tenantId));
    }

    /** Role names in the current catalog. */
    public List<String> getAvailableRoles() {
        return PolicySource.roles(catalog);
    }

    public PolicyCatalog catalog() {
        return catalog;
    }

    /** Whether policy facts have been compiled and loaded at least once. */
    public boolean isReady() {
        return engine.isLoaded();
    }

    /** Tenants that currently have compiled facts. */
    public Set<String> loadedTenants() {
        return engine.tenants();
    }

    /** Point-in-time copy of compiled facts and live assignments. */
    public PolicySnapshot snapshot() {
        return engine.snapshot();
    }

    // ── Policy reload ──

    /**
     * Recompiles the current catalog for {@code tenants} and swaps the fact set atomically.
     *
     * <p>Facts for tenants missing from {@code tenants} are dropped. Assignments are untouched, so
     * a dropped tenant's assignments grant nothing until the tenant is reloaded again.
     *
     * @throws InvalidArgumentException if {@code tenants} is empty; previous facts stay in place
     */
    public void reloadPolicies(Collection<String> tenants) {
        ArgumentValidator.requireTenants(tenants);

        mutationLock.lock();
        try {
            swapFacts(catalog, tenants);
        } finally {
            mutationLock.unlock();
        }
        log.info("Policies reloaded successfully for {} tenants", tenants.size());
    }

    /**
     * Replaces the catalog itself and recompiles it for {@code tenants}, as one step.
     *
     * @throws InvalidArgumentException if {@code tenants} is empty
     * @throws com.tessera.authorization.policy.PolicyConfigException if the catalog is invalid
     */
    public void reloadCatalog(PolicyCatalog newCatalog, Collection<String> tenants) {
        ArgumentValidator.requireTenants(tenants);
        PolicySource.requireValid(newCatalog);

        mutationLock.lock();
        try {
            swapFacts(newCatalog, tenants);
            var dropped = new LinkedHashSet<>(catalog.roleNames());
            dropped.removeAll(newCatalog.roleNames());
            if (!dropped.isEmpty()) {
                log.warn("Roles removed from catalog; their assignments now grant nothing: {}", dropped);
            }
            catalog = newCatalog;
        } finally {
            mutationLock.unlock();
        }
        log.info(
                "Policy catalog reloaded with {} roles for {} tenants",
                newCatalog.roles().size(),
                tenants.size());
    }

    private void swapFacts(PolicyCatalog source, Collection<String> tenants) {
        Set<PolicyFact> facts = PolicyCompiler.compile(source, tenants);

        var retired = new LinkedHashSet<>(engine.tenants());
        retired.removeAll(tenants);

        engine.replacePolicyFacts(facts);
        if (!retired.isEmpty()) {
            log.warn("Policy facts purged for tenants no longer configured: {}", retired);
        }
    }
}
