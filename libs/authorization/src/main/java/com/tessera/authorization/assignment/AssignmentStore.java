package com.tessera.authorization.assignment;

import java.util.Collection;
import java.util.Set;

/**
 * Durable storage for role assignments, and nothing else.
 *
 * <p>Contract for every implementation:
 *
 * <ul>
 *   <li>Only rules tagged {@link RuleType#ASSIGNMENT} are ever written. Any other rule passed to
 *       {@link #add} or {@link #remove} is a no-op that reports {@code IGNORED}.
 *   <li>{@link #load()} skips stored rows that are not assignments.
 *   <li>{@link #save(Collection)} is all-or-nothing: on failure the previous durable state is kept.
 *   <li>{@link #add} and {@link #remove} are idempotent and never surface a uniqueness violation.
 *   <li>Every call is bounded in time; failures surface as {@link
 *       com.tessera.authorization.StorageException}.
 * </ul>
 */
public interface AssignmentStore {

    /** Reads every stored assignment. */
    Set<Assignment> load();

    /** Replaces all stored assignments with {@code assignments} in one transaction. */
    void save(Collection<Assignment> assignments);

    /** Stores the rule if it is an assignment and not already present. */
    AddOutcome add(AuthorizationRule rule);

    /** Deletes the rule if it is a stored assignment. */
    RemoveOutcome remove(AuthorizationRule rule);

    default AddOutcome add(Assignment assignment) {
        return add(assignment.toRule());
    }

    default RemoveOutcome remove(Assignment assignment) {
        return remove(assignment.toRule());
    }
}
