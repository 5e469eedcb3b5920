package com.tessera.authorization.assignment;

/** Result of {@link AssignmentStore#remove(AuthorizationRule)}. */
public enum RemoveOutcome {
    REMOVED,
    NOT_FOUND,
    /** The rule was not an assignment and nothing was touched. */
    IGNORED
}
