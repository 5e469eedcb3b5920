package com.tessera.authorization.assignment;

/** Result of {@link AssignmentStore#add(AuthorizationRule)}. */
public enum AddOutcome {
    ADDED,
    ALREADY_EXISTED,
    /** The rule was not an assignment and was not written. */
    IGNORED
}
