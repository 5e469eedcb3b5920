package com.tessera.authorization.assignment;

import java.util.Optional;

/**
 * Discriminant stored in the {@code record_type} column of the rule table.
 */
public enum RuleType {

    /** User-role-tenant binding. The only type the store ever writes. */
    ASSIGNMENT("assignment"),

    /** Compiled permission fact. Kept in memory only; the store ignores it. */
    POLICY("policy");

    private final String value;

    RuleType(String value) {
        this.value = value;
    }

    /** The value persisted in {@code record_type}. */
    public String value() {
        return value;
    }

    /**
     * Looks up a type by its persisted value.
     *
     * @return the matching type, or empty for values this version does not know
     */
    public static Optional<RuleType> fromValue(String value) {
        for (RuleType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
