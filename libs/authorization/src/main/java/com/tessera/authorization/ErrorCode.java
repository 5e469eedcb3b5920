package com.tessera.authorization;

/**
 * Machine-readable category of an {@link AuthorizationException}.
 *
 * <p>Transport adapters branch on the code, never on the message text.
 */
public enum ErrorCode {

    INVALID_ARGUMENT("INVALID_ARGUMENT"),
    STORAGE_ERROR("STORAGE_ERROR"),
    ENFORCEMENT_ERROR("ENFORCEMENT_ERROR"),
    POLICY_CONFIG_ERROR("POLICY_CONFIG_ERROR");

    private final String value;

    ErrorCode(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "STORAGE_ERROR"). */
    public String value() {
        return value;
    }
}
