package com.tessera.authorization;

import java.util.List;

/**
 * Result of validating caller input or a policy catalog.
 *
 * @param valid whether every check passed
 * @param errors validation error messages (empty if valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    /** Creates a passing result. */
    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    /** Creates a failing result with one or more error messages. */
    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }
}
