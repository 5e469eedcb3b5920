package com.tessera.authorization;

import java.util.List;

/**
 * Thrown when a caller supplies a blank identifier, an unknown role or an empty tenant list.
 *
 * <p>Always raised before the engine or the store is touched.
 */
public class InvalidArgumentException extends AuthorizationException {

    private final List<String> errors;

    public InvalidArgumentException(String message) {
        this(List.of(message));
    }

    public InvalidArgumentException(List<String> errors) {
        super(ErrorCode.INVALID_ARGUMENT, String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    /** Every validation error found, in the order the fields were checked. */
    public List<String> errors() {
        return errors;
    }
}
