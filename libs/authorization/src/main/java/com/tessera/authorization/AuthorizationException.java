package com.tessera.authorization;

/**
 * Base type for every failure raised by the authorization core.
 *
 * <p>Unchecked, like the rest of the platform's exceptions: callers that care branch on {@link
 * #code()}, everyone else lets it reach the transport boundary.
 */
public abstract class AuthorizationException extends RuntimeException {

    private final ErrorCode code;

    protected AuthorizationException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected AuthorizationException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
