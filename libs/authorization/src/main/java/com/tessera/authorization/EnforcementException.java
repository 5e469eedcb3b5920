package com.tessera.authorization;

/**
 * The engine could not produce a decision. Always paired with a deny.
 */
public class EnforcementException extends AuthorizationException {

    public EnforcementException(String message) {
        super(ErrorCode.ENFORCEMENT_ERROR, message);
    }

    public EnforcementException(String message, Throwable cause) {
        super(ErrorCode.ENFORCEMENT_ERROR, message, cause);
    }
}
