package com.tessera.authorization.policy;

import com.tessera.authorization.AuthorizationException;
import com.tessera.authorization.ErrorCode;
import java.util.List;

/**
 * Thrown when a policy document cannot be read, parsed or validated.
 */
public class PolicyConfigException extends AuthorizationException {

    private final List<String> errors;

    public PolicyConfigException(String message, Throwable cause) {
        super(ErrorCode.POLICY_CONFIG_ERROR, message, cause);
        this.errors = List.of(message);
    }

    public PolicyConfigException(List<String> errors) {
        super(ErrorCode.POLICY_CONFIG_ERROR, "Invalid policy catalog: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
