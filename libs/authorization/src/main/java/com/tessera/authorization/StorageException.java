package com.tessera.authorization;

/**
 * Infrastructure failure in the assignment store: unreachable database, timeout or an unexpected
 * schema violation.
 *
 * <p>The message carries diagnostic detail for logs and must not be echoed across a transport
 * boundary. {@link #retryable()} is set for timeouts and transient connectivity errors; the core
 * itself never retries.
 */
public class StorageException extends AuthorizationException {

    private final boolean retryable;

    public StorageException(String message, Throwable cause, boolean retryable) {
        super(ErrorCode.STORAGE_ERROR, message, cause);
        this.retryable = retryable;
    }

    public StorageException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public boolean retryable() {
        return retryable;
    }
}
