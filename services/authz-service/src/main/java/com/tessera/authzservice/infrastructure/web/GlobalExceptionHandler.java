package com.tessera.authzservice.infrastructure.web;

import com.tessera.authorization.EnforcementException;
import com.tessera.authorization.InvalidArgumentException;
import com.tessera.authorization.StorageException;
import com.tessera.authorization.policy.PolicyConfigException;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps authorization exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://tessera.dev/errors/invalid-argument",
 *   "title": "Invalid Argument",
 *   "status": 400,
 *   "detail": "userId must not be null or blank",
 *   "errors": ["userId must not be null or blank"],
 *   "timestamp": "2025-07-12T10:30:00Z"
 * }
 * </pre>
 *
 * <p>Storage and enforcement failures are logged in full and answered with a fixed detail; their
 * messages never leave the service.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_BASE = "https://tessera.dev/errors/";

    @ExceptionHandler(InvalidArgumentException.class)
    public ProblemDetail handleInvalidArgument(InvalidArgumentException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());
        ProblemDetail problem =
                problem(HttpStatus.BAD_REQUEST, "Invalid Argument", "invalid-argument", ex.getMessage());
        problem.setProperty("errors", ex.errors());
        return problem;
    }

    @ExceptionHandler(PolicyConfigException.class)
    public ProblemDetail handlePolicyConfig(PolicyConfigException ex) {
        log.warn("Policy document rejected: {}", ex.getMessage());
        ProblemDetail problem =
                problem(
                        HttpStatus.BAD_REQUEST,
                        "Invalid Policy Document",
                        "policy-config",
                        ex.getMessage());
        problem.setProperty("errors", ex.errors());
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        List<String> errors =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .toList();
        ProblemDetail problem =
                problem(
                        HttpStatus.BAD_REQUEST,
                        "Validation Error",
                        "validation",
                        errors.isEmpty() ? "Validation failed" : String.join("; ", errors));
        problem.setProperty("errors", errors);
        return problem;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(
                HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Request body is missing or malformed");
    }

    @ExceptionHandler(StorageException.class)
    public ProblemDetail handleStorage(StorageException ex) {
        log.error("Assignment store failure (retryable={})", ex.retryable(), ex);
        ProblemDetail problem =
                problem(
                        HttpStatus.SERVICE_UNAVAILABLE,
                        "Service Unavailable",
                        "storage",
                        "The authorization store is unavailable");
        problem.setProperty("retryable", ex.retryable());
        return problem;
    }

    @ExceptionHandler(EnforcementException.class)
    public ProblemDetail handleEnforcement(EnforcementException ex) {
        log.error("Authorization check failed", ex);
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Authorization Check Failed",
                "enforcement",
                "The authorization decision could not be made");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "internal",
                "An unexpected error occurred");
    }

    // ── Private Helpers ──

    private static ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        return problem;
    }
}
