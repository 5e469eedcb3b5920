package com.tessera.authorization.engine;

/**
 * A single allow/deny question. Never persisted.
 *
 * @param userId requesting user
 * @param resource resource being accessed
 * @param action action being performed
 * @param tenantId tenant the request is scoped to
 */
public record EnforcementQuery(String userId, String resource, String action, String tenantId) {}
