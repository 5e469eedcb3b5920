package com.tessera.authorization.interceptor;

/**
 * Caller identity as already established by the transport (trusted headers or a verified token).
 *
 * @param userId authenticated user id
 * @param tenantId tenant the request targets
 */
public record RequestIdentity(String userId, String tenantId) {}
