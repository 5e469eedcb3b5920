package com.tessera.authzservice.api;

/**
 * Result of an assign or remove call.
 *
 * @param changed true if a row was added (assign) or deleted (remove)
 */
public record AssignmentResponse(String userId, String role, String tenantId, boolean changed) {}
