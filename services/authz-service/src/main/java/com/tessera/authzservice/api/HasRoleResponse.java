package com.tessera.authzservice.api;

public record HasRoleResponse(String userId, String tenantId, String role, boolean hasRole) {}
