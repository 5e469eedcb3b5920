package com.tessera.authzservice.api;

public record DecisionResponse(
        String userId, String resource, String action, String tenantId, boolean allowed) {}
