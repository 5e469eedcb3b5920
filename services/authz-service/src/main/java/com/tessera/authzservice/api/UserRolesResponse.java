package com.tessera.authzservice.api;

import java.util.Set;

public record UserRolesResponse(String userId, String tenantId, Set<String> roles) {}
