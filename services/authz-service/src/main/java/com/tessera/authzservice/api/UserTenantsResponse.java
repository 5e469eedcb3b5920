package com.tessera.authzservice.api;

import java.util.Set;

public record UserTenantsResponse(String userId, String role, Set<String> tenants) {}
