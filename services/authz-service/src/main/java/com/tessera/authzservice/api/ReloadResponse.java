package com.tessera.authzservice.api;

import java.util.List;

public record ReloadResponse(List<String> roles, List<String> tenants) {}
