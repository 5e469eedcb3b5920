package com.tessera.authzservice.api;

import java.util.List;

/**
 * Optional body of {@code POST /policies/reload}.
 *
 * @param tenants tenants to compile for; null means the configured tenants
 */
public record ReloadRequest(List<String> tenants) {}
