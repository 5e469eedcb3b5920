package com.tessera.authzservice.api;

import jakarta.validation.constraints.NotBlank;

public record DecisionRequest(
        @NotBlank String userId,
        @NotBlank String resource,
        @NotBlank String action,
        @NotBlank String tenantId) {}
