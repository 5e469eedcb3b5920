package com.tessera.authzservice.api;

import jakarta.validation.constraints.NotBlank;

/** Body of {@code POST} and {@code DELETE /api/v1/authorization/assignments}. */
public record AssignmentRequest(@NotBlank String userId, @NotBlank String role, @NotBlank String tenantId) {}
