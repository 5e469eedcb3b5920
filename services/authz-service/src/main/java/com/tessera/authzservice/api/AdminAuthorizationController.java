package com.tessera.authzservice.api;

import com.tessera.authorization.AuthorizationService;
import com.tessera.authorization.engine.PolicySnapshot;
import com.tessera.authzservice.config.PolicyCatalogLoader;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administrative REST API over the {@link AuthorizationService}.
 *
 * <p>Operator-facing: callers are assumed to be authenticated and authorized upstream. {@code
 * GET /users/{userId}/roles/{role}/tenants} crosses tenant boundaries and must stay off any
 * tenant-scoped route.
 */
@RestController
@RequestMapping("/api/v1/authorization")
public class AdminAuthorizationController {

    private final AuthorizationService authorizationService;
    private final PolicyCatalogLoader policyCatalogLoader;

    public AdminAuthorizationController(
            AuthorizationService authorizationService, PolicyCatalogLoader policyCatalogLoader) {
        this.authorizationService = authorizationService;
        this.policyCatalogLoader = policyCatalogLoader;
    }

    // ── Assignments ──

    /** 201 when the assignment is new, 200 when it already existed. */
    @PostMapping("/assignments")
    public ResponseEntity<AssignmentResponse> assignRole(@Valid @RequestBody AssignmentRequest request) {
        boolean added =
                authorizationService.assignRole(request.userId(), request.role(), request.tenantId());
        return ResponseEntity.status(added ? HttpStatus.CREATED : HttpStatus.OK)
                .body(new AssignmentResponse(request.userId(), request.role(), request.tenantId(), added));
    }

    @DeleteMapping("/assignments")
    public AssignmentResponse removeRole(@Valid @RequestBody AssignmentRequest request) {
        boolean removed =
                authorizationService.removeRole(request.userId(), request.role(), request.tenantId());
        return new AssignmentResponse(request.userId(), request.role(), request.tenantId(), removed);
    }

    // ── Queries ──

    @GetMapping("/users/{userId}/tenants/{tenantId}/roles")
    public UserRolesResponse userRoles(@PathVariable String userId, @PathVariable String tenantId) {
        return new UserRolesResponse(
                userId, tenantId, authorizationService.getUserRoles(userId, tenantId));
    }

    @GetMapping("/users/{userId}/roles/{role}/tenants")
    public UserTenantsResponse userTenantsForRole(
            @PathVariable String userId, @PathVariable String role) {
        return new UserTenantsResponse(
                userId, role, authorizationService.getUserTenantsForRole(userId, role));
    }

    @GetMapping("/users/{userId}/tenants/{tenantId}/roles/{role}")
    public HasRoleResponse hasRole(
            @PathVariable String userId, @PathVariable String tenantId, @PathVariable String role) {
        return new HasRoleResponse(
                userId, tenantId, role, authorizationService.hasRole(userId, role, tenantId));
    }

    @GetMapping("/roles")
    public Map<String, List<String>> availableRoles() {
        return Map.of("roles", authorizationService.getAvailableRoles());
    }

    /** Answers a single enforcement query; an undecidable query is a 500, never a deny. */
    @PostMapping("/decisions")
    public DecisionResponse decide(@Valid @RequestBody DecisionRequest request) {
        boolean allowed =
                authorizationService.canDo(
                        request.userId(), request.resource(), request.action(), request.tenantId());
        return new DecisionResponse(
                request.userId(), request.resource(), request.action(), request.tenantId(), allowed);
    }

    // ── Policies ──

    /**
     * Re-reads the policy document and recompiles it. Without a body, or without {@code tenants},
     * the configured tenants are used.
     */
    @PostMapping("/policies/reload")
    public ReloadResponse reloadPolicies(@RequestBody(required = false) ReloadRequest request) {
        List<String> tenants =
                request == null || request.tenants() == null
                        ? policyCatalogLoader.configuredTenants()
                        : request.tenants();
        authorizationService.reloadCatalog(policyCatalogLoader.load(), tenants);
        return new ReloadResponse(authorizationService.getAvailableRoles(), List.copyOf(tenants));
    }

    @GetMapping("/policies")
    public PolicySnapshot policies() {
        return authorizationService.snapshot();
    }
}
