package com.tessera.authorization.interceptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EndpointPermissions")
class EndpointPermissionsTest {

    @Test
    @DisplayName("methodName() builds the gRPC full method name")
    void methodName() {
        assertThat(EndpointPermissions.methodName("auth.v1.AuthService", "Login"))
                .isEqualTo("/auth.v1.AuthService/Login");
    }

    @Test
    @DisplayName("lookup() finds mapped endpoints only")
    void lookup() {
        var permissions = EndpointPermissions.builder().map("/svc/Create", "course", "create").build();

        assertThat(permissions.lookup("/svc/Create")).contains(new ResourceAction("course", "create"));
        assertThat(permissions.lookup("/svc/Delete")).isEmpty();
        assertThat(permissions.isPublic("/svc/Create")).isFalse();
    }

    @Test
    @DisplayName("public endpoints are listed separately")
    void publicEndpoints() {
        var permissions = EndpointPermissions.builder().publicEndpoint("/auth/Login").build();

        assertThat(permissions.isPublic("/auth/Login")).isTrue();
        assertThat(permissions.publicEndpoints()).containsExactly("/auth/Login");
        assertThat(permissions.mappings()).isEmpty();
    }

    @Test
    @DisplayName("blank entries are refused at build time")
    void rejectsBlank() {
        assertThatThrownBy(() -> EndpointPermissions.builder().map("/svc/Create", "", "create"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("resource");
        assertThatThrownBy(() -> EndpointPermissions.builder().publicEndpoint(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
