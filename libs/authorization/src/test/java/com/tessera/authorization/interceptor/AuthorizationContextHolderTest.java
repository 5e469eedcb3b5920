package com.tessera.authorization.interceptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("AuthorizationContextHolder")
class AuthorizationContextHolderTest {

    private static final AuthorizationContext CONTEXT =
            new AuthorizationContext("u1", "acme", "assignment", "create");

    @AfterEach
    void tearDown() {
        AuthorizationContextHolder.clear();
    }

    @Test
    @DisplayName("set() binds the context and populates MDC")
    void setPopulatesMdc() {
        AuthorizationContextHolder.set(CONTEXT);

        assertThat(AuthorizationContextHolder.get()).contains(CONTEXT);
        assertThat(MDC.get(AuthorizationContext.MDC_USER_ID)).isEqualTo("u1");
        assertThat(MDC.get(AuthorizationContext.MDC_TENANT_ID)).isEqualTo("acme");
        assertThat(MDC.get(AuthorizationContext.MDC_RESOURCE)).isEqualTo("assignment");
        assertThat(MDC.get(AuthorizationContext.MDC_ACTION)).isEqualTo("create");
    }

    @Test
    @DisplayName("clear() removes the context and its MDC keys")
    void clearRemoves() {
        AuthorizationContextHolder.set(CONTEXT);

        AuthorizationContextHolder.clear();

        assertThat(AuthorizationContextHolder.get()).isEmpty();
        assertThat(MDC.get(AuthorizationContext.MDC_USER_ID)).isNull();
        assertThat(MDC.get(AuthorizationContext.MDC_TENANT_ID)).isNull();
    }

    @Test
    @DisplayName("set(null) is rejected")
    void rejectsNull() {
        assertThatThrownBy(() -> AuthorizationContextHolder.set(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("runWithContext() restores the previous context")
    void runWithContextRestores() {
        var other = new AuthorizationContext("u2", "other", "course", "view");
        AuthorizationContextHolder.set(CONTEXT);

        AuthorizationContextHolder.runWithContext(
                other, () -> assertThat(AuthorizationContextHolder.get()).contains(other));

        assertThat(AuthorizationContextHolder.get()).contains(CONTEXT);
        assertThat(MDC.get(AuthorizationContext.MDC_USER_ID)).isEqualTo("u1");
    }

    @Test
    @DisplayName("runWithContext() on a bare thread leaves it bare")
    void runWithContextClears() {
        AuthorizationContextHolder.runWithContext(CONTEXT, () -> {});

        assertThat(AuthorizationContextHolder.get()).isEmpty();
    }
}
