package com.tessera.authorization.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.tessera.authorization.EnforcementException;
import com.tessera.authorization.assignment.Assignment;
import com.tessera.authorization.policy.PolicyCompiler;
import com.tessera.authorization.policy.PolicyFact;
import com.tessera.authorization.testing.TestPolicyCatalogs;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EnforcementEngine")
class EnforcementEngineTest {

    private EnforcementEngine engine;

    @BeforeEach
    void setUp() {
        engine = new EnforcementEngine();
        engine.replacePolicyFacts(
                PolicyCompiler.compile(TestPolicyCatalogs.classroom(), List.of("acme", "globex")));
    }

    private boolean allowed(String user, String resource, String action, String tenant) {
        return engine.evaluate(new EnforcementQuery(user, resource, action, tenant)).allowed();
    }

    @Nested
    @DisplayName("evaluate()")
    class Evaluate {

        @Test
        @DisplayName("allows a literal grant in the assigned tenant")
        void literalGrant() {
            engine.addAssignment(new Assignment("u1", "instructor", "acme"));

            assertThat(allowed("u1", "assignment", "create", "acme")).isTrue();
            assertThat(allowed("u1", "assignment", "delete", "acme")).isFalse();
            assertThat(allowed("u1", "grade", "create", "acme")).isFalse();
        }

        @Test
        @DisplayName("never grants in a tenant the user is not assigned in")
        void tenantIsolation() {
            engine.addAssignment(new Assignment("u1", "admin", "acme"));

            assertThat(allowed("u1", "anything", "anything", "acme")).isTrue();
            assertThat(allowed("u1", "anything", "anything", "globex")).isFalse();
        }

        @Test
        @DisplayName("applies action and resource wildcards independently")
        void orthogonalWildcards() {
            engine.addAssignment(new Assignment("grader", "grader", "acme"));
            engine.addAssignment(new Assignment("auditor", "auditor", "acme"));

            assertThat(allowed("grader", "submission", "delete", "acme")).isTrue();
            assertThat(allowed("grader", "assignment", "delete", "acme")).isFalse();
            assertThat(allowed("auditor", "invoice", "view", "acme")).isTrue();
            assertThat(allowed("auditor", "invoice", "edit", "acme")).isFalse();
        }

        @Test
        @DisplayName("denies a user with no assignments")
        void noAssignments() {
            assertThat(engine.evaluate(new EnforcementQuery("nobody", "assignment", "view", "acme")))
                    .isEqualTo(Decision.deny());
        }

        @Test
        @DisplayName("denies in a tenant that has no compiled facts")
        void unknownTenant() {
            engine.addAssignment(new Assignment("u1", "admin", "initech"));

            assertThat(allowed("u1", "assignment", "view", "initech")).isFalse();
        }

        @Test
        @DisplayName("fails closed when no facts were ever loaded")
        void notLoaded() {
            var fresh = new EnforcementEngine();
            fresh.addAssignment(new Assignment("u1", "admin", "acme"));

            Decision decision = fresh.evaluate(new EnforcementQuery("u1", "a", "b", "acme"));

            assertThat(decision.allowed()).isFalse();
            assertThat(decision.error())
                    .isInstanceOf(EnforcementException.class)
                    .hasMessageContaining("not been loaded");
        }
    }

    @Nested
    @DisplayName("replacePolicyFacts()")
    class ReplacePolicyFacts {

        @Test
        @DisplayName("drops facts for tenants missing from the new set")
        void purgesRetiredTenants() {
            engine.addAssignment(new Assignment("u1", "admin", "globex"));
            engine.replacePolicyFacts(
                    PolicyCompiler.compile(TestPolicyCatalogs.classroom(), List.of("acme")));

            assertThat(engine.tenants()).containsExactly("acme");
            assertThat(allowed("u1", "assignment", "view", "globex")).isFalse();
        }

        @Test
        @DisplayName("leaves assignments untouched")
        void keepsAssignments() {
            engine.addAssignment(new Assignment("u1", "student", "acme"));
            engine.replacePolicyFacts(Set.of(new PolicyFact("student", "forum", "post", "acme")));

            assertThat(engine.rolesFor("u1", "acme")).containsExactly("student");
            assertThat(allowed("u1", "forum", "post", "acme")).isTrue();
            assertThat(allowed("u1", "assignment", "view", "acme")).isFalse();
        }

        @Test
        @DisplayName("readers never observe a partially rebuilt fact set")
        void atomicSwap() throws Exception {
            engine.addAssignment(new Assignment("u1", "student", "acme"));
            // Both sets grant assignment:view, so any deny means a reader saw a half-built table.
            Set<PolicyFact> literal =
                    Set.of(
                            new PolicyFact("student", "assignment", "view", "acme"),
                            new PolicyFact("student", "forum", "post", "acme"));
            Set<PolicyFact> wildcard =
                    Set.of(
                            new PolicyFact("student", "assignment", "*", "acme"),
                            new PolicyFact("student", "forum", "read", "acme"));
            engine.replacePolicyFacts(literal);

            ExecutorService pool = Executors.newFixedThreadPool(4);
            var start = new CountDownLatch(1);
            try {
                var readers = new ArrayList<Future<Integer>>();
                for (int r = 0; r < 3; r++) {
                    readers.add(
                            pool.submit(
                                    () -> {
                                        start.await();
                                        int denials = 0;
                                        for (int i = 0; i < 2_000; i++) {
                                            if (!allowed("u1", "assignment", "view", "acme")) {
                                                denials++;
                                            }
                                        }
                                        return denials;
                                    }));
                }
                Future<?> writer =
                        pool.submit(
                                () -> {
                                    start.await();
                                    for (int i = 0; i < 500; i++) {
                                        engine.replacePolicyFacts(i % 2 == 0 ? wildcard : literal);
                                    }
                                    return null;
                                });
                start.countDown();
                writer.get(10, TimeUnit.SECONDS);
                for (Future<Integer> reader : readers) {
                    assertThat(reader.get(10, TimeUnit.SECONDS)).isZero();
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("assignment index")
    class AssignmentIndex {

        @Test
        @DisplayName("add and remove report whether anything changed")
        void idempotentChanges() {
            var a = new Assignment("u1", "student", "acme");

            assertThat(engine.addAssignment(a)).isTrue();
            assertThat(engine.addAssignment(a)).isFalse();
            assertThat(engine.hasAssignment(a)).isTrue();
            assertThat(engine.removeAssignment(a)).isTrue();
            assertThat(engine.removeAssignment(a)).isFalse();
            assertThat(engine.hasAssignment(a)).isFalse();
        }

        @Test
        @DisplayName("rolesFor() is tenant-scoped while tenantsFor() crosses tenants")
        void lookups() {
            engine.addAssignment(new Assignment("u1", "student", "acme"));
            engine.addAssignment(new Assignment("u1", "instructor", "acme"));
            engine.addAssignment(new Assignment("u1", "student", "globex"));

            assertThat(engine.rolesFor("u1", "acme")).containsExactly("instructor", "student");
            assertThat(engine.rolesFor("u1", "globex")).containsExactly("student");
            assertThat(engine.tenantsFor("u1", "student")).containsExactly("acme", "globex");
            assertThat(engine.tenantsFor("u2", "student")).isEmpty();
        }

        @Test
        @DisplayName("replaceAssignments() swaps the whole table")
        void replaceAll() {
            engine.addAssignment(new Assignment("u1", "student", "acme"));
            engine.replaceAssignments(List.of(new Assignment("u2", "admin", "globex")));

            assertThat(engine.rolesFor("u1", "acme")).isEmpty();
            assertThat(engine.rolesFor("u2", "globex")).containsExactly("admin");
        }

        @Test
        @DisplayName("snapshot() copies facts and assignments")
        void snapshot() {
            engine.addAssignment(new Assignment("u1", "student", "acme"));

            PolicySnapshot snapshot = engine.snapshot();

            assertThat(snapshot.tenants()).containsExactlyInAnyOrder("acme", "globex");
            assertThat(snapshot.facts())
                    .contains(new PolicyFact("student", "assignment", "view", "globex"));
            assertThat(snapshot.assignments()).containsExactly(new Assignment("u1", "student", "acme"));
        }
    }
}
