package com.tessera.authzservice.infrastructure.metrics;

import com.tessera.authorization.interceptor.InterceptionResult.Outcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Micrometer counters for request-boundary decisions, one per {@link Outcome}.
 *
 * <p>Published as {@value #DECISIONS} with an {@code outcome} tag. User and tenant are not tagged:
 * their cardinality is unbounded.
 */
public class AuthorizationMetrics {

    public static final String DECISIONS = "tessera.authz.decisions";
    public static final String TAG_OUTCOME = "outcome";

    private final Map<Outcome, Counter> counters = new EnumMap<>(Outcome.class);

    public AuthorizationMetrics(MeterRegistry registry) {
        for (Outcome outcome : Outcome.values()) {
            counters.put(
                    outcome,
                    Counter.builder(DECISIONS)
                            .description("Authorization decisions taken at the request boundary")
                            .tag(TAG_OUTCOME, outcome.name().toLowerCase(Locale.ROOT))
                            .register(registry));
        }
    }

    public void record(Outcome outcome) {
        counters.get(outcome).increment();
    }
}
