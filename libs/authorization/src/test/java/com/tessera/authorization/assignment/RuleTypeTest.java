package com.tessera.authorization.assignment;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RuleType")
class RuleTypeTest {

    @Test
    @DisplayName("persisted values round through fromValue()")
    void knownValues() {
        assertThat(RuleType.fromValue("assignment")).contains(RuleType.ASSIGNMENT);
        assertThat(RuleType.fromValue("policy")).contains(RuleType.POLICY);
    }

    @Test
    @DisplayName("unknown tags are reported as empty")
    void unknownValue() {
        assertThat(RuleType.fromValue("g2")).isEmpty();
        assertThat(RuleType.fromValue(null)).isEmpty();
    }
}
