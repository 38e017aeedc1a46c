package com.teenagi.agent.capability;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CapabilityRegistryTest {

    @Test
    void learn_keepsInsertionOrder() {
        CapabilityRegistry registry = new CapabilityRegistry();
        registry.learn("checking the weather");
        registry.learn("doing math");

        assertThat(registry.statements()).containsExactly("checking the weather", "doing math");
    }

    @Test
    void learn_blankStatement_isRejected() {
        CapabilityRegistry registry = new CapabilityRegistry();

        assertThat(registry.learn("   ")).isFalse();
        assertThat(registry.learn(null)).isFalse();
        assertThat(registry.isEmpty()).isTrue();
    }

    @Test
    void statements_isSnapshot() {
        CapabilityRegistry registry = new CapabilityRegistry();
        registry.learn("one");
        var snapshot = registry.statements();
        registry.learn("two");

        assertThat(snapshot).containsExactly("one");
        assertThat(registry.size()).isEqualTo(2);
    }
}
