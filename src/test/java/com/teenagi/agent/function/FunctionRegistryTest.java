package com.teenagi.agent.function;

import com.teenagi.agent.exception.DuplicateRegistrationException;
import com.teenagi.agent.exception.FunctionNotFoundException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FunctionRegistryTest {

    private static FunctionDescriptor descriptor(String name, String description) {
        return FunctionDescriptor.builder().name(name).description(description).build();
    }

    @Test
    void resolve_returnsBoundInvoker() throws Exception {
        FunctionRegistry registry = new FunctionRegistry();
        registry.register(descriptor("ping", "Ping"), args -> "pong");

        assertThat(registry.hasFunction("ping")).isTrue();
        assertThat(registry.resolve("ping").invoker().invoke(TypedArguments.empty())).isEqualTo("pong");
    }

    @Test
    void resolve_unknownName_throwsFunctionNotFound() {
        FunctionRegistry registry = new FunctionRegistry();

        assertThatThrownBy(() -> registry.resolve("missing"))
                .isInstanceOf(FunctionNotFoundException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void descriptors_keepRegistrationOrder() {
        FunctionRegistry registry = new FunctionRegistry();
        registry.register(descriptor("b", null), args -> null);
        registry.register(descriptor("a", null), args -> null);
        registry.register(descriptor("c", null), args -> null);

        assertThat(registry.descriptors()).extracting(FunctionDescriptor::getName).containsExactly("b", "a", "c");
        assertThat(registry.names()).containsExactly("b", "a", "c");
    }

    @Test
    void replacePolicy_lastRegistrationWinsAndKeepsPosition() throws Exception {
        FunctionRegistry registry = new FunctionRegistry(RegistrationPolicy.REPLACE);
        registry.register(descriptor("x", "old"), args -> "old");
        registry.register(descriptor("y", null), args -> null);
        registry.register(descriptor("x", "new"), args -> "new");

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.names()).containsExactly("x", "y");
        assertThat(registry.resolve("x").descriptor().getDescription()).isEqualTo("new");
        assertThat(registry.resolve("x").invoker().invoke(TypedArguments.empty())).isEqualTo("new");
    }

    @Test
    void rejectPolicy_duplicateThrowsAndKeepsOriginal() {
        FunctionRegistry registry = new FunctionRegistry(RegistrationPolicy.REJECT);
        registry.register(descriptor("x", "old"), args -> "old");

        assertThatThrownBy(() -> registry.register(descriptor("x", "new"), args -> "new"))
                .isInstanceOf(DuplicateRegistrationException.class);
        assertThat(registry.resolve("x").descriptor().getDescription()).isEqualTo("old");
    }

    @Test
    void describe_listsSignatures() {
        FunctionRegistry registry = new FunctionRegistry();
        registry.register(FunctionDescriptor.builder()
                .name("get_weather")
                .description("Get weather information for a location")
                .parameter(ParameterSpec.required("location", ParameterType.STRING, null))
                .build(), args -> null);

        assertThat(registry.describe())
                .containsExactly("get_weather(location (required)): Get weather information for a location");
    }
}
