package com.teenagi.agent.function;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teenagi.agent.exception.MissingArgumentException;
import com.teenagi.agent.exception.TypeCoercionException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArgumentValidatorTest {

    private final ArgumentValidator validator = new ArgumentValidator(new ObjectMapper());

    private final FunctionDescriptor add = FunctionDescriptor.builder()
            .name("add")
            .description("Add two integers")
            .parameter(ParameterSpec.required("a", ParameterType.INTEGER, "first"))
            .parameter(ParameterSpec.required("b", ParameterType.INTEGER, "second"))
            .build();

    @Test
    void validate_coercesNumericStringToInteger() {
        TypedArguments args = validator.validate(add, Map.of("a", "2", "b", 3));

        assertThat(args.get("a")).isEqualTo(2L);
        assertThat(args.get("b")).isEqualTo(3);
    }

    @Test
    void validate_acceptsIntegralDoubleForInteger() {
        TypedArguments args = validator.validate(add, Map.of("a", 4.0, "b", 1));
        assertThat(args.getLong("a")).isEqualTo(4L);
    }

    @Test
    void validate_rejectsFractionalValueForInteger() {
        assertThatThrownBy(() -> validator.validate(add, Map.of("a", 2.5, "b", 1)))
                .isInstanceOf(TypeCoercionException.class)
                .hasMessageContaining("'a'")
                .hasMessageContaining("integer");
    }

    @Test
    void validate_missingRequired_namesParameterAndType() {
        assertThatThrownBy(() -> validator.validate(add, Map.of("a", 1)))
                .isInstanceOf(MissingArgumentException.class)
                .hasMessageContaining("'b'")
                .hasMessageContaining("integer")
                .hasMessageContaining("add");
    }

    @Test
    void validate_explicitNullForRequired_isMissing() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("a", 1);
        raw.put("b", null);

        assertThatThrownBy(() -> validator.validate(add, raw))
                .isInstanceOf(MissingArgumentException.class);
    }

    @Test
    void validate_nullPayload_treatedAsEmpty() {
        FunctionDescriptor noArgs = FunctionDescriptor.builder().name("now").build();

        assertThat(validator.validate(noArgs, null).asMap()).isEmpty();
        assertThatThrownBy(() -> validator.validate(add, null))
                .isInstanceOf(MissingArgumentException.class);
    }

    @Test
    void validate_optionalParameter_takesDefaultWhenAbsent() {
        FunctionDescriptor search = FunctionDescriptor.builder()
                .name("search")
                .parameter(ParameterSpec.required("query", ParameterType.STRING, null))
                .parameter(ParameterSpec.optional("limit", ParameterType.INTEGER, 3, null))
                .parameter(ParameterSpec.optional("lang", ParameterType.STRING, null, null))
                .build();

        TypedArguments args = validator.validate(search, Map.of("query", "java"));

        assertThat(args.get("limit")).isEqualTo(3);
        assertThat(args.has("lang")).isFalse();
    }

    @Test
    void validate_booleanStrings_anyCase() {
        FunctionDescriptor toggle = FunctionDescriptor.builder()
                .name("toggle")
                .parameter(ParameterSpec.required("on", ParameterType.BOOLEAN, null))
                .build();

        assertThat(validator.validate(toggle, Map.of("on", "TRUE")).getBoolean("on")).isTrue();
        assertThat(validator.validate(toggle, Map.of("on", "false")).getBoolean("on")).isFalse();
        assertThatThrownBy(() -> validator.validate(toggle, Map.of("on", "yes")))
                .isInstanceOf(TypeCoercionException.class);
    }

    @Test
    void validate_numbersAndBooleansBecomeStrings() {
        FunctionDescriptor echo = FunctionDescriptor.builder()
                .name("echo")
                .parameter(ParameterSpec.required("text", ParameterType.STRING, null))
                .build();

        assertThat(validator.validate(echo, Map.of("text", 42)).getString("text")).isEqualTo("42");
        assertThatThrownBy(() -> validator.validate(echo, Map.of("text", List.of("a"))))
                .isInstanceOf(TypeCoercionException.class);
    }

    @Test
    void validate_jsonTextBecomesObjectAndArray() {
        FunctionDescriptor post = FunctionDescriptor.builder()
                .name("post")
                .parameter(ParameterSpec.required("body", ParameterType.OBJECT, null))
                .parameter(ParameterSpec.required("tags", ParameterType.ARRAY, null))
                .build();

        TypedArguments args = validator.validate(post, Map.of("body", "{\"k\": 1}", "tags", "[\"x\", \"y\"]"));

        assertThat(args.getMap("body")).containsEntry("k", 1);
        assertThat(args.getList("tags")).containsExactly("x", "y");
    }

    @Test
    void validate_numberFromDecimalString() {
        FunctionDescriptor scale = FunctionDescriptor.builder()
                .name("scale")
                .parameter(ParameterSpec.required("factor", ParameterType.NUMBER, null))
                .build();

        assertThat(validator.validate(scale, Map.of("factor", "1.5")).getDouble("factor")).isEqualTo(1.5);
        assertThat(validator.validate(scale, Map.of("factor", "2")).get("factor")).isEqualTo(2L);
    }

    @Test
    void validate_ignoresUndeclaredKeys() {
        TypedArguments args = validator.validate(add, Map.of("a", 1, "b", 2, "c", 3));
        assertThat(args.asMap()).containsOnlyKeys("a", "b");
    }

    @Test
    void validate_isIdempotentOnTypedValues() {
        TypedArguments first = validator.validate(add, Map.of("a", "7", "b", 8));
        TypedArguments second = validator.validate(add, first.asMap());

        assertThat(second.asMap()).isEqualTo(first.asMap());
    }
}
