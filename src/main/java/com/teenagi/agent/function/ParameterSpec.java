package com.teenagi.agent.function;

import lombok.Builder;
import lombok.Value;

/**
 * One declared parameter of a registered function.
 */
@Value
@Builder
public class ParameterSpec {

    String name;
    ParameterType type;
    boolean required;

    /** Used when an optional parameter is absent. May be null. */
    Object defaultValue;

    /** Optional hint for the model */
    String description;

    public static ParameterSpec required(String name, ParameterType type, String description) {
        return ParameterSpec.builder()
                .name(name)
                .type(type)
                .required(true)
                .description(description)
                .build();
    }

    public static ParameterSpec optional(String name, ParameterType type, Object defaultValue, String description) {
        return ParameterSpec.builder()
                .name(name)
                .type(type)
                .required(false)
                .defaultValue(defaultValue)
                .description(description)
                .build();
    }
}
