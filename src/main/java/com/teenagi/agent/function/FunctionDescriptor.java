package com.teenagi.agent.function;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Declared shape of a callable function: name, description, ordered parameters
 * and a free-text hint of what it returns. Immutable once built.
 *
 * The descriptor is what the model sees; binding it to an implementation
 * happens separately in {@link FunctionRegistry#register(FunctionDescriptor, FunctionInvoker)}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class FunctionDescriptor {

    // Both OpenAI and Anthropic accept this character set for tool names
    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");

    private final String name;
    private final String description;
    private final List<ParameterSpec> parameters;
    private final String returnType;

    @Builder
    private FunctionDescriptor(String name, String description,
                               @Singular List<ParameterSpec> parameters, String returnType) {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException(
                    "Function name must match " + NAME_PATTERN.pattern() + " but was: " + name);
        }
        Set<String> seen = new HashSet<>();
        for (ParameterSpec p : parameters) {
            if (p.getName() == null || p.getName().isBlank() || p.getType() == null) {
                throw new IllegalArgumentException("Parameter of '" + name + "' needs a name and a type");
            }
            if (!seen.add(p.getName())) {
                throw new IllegalArgumentException(
                        "Duplicate parameter '" + p.getName() + "' in function '" + name + "'");
            }
        }
        this.name = name;
        this.description = description == null || description.isBlank() ? "No description provided" : description;
        this.parameters = List.copyOf(parameters);
        this.returnType = returnType == null ? "string" : returnType;
    }

    /**
     * JSON Schema of the parameter object. Both backends embed this verbatim:
     * OpenAI as {@code function.parameters}, Anthropic as {@code input_schema}.
     */
    public Map<String, Object> toJsonSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (ParameterSpec p : parameters) {
            Map<String, Object> property = new LinkedHashMap<>();
            property.put("type", p.getType().jsonType());
            if (p.getDescription() != null && !p.getDescription().isBlank()) {
                property.put("description", p.getDescription());
            }
            if (p.getDefaultValue() != null) {
                property.put("default", p.getDefaultValue());
            }
            properties.put(p.getName(), property);
        }

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", parameters.stream()
                .filter(ParameterSpec::isRequired)
                .map(ParameterSpec::getName)
                .toList());
        return schema;
    }

    /** e.g. {@code get_weather(location (required)): Get weather information for a location} */
    public String signature() {
        String params = parameters.stream()
                .map(p -> p.getName() + (p.isRequired() ? " (required)" : " (optional)"))
                .collect(Collectors.joining(", "));
        return name + "(" + params + "): " + description;
    }
}
