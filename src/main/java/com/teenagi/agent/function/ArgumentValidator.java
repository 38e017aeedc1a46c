package com.teenagi.agent.function;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teenagi.agent.exception.MissingArgumentException;
import com.teenagi.agent.exception.TypeCoercionException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks a model-proposed argument payload against a function's declared
 * parameters and turns it into {@link TypedArguments}.
 *
 * Coercion is best-effort: a model that sends {@code "42"} for an integer or
 * {@code "TRUE"} for a boolean gets the benefit of the doubt. Values that
 * already have the declared type pass through untouched. Keys the function
 * does not declare are ignored.
 *
 * Never invokes the function.
 */
@Slf4j
public class ArgumentValidator {

    private final ObjectMapper objectMapper;

    public ArgumentValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws MissingArgumentException when a required parameter is absent or null
     * @throws TypeCoercionException    when a value cannot be coerced to its declared type
     */
    public TypedArguments validate(FunctionDescriptor descriptor, Map<String, Object> rawArguments) {
        Map<String, Object> raw = rawArguments != null ? rawArguments : Map.of();
        Map<String, Object> typed = new LinkedHashMap<>();

        for (ParameterSpec spec : descriptor.getParameters()) {
            Object value = raw.get(spec.getName());

            if (value == null) {
                if (spec.isRequired()) {
                    throw new MissingArgumentException(descriptor.getName(), spec.getName(), spec.getType());
                }
                if (spec.getDefaultValue() != null) {
                    typed.put(spec.getName(), spec.getDefaultValue());
                }
                continue;
            }

            typed.put(spec.getName(), coerce(descriptor.getName(), spec, value));
        }

        if (log.isDebugEnabled()) {
            raw.keySet().stream()
                    .filter(key -> !typed.containsKey(key))
                    .filter(key -> descriptor.getParameters().stream().noneMatch(p -> p.getName().equals(key)))
                    .forEach(key -> log.debug("Ignoring undeclared argument '{}' for [{}]", key, descriptor.getName()));
        }

        return new TypedArguments(typed);
    }

    private Object coerce(String functionName, ParameterSpec spec, Object value) {
        Object coerced = switch (spec.getType()) {
            case STRING -> toStringValue(value);
            case INTEGER -> toInteger(value);
            case NUMBER -> toNumber(value);
            case BOOLEAN -> toBoolean(value);
            case OBJECT -> toObject(value);
            case ARRAY -> toArray(value);
        };
        if (coerced == null) {
            throw new TypeCoercionException(functionName, spec.getName(), spec.getType(), value);
        }
        return coerced;
    }

    // Each converter returns null when the value cannot be coerced

    private Object toStringValue(Object value) {
        if (value instanceof String) {
            return value;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return null;
    }

    private Object toInteger(Object value) {
        if (value instanceof Integer || value instanceof Long) {
            return value;
        }
        if (value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number number) {
            BigDecimal parsed = parseDecimal(number.toString());
            return parsed == null ? null : integralValue(parsed);
        }
        if (value instanceof String text) {
            BigDecimal parsed = parseDecimal(text);
            return parsed == null ? null : integralValue(parsed);
        }
        return null;
    }

    private Object toNumber(Object value) {
        if (value instanceof Number) {
            return value;
        }
        if (value instanceof String text) {
            BigDecimal parsed = parseDecimal(text);
            if (parsed == null) {
                return null;
            }
            return parsed.scale() <= 0 && fitsInLong(parsed) ? (Object) parsed.longValueExact() : (Object) parsed.doubleValue();
        }
        return null;
    }

    private Object toBoolean(Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            if ("true".equalsIgnoreCase(trimmed)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(trimmed)) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    private Object toObject(Object value) {
        if (value instanceof Map) {
            return value;
        }
        if (value instanceof String text && text.trim().startsWith("{")) {
            return parseJson(text, new TypeReference<Map<String, Object>>() {});
        }
        return null;
    }

    private Object toArray(Object value) {
        if (value instanceof List) {
            return value;
        }
        if (value instanceof String text && text.trim().startsWith("[")) {
            return parseJson(text, new TypeReference<List<Object>>() {});
        }
        return null;
    }

    private <T> T parseJson(String text, TypeReference<T> type) {
        try {
            return objectMapper.readValue(text, type);
        } catch (JsonProcessingException e) {
            log.debug("Could not coerce JSON text argument: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static BigDecimal parseDecimal(String text) {
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long integralValue(BigDecimal decimal) {
        BigDecimal stripped = decimal.stripTrailingZeros();
        if (stripped.scale() > 0 || !fitsInLong(stripped)) {
            return null;
        }
        return stripped.longValueExact();
    }

    private static boolean fitsInLong(BigDecimal decimal) {
        BigInteger integer = decimal.toBigInteger();
        return integer.bitLength() < 64;
    }
}
