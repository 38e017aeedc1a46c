package com.teenagi.agent.exception;

import com.teenagi.agent.function.ParameterType;

public class TypeCoercionException extends ArgumentValidationException {

    public TypeCoercionException(String functionName, String parameterName,
                                 ParameterType expectedType, Object actual) {
        super(String.format("Argument '%s' for function '%s' must be %s but was %s: %s",
                        parameterName, functionName, expectedType.jsonType(),
                        describeType(actual), actual),
                functionName, parameterName, expectedType);
    }

    private static String describeType(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
