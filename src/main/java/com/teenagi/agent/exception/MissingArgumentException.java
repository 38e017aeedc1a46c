package com.teenagi.agent.exception;

import com.teenagi.agent.function.ParameterType;

public class MissingArgumentException extends ArgumentValidationException {

    public MissingArgumentException(String functionName, String parameterName, ParameterType expectedType) {
        super(String.format("Missing required argument '%s' (expected %s) for function '%s'",
                        parameterName, expectedType.jsonType(), functionName),
                functionName, parameterName, expectedType);
    }
}
