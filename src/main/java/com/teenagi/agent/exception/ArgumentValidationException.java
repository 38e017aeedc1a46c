package com.teenagi.agent.exception;

import com.teenagi.agent.function.ParameterType;

/**
 * Arguments proposed by the model do not fit the function's declared parameters.
 * The message is written for the model: it names the parameter and the expected type.
 */
public abstract class ArgumentValidationException extends AgentException {

    private final String functionName;
    private final String parameterName;
    private final ParameterType expectedType;

    protected ArgumentValidationException(String message, String functionName,
                                          String parameterName, ParameterType expectedType) {
        super(message);
        this.functionName = functionName;
        this.parameterName = parameterName;
        this.expectedType = expectedType;
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getParameterName() {
        return parameterName;
    }

    public ParameterType getExpectedType() {
        return expectedType;
    }
}
