package com.teenagi.agent.exception;

public class FunctionNotFoundException extends AgentException {

    private final String functionName;

    public FunctionNotFoundException(String functionName) {
        super("Function '" + functionName + "' is not registered");
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
