package com.teenagi.agent.exception;

/**
 * Thrown under the REJECT registration policy when a function name is already taken.
 */
public class DuplicateRegistrationException extends AgentException {

    public DuplicateRegistrationException(String functionName) {
        super("Function '" + functionName + "' is already registered");
    }
}
