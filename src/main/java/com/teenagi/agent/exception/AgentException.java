package com.teenagi.agent.exception;

/**
 * Root of every failure raised by the agent.
 * Unchecked so callers of {@code respond} only handle what they care about.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
