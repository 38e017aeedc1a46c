package com.teenagi.agent.exception;

/**
 * Invalid agent configuration (e.g. an unknown provider name).
 * Raised while building the agent, before any model round-trip.
 */
public class ConfigurationException extends AgentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
