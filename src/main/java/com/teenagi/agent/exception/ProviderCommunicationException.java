package com.teenagi.agent.exception;

/**
 * The model backend could not be reached, rejected our credentials,
 * timed out, or returned a body that is not a valid response at all.
 * Fatal to the current {@code respond} call.
 */
public class ProviderCommunicationException extends AgentException {

    public ProviderCommunicationException(String message) {
        super(message);
    }

    public ProviderCommunicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
