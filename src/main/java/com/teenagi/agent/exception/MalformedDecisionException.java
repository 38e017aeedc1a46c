package com.teenagi.agent.exception;

import com.teenagi.agent.model.Decision;

/**
 * The backend answered, but its response is neither a final answer nor a
 * usable function call proposal.
 *
 * When the proposal itself could be read (name and id present), the adapter
 * attaches it as {@link #getSalvageableDecision()} with the offending calls
 * marked, so the loop can feed the problem back to the model instead of
 * failing the whole request.
 */
public class MalformedDecisionException extends AgentException {

    private final transient Decision salvageableDecision;

    public MalformedDecisionException(String message) {
        this(message, null, null);
    }

    public MalformedDecisionException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public MalformedDecisionException(String message, Decision salvageableDecision, Throwable cause) {
        super(message, cause);
        this.salvageableDecision = salvageableDecision;
    }

    public Decision getSalvageableDecision() {
        return salvageableDecision;
    }

    public boolean isSalvageable() {
        return salvageableDecision != null;
    }
}
