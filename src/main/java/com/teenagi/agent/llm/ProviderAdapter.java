package com.teenagi.agent.llm;

import com.teenagi.agent.model.Decision;

/**
 * Normalized contract over every supported model backend.
 *
 * One call is one model round-trip and yields exactly one {@link Decision}.
 * Implementations translate the request into the backend's wire format and the
 * backend's reply back into a Decision; nothing backend-specific leaks out.
 * Implementations do not retry.
 */
public interface ProviderAdapter {

    /**
     * @param request system prompt, declared functions and the full history so far
     * @return either a final answer or an ordered list of proposed function calls
     * @throws com.teenagi.agent.exception.ProviderCommunicationException backend unreachable,
     *         credentials missing or rejected, or a reply that is not a response at all
     * @throws com.teenagi.agent.exception.MalformedDecisionException reply matches neither variant
     */
    Decision decide(DecisionRequest request);

    String providerName();
}
