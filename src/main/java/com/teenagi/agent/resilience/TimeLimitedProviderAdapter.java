package com.teenagi.agent.resilience;

import com.teenagi.agent.exception.AgentException;
import com.teenagi.agent.exception.ProviderCommunicationException;
import com.teenagi.agent.llm.DecisionRequest;
import com.teenagi.agent.llm.ProviderAdapter;
import com.teenagi.agent.model.Decision;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeoutException;

/**
 * Decorator that puts an explicit deadline on every model round-trip.
 *
 * A round-trip that overruns is reported as a ProviderCommunicationException,
 * the same path as any other backend failure. No retries: whether to try
 * again is the caller's decision.
 */
@Slf4j
public class TimeLimitedProviderAdapter implements ProviderAdapter {

    private final ProviderAdapter delegate;
    private final TimeLimitedExecutor executor;

    public TimeLimitedProviderAdapter(ProviderAdapter delegate, TimeLimitedExecutor executor) {
        this.delegate = delegate;
        this.executor = executor;
    }

    @Override
    public Decision decide(DecisionRequest request) {
        try {
            return executor.call(() -> delegate.decide(request));
        } catch (TimeoutException e) {
            log.error("{} did not answer within {}", delegate.providerName(), executor.getTimeout());
            throw new ProviderCommunicationException(
                    delegate.providerName() + " did not answer within " + executor.getTimeout().toMillis() + "ms", e);
        } catch (InterruptedException e) {
            throw new AgentException("Interrupted while waiting for " + delegate.providerName(), e);
        } catch (AgentException e) {
            throw e;
        } catch (Exception e) {
            throw new ProviderCommunicationException(
                    delegate.providerName() + " call failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String providerName() {
        return delegate.providerName();
    }
}
