package com.teenagi.agent.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teenagi.agent.capability.CapabilityRegistry;
import com.teenagi.agent.config.AgentProperties;
import com.teenagi.agent.exception.ConfigurationException;
import com.teenagi.agent.function.ArgumentValidator;
import com.teenagi.agent.function.FunctionRegistry;
import com.teenagi.agent.llm.AnthropicProviderAdapter;
import com.teenagi.agent.llm.LlmProvider;
import com.teenagi.agent.llm.LlmProviderProperties;
import com.teenagi.agent.llm.OpenAiProviderAdapter;
import com.teenagi.agent.llm.ProviderAdapter;
import com.teenagi.agent.resilience.TimeLimitedExecutor;
import com.teenagi.agent.resilience.TimeLimitedProviderAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Builds agents from {name, provider, model}.
 *
 * An unknown provider fails here with ConfigurationException. Missing
 * credentials do not: they surface as ProviderCommunicationException on the
 * first {@code respond}.
 */
@Component
@Slf4j
public class AgentFactory {

    private final AgentProperties properties;
    private final ObjectMapper objectMapper;
    private final RestClient.Builder restClientBuilder;
    private final AsyncTaskExecutor decisionTaskExecutor;
    private final AsyncTaskExecutor functionTaskExecutor;

    public AgentFactory(AgentProperties properties,
                        ObjectMapper objectMapper,
                        RestClient.Builder restClientBuilder,
                        @Qualifier("decisionTaskExecutor") AsyncTaskExecutor decisionTaskExecutor,
                        @Qualifier("functionTaskExecutor") AsyncTaskExecutor functionTaskExecutor) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.restClientBuilder = restClientBuilder;
        this.decisionTaskExecutor = decisionTaskExecutor;
        this.functionTaskExecutor = functionTaskExecutor;
    }

    /** Agent configured entirely from application properties. */
    public Agent create() {
        return create(properties.getName(), properties.getProvider(), properties.getModel());
    }

    /**
     * @param model backend-specific model id; null or blank selects the provider's configured default
     */
    public Agent create(String name, String provider, String model) {
        LlmProvider llmProvider = LlmProvider.fromName(provider);
        LlmProviderProperties providerProps = properties.providerProperties(llmProvider).copy();
        if (model != null && !model.isBlank()) {
            providerProps.setModel(model);
        }
        if (providerProps.getModel() == null || providerProps.getModel().isBlank()) {
            throw new ConfigurationException("No model configured for provider '" + llmProvider.id() + "'");
        }
        String agentName = name != null && !name.isBlank() ? name : properties.getName();

        ProviderAdapter adapter = new TimeLimitedProviderAdapter(
                createAdapter(llmProvider, providerProps),
                new TimeLimitedExecutor("decision", decisionTaskExecutor,
                        Duration.ofMillis(properties.getDecisionTimeoutMs())));

        CapabilityRegistry capabilities = new CapabilityRegistry();
        FunctionRegistry functions = new FunctionRegistry(properties.getRegistrationPolicy());

        AgentLoop loop = new AgentLoop(
                agentName,
                adapter,
                capabilities,
                functions,
                new ArgumentValidator(objectMapper),
                new PromptBuilder(),
                new TimeLimitedExecutor("function", functionTaskExecutor,
                        Duration.ofMillis(properties.getFunctionTimeoutMs())),
                objectMapper,
                LoopSettings.builder()
                        .maxIterations(properties.getMaxIterations())
                        .malformedDecisionRetries(properties.getMalformedDecisionRetries())
                        .build());

        log.info("Initializing {} with provider: {} [model={}]", agentName, llmProvider.id(), providerProps.getModel());
        return new Agent(agentName, llmProvider.id(), providerProps.getModel(), capabilities, functions, loop);
    }

    ProviderAdapter createAdapter(LlmProvider provider, LlmProviderProperties providerProps) {
        return switch (provider) {
            case OPENAI -> new OpenAiProviderAdapter(providerProps, objectMapper, restClientBuilder.clone());
            case ANTHROPIC -> new AnthropicProviderAdapter(providerProps, objectMapper, restClientBuilder.clone());
        };
    }
}
