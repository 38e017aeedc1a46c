package com.teenagi.agent.config;

import com.teenagi.agent.core.Agent;
import com.teenagi.agent.core.AgentFactory;
import com.teenagi.agent.function.AgentFunction;
import com.teenagi.agent.llm.LlmProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the default agent served over HTTP: built from application
 * properties, with every AgentFunction bean registered and the configured
 * capabilities learned.
 */
@Configuration
@Slf4j
public class AgentConfig {

    @Bean
    public Agent defaultAgent(AgentFactory agentFactory, AgentProperties properties, List<AgentFunction> functions) {
        Agent agent = agentFactory.create();
        functions.forEach(agent::registerFunction);
        properties.getCapabilities().forEach(agent::learn);

        LlmProvider provider = LlmProvider.fromName(agent.getProvider());
        log.info("================================================================");
        log.info("  Agent               : {}", agent.getName());
        log.info("  Active LLM Provider : {}", provider.id().toUpperCase());
        log.info("  Model               : {}", agent.getModel());
        log.info("  Functions           : {}", agent.getFunctions().size());
        log.info("  Capabilities        : {}", agent.getCapabilities().size());
        logKey(provider, properties.providerProperties(provider).getApiKey());
        log.info("================================================================");
        return agent;
    }

    private void logKey(LlmProvider provider, String key) {
        if (key == null || key.isBlank()) {
            log.warn("  API key not set! Set env var: {}={your-key}", provider.apiKeyEnvVar());
        } else {
            log.info("  Key                 : {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
