package com.teenagi.agent.config;

import com.teenagi.agent.exception.ConfigurationException;
import com.teenagi.agent.function.RegistrationPolicy;
import com.teenagi.agent.llm.LlmProvider;
import com.teenagi.agent.llm.LlmProviderProperties;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Strongly-typed configuration for the agent.
 * Bound from application.yml under the "agent" prefix.
 */
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    /** Display name, used in the system prompt */
    private String name = "TeenAGI";

    /** openai | anthropic */
    private String provider = "openai";

    /** Overrides the provider's default model when set */
    private String model;

    private int maxIterations = 5;
    private int malformedDecisionRetries = 1;
    private long decisionTimeoutMs = 60_000;
    private long functionTimeoutMs = 30_000;
    private RegistrationPolicy registrationPolicy = RegistrationPolicy.REPLACE;

    /** Capabilities the default agent learns at startup */
    private List<String> capabilities = new ArrayList<>();

    private Providers providers = new Providers();
    private Http http = new Http();
    private Pool decisionPool = new Pool();
    private Pool functionPool = new Pool();

    public LlmProviderProperties providerProperties(LlmProvider provider) {
        LlmProviderProperties props = switch (provider) {
            case OPENAI -> providers.getOpenai();
            case ANTHROPIC -> providers.getAnthropic();
        };
        if (props == null) {
            throw new ConfigurationException("No settings for provider '" + provider.id() + "'");
        }
        return props;
    }

    @Data
    public static class Providers {
        private LlmProviderProperties openai = openAiDefaults();
        private LlmProviderProperties anthropic = anthropicDefaults();

        private static LlmProviderProperties openAiDefaults() {
            LlmProviderProperties p = new LlmProviderProperties();
            p.setBaseUrl("https://api.openai.com/v1");
            p.setModel("gpt-4o-mini");
            return p;
        }

        private static LlmProviderProperties anthropicDefaults() {
            LlmProviderProperties p = new LlmProviderProperties();
            p.setBaseUrl("https://api.anthropic.com/v1");
            p.setModel("claude-3-haiku-20240307");
            p.setApiVersion("2023-06-01");
            return p;
        }
    }

    @Data
    public static class Http {
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 60_000;
    }

    @Data
    public static class Pool {
        private int corePoolSize = 2;
        private int maxPoolSize = 8;
        private int queueCapacity = 50;
    }
}
