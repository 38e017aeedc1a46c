package com.teenagi.agent.llm;

import lombok.Data;

/**
 * Holds config for a single LLM provider.
 * Populated from application.yml under agent.providers.openai / agent.providers.anthropic.
 */
@Data
public class LlmProviderProperties {
    private String apiKey;
    private String baseUrl;
    private String model;
    private int maxTokens = 1000;
    private double temperature = 0.7;
    /** Anthropic only: value of the anthropic-version header */
    private String apiVersion;

    public LlmProviderProperties copy() {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(apiKey); p.setBaseUrl(baseUrl); p.setModel(model);
        p.setMaxTokens(maxTokens); p.setTemperature(temperature); p.setApiVersion(apiVersion);
        return p;
    }
}
