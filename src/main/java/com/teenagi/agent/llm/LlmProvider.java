package com.teenagi.agent.llm;

import com.teenagi.agent.exception.ConfigurationException;

import java.util.Arrays;

public enum LlmProvider {
    OPENAI("openai", "OPENAI_API_KEY"),
    ANTHROPIC("anthropic", "ANTHROPIC_API_KEY");

    private final String id;
    private final String apiKeyEnvVar;

    LlmProvider(String id, String apiKeyEnvVar) {
        this.id = id;
        this.apiKeyEnvVar = apiKeyEnvVar;
    }

    public String id() {
        return id;
    }

    public String apiKeyEnvVar() {
        return apiKeyEnvVar;
    }

    public static LlmProvider fromName(String name) {
        return Arrays.stream(values())
                .filter(p -> p.id.equalsIgnoreCase(name == null ? "" : name.trim()))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException(
                        "Unsupported provider: " + name + ". Use 'openai' or 'anthropic'"));
    }
}
