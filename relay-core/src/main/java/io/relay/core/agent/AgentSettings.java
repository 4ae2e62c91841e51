package io.relay.core.agent;

import io.relay.core.model.ReasoningEffort;

public record AgentSettings(
    String systemPrompt,
    String provider,
    String model,
    int maxToolIterations,
    ReasoningEffort reasoning,
    Integer maxTokens
) {
    public static final int DEFAULT_MAX_TOOL_ITERATIONS = 20;

    public AgentSettings {
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        provider = provider == null ? "" : provider.trim();
        model = model == null ? "" : model.trim();
        maxToolIterations = maxToolIterations <= 0 ? DEFAULT_MAX_TOOL_ITERATIONS : maxToolIterations;
        maxTokens = maxTokens == null || maxTokens <= 0 ? null : maxTokens;
    }

    public AgentSettings(String systemPrompt, String provider, String model, int maxToolIterations) {
        this(systemPrompt, provider, model, maxToolIterations, null, null);
    }
}
