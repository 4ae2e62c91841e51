package io.relay.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentConfig(
    String provider,
    String model,
    @JsonProperty("system_prompt") @JsonAlias({"systemPrompt"}) String systemPrompt,
    @JsonProperty("max_tool_iterations") @JsonAlias({"maxToolIterations"}) int maxToolIterations,
    String reasoning,
    @JsonProperty("max_tokens") @JsonAlias({"maxTokens"}) Integer maxTokens
) {

    public static AgentConfig defaults() {
        return new AgentConfig(
            "*",
            "",
            "You are a helpful assistant. Use the available tools when they help answer the request.",
            20,
            "",
            null
        );
    }
}
