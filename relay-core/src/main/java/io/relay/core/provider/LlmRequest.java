package io.relay.core.provider;

import io.relay.core.model.ChatMessage;
import io.relay.core.model.ReasoningEffort;
import io.relay.core.model.ToolDeclaration;
import java.util.List;
import java.util.Objects;

public record LlmRequest(
    String providerId,
    ApiShape api,
    String model,
    List<ChatMessage> messages,
    List<ToolDeclaration> tools,
    ReasoningEffort reasoning,
    Integer maxTokens
) {
    public LlmRequest {
        Objects.requireNonNull(providerId, "providerId must not be null");
        Objects.requireNonNull(api, "api must not be null");
        Objects.requireNonNull(model, "model must not be null");
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
        maxTokens = maxTokens == null || maxTokens <= 0 ? null : maxTokens;
    }

    public static LlmRequest forRoute(
        RoutingDecision route,
        List<ChatMessage> messages,
        List<ToolDeclaration> tools,
        ReasoningEffort reasoning,
        Integer maxTokens
    ) {
        Integer limit = maxTokens != null ? maxTokens : route.profile().maxTokens();
        return new LlmRequest(route.profile().name(), route.api(), route.model(), messages, tools, reasoning, limit);
    }
}
