package io.relay.core.model;

import java.util.List;
import java.util.Objects;

public record ChatMessage(
    MessageRole role,
    String content,
    String toolCallId,
    List<ToolCall> toolCalls,
    boolean toolError,
    String reasoning,
    String reasoningSignature
) {

    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        reasoning = reasoning == null ? "" : reasoning;
        reasoningSignature = reasoningSignature == null ? "" : reasoningSignature;
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(MessageRole.SYSTEM, content, null, List.of(), false, "", "");
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(MessageRole.USER, content, null, List.of(), false, "", "");
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(MessageRole.ASSISTANT, content, null, List.of(), false, "", "");
    }

    public static ChatMessage assistantWithToolCalls(String content, List<ToolCall> toolCalls) {
        return new ChatMessage(MessageRole.ASSISTANT, content, null, toolCalls, false, "", "");
    }

    /**
     * Assistant turn that keeps the model's reasoning. Providers that sign their thinking blocks require the
     * text and signature back unchanged before the tool calls they led to.
     */
    public static ChatMessage assistantWithReasoning(String content, List<ToolCall> toolCalls, String reasoning,
                                                     String reasoningSignature) {
        return new ChatMessage(MessageRole.ASSISTANT, content, null, toolCalls, false, reasoning, reasoningSignature);
    }

    public static ChatMessage tool(String content, String toolCallId) {
        return new ChatMessage(MessageRole.TOOL, content, toolCallId, List.of(), false, "", "");
    }

    public static ChatMessage toolError(String content, String toolCallId) {
        return new ChatMessage(MessageRole.TOOL, content, toolCallId, List.of(), true, "", "");
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public boolean hasSignedReasoning() {
        return !reasoningSignature.isEmpty();
    }
}
