package io.relay.core.agent;

import io.relay.core.model.ChatMessage;
import io.relay.core.model.ToolDeclaration;
import java.util.List;

/**
 * Input of one turn: the conversation so far, ending with the caller's newest message, and the tools the
 * model may call.
 */
public record ConversationState(List<ChatMessage> messages, List<ToolDeclaration> tools) {

    public ConversationState {
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public static ConversationState of(List<ChatMessage> messages) {
        return new ConversationState(messages, List.of());
    }
}
