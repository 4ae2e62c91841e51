package io.relay.core.agent;

import io.relay.core.error.ProviderError;
import io.relay.core.event.FinishReason;
import io.relay.core.event.TokenUsage;
import io.relay.core.model.ChatMessage;
import java.util.List;
import java.util.Objects;

/**
 * @param messages messages this turn appended to the conversation, in order
 * @param text text of the last assistant message
 * @param error last concrete error of a failed turn, {@code null} otherwise
 * @param cancelledToolCalls ids of tool calls that were still open when the turn was aborted
 */
public record TurnResult(
    TurnOutcome outcome,
    List<ChatMessage> messages,
    String text,
    FinishReason finishReason,
    TokenUsage usage,
    ProviderError error,
    int retries,
    int fallbacks,
    List<String> cancelledToolCalls,
    boolean iterationLimitReached
) {
    public TurnResult {
        Objects.requireNonNull(outcome, "outcome must not be null");
        messages = messages == null ? List.of() : List.copyOf(messages);
        text = text == null ? "" : text;
        usage = usage == null ? TokenUsage.EMPTY : usage;
        cancelledToolCalls = cancelledToolCalls == null ? List.of() : List.copyOf(cancelledToolCalls);
    }

    public boolean completed() {
        return outcome == TurnOutcome.COMPLETED;
    }
}
