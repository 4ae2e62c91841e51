package io.relay.core.agent;

import io.relay.core.error.ProviderError;
import io.relay.core.event.CanonicalEvent;
import io.relay.core.model.ChatMessage;
import io.relay.core.model.ToolCall;

/**
 * Receives a turn's progress on the turn's thread. Canonical events arrive in stream order; error events are
 * not forwarded because a failed attempt may still be retried.
 */
public interface TurnListener {

    TurnListener NONE = new TurnListener() {
    };

    default void onEvent(CanonicalEvent event) {
    }

    default void onToolResult(ToolCall call, ChatMessage result) {
    }

    /** Events already delivered for {@code attempt} belong to an attempt that is being retried or replaced. */
    default void onAttemptDiscarded(int attempt, ProviderError error) {
    }

    default void onStateChanged(TurnState state) {
    }
}
