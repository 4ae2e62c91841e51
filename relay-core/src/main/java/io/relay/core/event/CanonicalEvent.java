package io.relay.core.event;

import io.relay.core.error.ProviderError;
import java.util.Objects;

/**
 * Provider-independent unit of streamed model output.
 *
 * <p>For any tool call id the events form the sequence open, zero or more argument deltas, close.
 * A stream of events for one attempt ends with exactly one {@link Finish} or {@link StreamError}.
 */
public interface CanonicalEvent {

    Type type();

    default boolean isTerminal() {
        return type() == Type.FINISH || type() == Type.ERROR;
    }

    /** Id of the tool call this event belongs to, or {@code null} for events that are not tool-call scoped. */
    default String toolCallId() {
        return null;
    }

    enum Type {
        TEXT_DELTA,
        REASONING_DELTA,
        TOOL_CALL_OPEN,
        TOOL_CALL_ARG_DELTA,
        TOOL_CALL_CLOSE,
        USAGE,
        FINISH,
        ERROR
    }

    record TextDelta(String text) implements CanonicalEvent {
        public TextDelta {
            text = text == null ? "" : text;
        }

        @Override
        public Type type() {
            return Type.TEXT_DELTA;
        }
    }

    /** Reasoning text; {@code signature} is set on the delta that seals a signed thinking block. */
    record ReasoningDelta(String text, String signature) implements CanonicalEvent {
        public ReasoningDelta {
            text = text == null ? "" : text;
            signature = signature == null ? "" : signature;
        }

        public ReasoningDelta(String text) {
            this(text, "");
        }

        @Override
        public Type type() {
            return Type.REASONING_DELTA;
        }
    }

    record ToolCallOpen(String id, String name) implements CanonicalEvent {
        public ToolCallOpen {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public Type type() {
            return Type.TOOL_CALL_OPEN;
        }

        @Override
        public String toolCallId() {
            return id;
        }
    }

    record ToolCallArgDelta(String id, String fragment) implements CanonicalEvent {
        public ToolCallArgDelta {
            Objects.requireNonNull(id, "id must not be null");
            fragment = fragment == null ? "" : fragment;
        }

        @Override
        public Type type() {
            return Type.TOOL_CALL_ARG_DELTA;
        }

        @Override
        public String toolCallId() {
            return id;
        }
    }

    record ToolCallClose(String id) implements CanonicalEvent {
        public ToolCallClose {
            Objects.requireNonNull(id, "id must not be null");
        }

        @Override
        public Type type() {
            return Type.TOOL_CALL_CLOSE;
        }

        @Override
        public String toolCallId() {
            return id;
        }
    }

    record Usage(TokenUsage usage) implements CanonicalEvent {
        public Usage {
            usage = usage == null ? TokenUsage.EMPTY : usage;
        }

        @Override
        public Type type() {
            return Type.USAGE;
        }
    }

    record Finish(FinishReason reason) implements CanonicalEvent {
        public Finish {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        @Override
        public Type type() {
            return Type.FINISH;
        }
    }

    record StreamError(ProviderError error) implements CanonicalEvent {
        public StreamError {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public Type type() {
            return Type.ERROR;
        }
    }
}
