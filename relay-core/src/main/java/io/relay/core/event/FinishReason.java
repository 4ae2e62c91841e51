package io.relay.core.event;

public enum FinishReason {
    STOP,
    LENGTH,
    TOOL_USE,
    CONTENT_FILTER
}
