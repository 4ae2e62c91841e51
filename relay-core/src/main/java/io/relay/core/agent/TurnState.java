package io.relay.core.agent;

public enum TurnState {
    IDLE,
    SENDING,
    STREAMING,
    TOOL_DISPATCH,
    COMPLETED,
    ABORTED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED || this == FAILED;
    }
}
