package io.relay.core.agent;

public enum TurnOutcome {
    COMPLETED,
    ABORTED,
    FAILED;

    TurnState state() {
        return switch (this) {
            case COMPLETED -> TurnState.COMPLETED;
            case ABORTED -> TurnState.ABORTED;
            case FAILED -> TurnState.FAILED;
        };
    }
}
