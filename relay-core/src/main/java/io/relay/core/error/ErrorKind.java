package io.relay.core.error;

public enum ErrorKind {
    NETWORK_ERROR(true),
    RATE_LIMITED(true),
    SHAPE_MISMATCH(false),
    AUTH_ERROR(false),
    CONFIG_ERROR(false),
    MALFORMED_STREAM(false),
    REQUEST_REJECTED(false),
    TOOL_EXECUTION_ERROR(false);

    private final boolean transientFailure;

    ErrorKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
