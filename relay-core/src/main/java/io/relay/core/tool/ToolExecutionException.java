package io.relay.core.tool;

public class ToolExecutionException extends Exception {
    private final boolean fatal;

    public ToolExecutionException(String message) {
        this(message, false, null);
    }

    public ToolExecutionException(String message, boolean fatal, Throwable cause) {
        super(message, cause);
        this.fatal = fatal;
    }

    public static ToolExecutionException fatal(String message) {
        return new ToolExecutionException(message, true, null);
    }

    /** A fatal failure ends the turn instead of being reported back to the model. */
    public boolean isFatal() {
        return fatal;
    }
}
