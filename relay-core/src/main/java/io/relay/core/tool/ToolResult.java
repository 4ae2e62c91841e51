package io.relay.core.tool;

public record ToolResult(Object value) {

    public static ToolResult of(Object value) {
        return new ToolResult(value);
    }
}
