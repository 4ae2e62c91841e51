package io.relay.core.tool;

import io.relay.core.model.ToolDeclaration;
import java.util.List;
import java.util.Map;

/**
 * Executes tool calls on behalf of the agent loop. Calls are made one at a time from the turn's thread.
 */
public interface ToolExecutor {

    ToolResult execute(String name, Map<String, Object> arguments) throws ToolExecutionException;

    default List<ToolDeclaration> declarations() {
        return List.of();
    }
}
