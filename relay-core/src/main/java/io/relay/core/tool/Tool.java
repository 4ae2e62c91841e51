package io.relay.core.tool;

import io.relay.core.model.ToolDeclaration;
import java.util.Map;

public interface Tool {
    String name();

    String description();

    default Map<String, Object> schema() {
        return Map.of("type", "object", "properties", Map.of());
    }

    Object execute(Map<String, Object> input) throws ToolExecutionException;

    default ToolDeclaration declaration() {
        return new ToolDeclaration(name(), description(), schema());
    }
}
