package io.relay.core.model;

import java.util.Map;
import java.util.Objects;

public record ToolDeclaration(String name, String description, Map<String, Object> parameters) {

    public ToolDeclaration {
        Objects.requireNonNull(name, "name must not be null");
        description = description == null ? "" : description;
        parameters = parameters == null || parameters.isEmpty()
            ? Map.of("type", "object", "properties", Map.of())
            : Map.copyOf(parameters);
    }
}
