package io.relay.core.tool;

import io.relay.core.model.ToolDeclaration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RegistryToolExecutor implements ToolExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(RegistryToolExecutor.class);

    private final ToolRegistry registry;

    public RegistryToolExecutor(ToolRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    @Override
    public ToolResult execute(String name, Map<String, Object> arguments) throws ToolExecutionException {
        Tool tool = registry.find(name)
            .orElseThrow(() -> new ToolExecutionException("Tool '" + name + "' not found"));
        try {
            return ToolResult.of(tool.execute(arguments));
        } catch (RuntimeException e) {
            LOG.warn("Tool {} failed", name, e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            throw new ToolExecutionException("Error executing tool '" + name + "': " + message, false, e);
        }
    }

    @Override
    public List<ToolDeclaration> declarations() {
        return registry.all().stream()
            .map(Tool::declaration)
            .sorted(Comparator.comparing(ToolDeclaration::name))
            .toList();
    }
}
