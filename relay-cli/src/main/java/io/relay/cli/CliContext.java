package io.relay.cli;

import io.relay.core.config.ConfigService;
import io.relay.core.config.RelayRuntime;
import io.relay.core.config.model.RelayConfig;
import io.relay.core.tool.ToolRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Function;

public record CliContext(
    ConfigService configService,
    Path configPath,
    ToolRegistry tools,
    Function<RelayConfig, RelayRuntime> runtimeFactory
) {
    public CliContext(ConfigService configService, Path configPath, ToolRegistry tools) {
        this(configService, configPath, tools, RelayRuntime::create);
    }

    RelayRuntime openRuntime() throws IOException {
        return runtimeFactory.apply(configService.load(configPath));
    }
}
