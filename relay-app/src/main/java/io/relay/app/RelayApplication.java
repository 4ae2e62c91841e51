package io.relay.app;

import io.relay.cli.CliContext;
import io.relay.cli.InitCommand;
import io.relay.cli.ProvidersCommand;
import io.relay.cli.RelayCliCommand;
import io.relay.cli.TurnCommand;
import io.relay.core.config.ConfigPaths;
import io.relay.core.config.ConfigService;
import io.relay.core.tool.ToolRegistry;
import io.relay.core.tool.impl.ReadFileTool;
import java.nio.file.Path;
import picocli.CommandLine;

public final class RelayApplication {

    private RelayApplication() {
    }

    public static void main(String[] args) {
        ToolRegistry toolRegistry = new ToolRegistry()
            .register(new ReadFileTool(Path.of("").toAbsolutePath()));

        CliContext context = new CliContext(new ConfigService(), resolveConfigPath(), toolRegistry);

        CommandLine commandLine = new CommandLine(new RelayCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("turn", new TurnCommand(context));
        commandLine.addSubcommand("providers", new ProvidersCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static Path resolveConfigPath() {
        Path override = ConfigPaths.resolve(System.getenv("RELAY_CONFIG"));
        return override == null ? ConfigPaths.defaultConfigPath() : override;
    }
}
