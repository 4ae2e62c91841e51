package io.relay.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.relay.core.config.ConfigService;
import io.relay.core.tool.ToolRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class InitCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteDefaultConfig() throws Exception {
        Path configPath = tempDir.resolve("relay/config.json");
        CliContext context = new CliContext(new ConfigService(), configPath, new ToolRegistry());

        int code = new CommandLine(new InitCommand(context)).execute();

        assertThat(code).isZero();
        assertThat(Files.readString(configPath))
            .contains("\"openai-responses\"")
            .contains("\"$ANTHROPIC_API_KEY\"")
            .contains("\"max_tool_iterations\" : 20");
    }
}
