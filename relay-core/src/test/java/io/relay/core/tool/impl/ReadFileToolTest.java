package io.relay.core.tool.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.relay.core.tool.ToolExecutionException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReadFileToolTest {

    @TempDir
    Path tempDir;

    private ReadFileTool tool;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(tempDir.resolve("a.txt"), "alpha");
        Files.createDirectories(tempDir.resolve("docs"));
        Files.writeString(tempDir.resolve("docs/readme.md"), "# docs");
        tool = new ReadFileTool(tempDir);
    }

    @Test
    void shouldReadFileRelativeToRoot() throws ToolExecutionException {
        assertThat(tool.execute(Map.of("path", "a.txt"))).isEqualTo("alpha");
        assertThat(tool.execute(Map.of("path", "docs/readme.md"))).isEqualTo("# docs");
    }

    @Test
    void shouldListDirectory() throws ToolExecutionException {
        assertThat(tool.execute(Map.of("path", "."))).isEqualTo("file a.txt\ndir docs");
    }

    @Test
    void shouldTruncateLargeFiles() throws IOException, ToolExecutionException {
        Files.writeString(tempDir.resolve("big.txt"), "x".repeat(70_000));

        String content = tool.execute(Map.of("path", "big.txt"));

        assertThat(content).endsWith("[truncated]");
        assertThat(content.length()).isLessThan(70_000);
    }

    @Test
    void shouldRejectPathsOutsideRoot() {
        assertThatThrownBy(() -> tool.execute(Map.of("path", "../outside.txt")))
            .isInstanceOf(ToolExecutionException.class)
            .hasMessageContaining("escapes the working directory");
    }

    @Test
    void shouldReportMissingFilesAndArguments() {
        assertThatThrownBy(() -> tool.execute(Map.of("path", "nope.txt")))
            .hasMessage("file not found: nope.txt");
        assertThatThrownBy(() -> tool.execute(Map.of()))
            .hasMessage("path is required");
    }
}
