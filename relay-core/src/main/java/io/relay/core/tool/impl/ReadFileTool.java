package io.relay.core.tool.impl;

import io.relay.core.tool.Tool;
import io.relay.core.tool.ToolExecutionException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Reads files and lists directories below a root directory. Paths that resolve outside the root are rejected.
 */
public final class ReadFileTool implements Tool {
    private static final int MAX_CHARS = 64 * 1024;

    private final Path root;

    public ReadFileTool(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
    }

    @Override
    public String name() {
        return "read_file";
    }

    @Override
    public String description() {
        return "Read a text file, or list a directory, relative to the working directory";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "path", Map.of("type", "string", "description", "File or directory path")
            ),
            "required", new String[] {"path"}
        );
    }

    @Override
    public String execute(Map<String, Object> input) throws ToolExecutionException {
        Object rawPath = input.get("path");
        String pathArg = rawPath == null ? "" : String.valueOf(rawPath).trim();
        if (pathArg.isBlank()) {
            throw new ToolExecutionException("path is required");
        }

        Path target = root.resolve(pathArg).normalize();
        if (!target.startsWith(root)) {
            throw new ToolExecutionException("path escapes the working directory: " + pathArg);
        }
        if (!Files.exists(target)) {
            throw new ToolExecutionException("file not found: " + pathArg);
        }
        try {
            return Files.isDirectory(target) ? listDirectory(target) : readFile(target);
        } catch (IOException e) {
            throw new ToolExecutionException("could not read " + pathArg + ": " + e.getMessage(), false, e);
        }
    }

    private String readFile(Path target) throws IOException {
        String content = Files.readString(target, StandardCharsets.UTF_8);
        if (content.length() > MAX_CHARS) {
            return content.substring(0, MAX_CHARS) + "\n[truncated]";
        }
        return content;
    }

    private String listDirectory(Path target) throws IOException {
        try (var stream = Files.list(target)) {
            return stream
                .sorted(Comparator.comparing(Path::toString))
                .map(path -> {
                    String type = Files.isDirectory(path) ? "dir" : "file";
                    return type + " " + target.relativize(path);
                })
                .collect(Collectors.joining("\n"));
        }
    }
}
