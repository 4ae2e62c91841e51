package io.relay.core.observability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

/**
 * Appends one JSON object per event to a file.
 */
public final class JsonlMetricsSink implements MetricsSink {
    private final Path path;
    private final ObjectMapper mapper;

    public JsonlMetricsSink(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized void write(List<MetricsEvent> events) throws IOException {
        if (events.isEmpty()) {
            return;
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        StringBuilder lines = new StringBuilder();
        for (MetricsEvent event : events) {
            lines.append(mapper.writeValueAsString(event)).append(System.lineSeparator());
        }
        Files.writeString(path, lines, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }
}
