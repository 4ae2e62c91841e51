package io.relay.core.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonlMetricsSinkTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldAppendOneJsonObjectPerLine() throws IOException {
        Path file = tempDir.resolve("metrics/events.jsonl");
        JsonlMetricsSink sink = new JsonlMetricsSink(file);

        sink.write(List.of(new MetricsEvent("e1", Instant.parse("2025-03-01T10:00:00Z"), "turn_started",
            Map.of("turn_id", "t1"))));
        sink.write(List.of(new MetricsEvent("e2", Instant.parse("2025-03-01T10:00:01Z"), "turn_finished",
            Map.of("turn_id", "t1", "retries", 2))));

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(2);
        JsonNode second = new ObjectMapper().readTree(lines.get(1));
        assertThat(second.path("type").asText()).isEqualTo("turn_finished");
        assertThat(second.path("timestamp").asText()).isEqualTo("2025-03-01T10:00:01Z");
        assertThat(second.path("attributes").path("retries").asInt()).isEqualTo(2);
    }
}
