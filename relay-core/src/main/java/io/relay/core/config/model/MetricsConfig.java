package io.relay.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param path JSONL file receiving metrics events; blank sends them to the debug log instead
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MetricsConfig(
    @JsonProperty("buffer_size") @JsonAlias({"bufferSize"}) int bufferSize,
    String path
) {

    public static MetricsConfig defaults() {
        return new MetricsConfig(1024, "");
    }
}
