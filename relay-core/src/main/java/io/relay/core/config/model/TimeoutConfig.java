package io.relay.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TimeoutConfig(Duration connect, Duration read, Duration attempt) {

    public static TimeoutConfig defaults() {
        return new TimeoutConfig(Duration.ofSeconds(20), Duration.ofSeconds(90), Duration.ofMinutes(10));
    }
}
