package io.relay.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.relay.core.policy.BackoffSchedule;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RetryConfig(
    @JsonProperty("max_attempts") @JsonAlias({"maxAttempts"}) int maxAttempts,
    @JsonProperty("initial_backoff") @JsonAlias({"initialBackoff"}) Duration initialBackoff,
    @JsonProperty("max_backoff") @JsonAlias({"maxBackoff"}) Duration maxBackoff,
    double multiplier,
    double jitter
) {

    public static RetryConfig defaults() {
        BackoffSchedule schedule = BackoffSchedule.defaults();
        return new RetryConfig(
            schedule.maxAttempts(),
            schedule.initialBackoff(),
            schedule.maxBackoff(),
            schedule.multiplier(),
            schedule.jitter()
        );
    }

    public BackoffSchedule toSchedule() {
        return new BackoffSchedule(maxAttempts, initialBackoff, maxBackoff, multiplier, jitter);
    }
}
