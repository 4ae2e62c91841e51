package io.relay.core.policy;

import java.time.Duration;
import java.util.Objects;

public record RetryDecision(Action action, Duration delay) {

    public enum Action {
        RETRY,
        FALLBACK,
        FAIL
    }

    public RetryDecision {
        Objects.requireNonNull(action, "action must not be null");
        delay = delay == null ? Duration.ZERO : delay;
    }

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(Action.RETRY, delay);
    }

    public static RetryDecision fallback() {
        return new RetryDecision(Action.FALLBACK, Duration.ZERO);
    }

    public static RetryDecision fail() {
        return new RetryDecision(Action.FAIL, Duration.ZERO);
    }
}
