package io.relay.core.error;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

public record ProviderError(ErrorKind kind, String message, Integer httpStatus, Duration retryAfter) {

    public ProviderError {
        Objects.requireNonNull(kind, "kind must not be null");
        message = message == null ? "" : message;
        retryAfter = retryAfter == null || retryAfter.isNegative() ? null : retryAfter;
    }

    public static ProviderError of(ErrorKind kind, String message) {
        return new ProviderError(kind, message, null, null);
    }

    public static ProviderError http(ErrorKind kind, int status, String message, Duration retryAfter) {
        return new ProviderError(kind, message, status, retryAfter);
    }

    public Optional<Duration> retryAfterHint() {
        return Optional.ofNullable(retryAfter);
    }

    public boolean isTransient() {
        return kind.isTransient();
    }

    @Override
    public String toString() {
        String status = httpStatus == null ? "" : " (HTTP " + httpStatus + ")";
        return kind + status + ": " + message;
    }
}
