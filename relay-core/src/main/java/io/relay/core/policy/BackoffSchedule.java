package io.relay.core.policy;

import java.time.Duration;

/**
 * Bounded exponential backoff with symmetric jitter.
 *
 * @param maxAttempts total attempts allowed for one send, the first one included
 * @param jitter fraction of the computed delay that may be added or removed at random
 */
public record BackoffSchedule(
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    double multiplier,
    double jitter
) {
    public static final Duration HINT_CEILING = Duration.ofSeconds(60);

    public BackoffSchedule {
        maxAttempts = Math.max(1, maxAttempts);
        initialBackoff = initialBackoff == null || initialBackoff.isNegative() ? Duration.ZERO : initialBackoff;
        maxBackoff = maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0 ? initialBackoff : maxBackoff;
        multiplier = multiplier < 1.0 ? 1.0 : multiplier;
        jitter = Math.max(0.0, Math.min(1.0, jitter));
    }

    public static BackoffSchedule defaults() {
        return new BackoffSchedule(4, Duration.ofMillis(200), Duration.ofSeconds(2), 2.0, 0.2);
    }

    public boolean hasAttemptsLeft(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * @param retryNumber 1 for the first retry
     * @param hint provider supplied wait, may be {@code null}
     * @param random uniform value in [0, 1)
     */
    public Duration delayBeforeRetry(int retryNumber, Duration hint, double random) {
        double base = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, retryNumber - 1));
        base = Math.min(base, maxBackoff.toMillis());
        double spread = base * jitter;
        double jittered = base - spread + (2 * spread * random);
        long millis = Math.round(Math.max(0, Math.min(jittered, maxBackoff.toMillis())));
        if (hint != null && !hint.isNegative()) {
            millis = Math.max(millis, Math.min(hint.toMillis(), HINT_CEILING.toMillis()));
        }
        return Duration.ofMillis(millis);
    }
}
