package io.relay.core.policy;

import io.relay.core.error.ErrorKind;
import io.relay.core.error.ProviderError;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

public final class RetryPolicy {
    private final BackoffSchedule schedule;
    private final DoubleSupplier jitterSource;

    public RetryPolicy(BackoffSchedule schedule) {
        this(schedule, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryPolicy(BackoffSchedule schedule, DoubleSupplier jitterSource) {
        this.schedule = Objects.requireNonNull(schedule, "schedule must not be null");
        this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource must not be null");
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(BackoffSchedule.defaults());
    }

    public BackoffSchedule schedule() {
        return schedule;
    }

    /**
     * @param attemptsMade attempts already charged against the retry budget, the failed one included
     * @param fallbackAvailable whether a fallback hop is still unused and configured for this endpoint
     */
    public RetryDecision decide(ProviderError error, int attemptsMade, boolean fallbackAvailable) {
        Objects.requireNonNull(error, "error must not be null");
        if (error.kind() == ErrorKind.SHAPE_MISMATCH) {
            return fallbackAvailable ? RetryDecision.fallback() : RetryDecision.fail();
        }
        if (!error.isTransient() || !schedule.hasAttemptsLeft(attemptsMade)) {
            return RetryDecision.fail();
        }
        return RetryDecision.retryAfter(
            schedule.delayBeforeRetry(attemptsMade, error.retryAfter(), jitterSource.getAsDouble())
        );
    }
}
