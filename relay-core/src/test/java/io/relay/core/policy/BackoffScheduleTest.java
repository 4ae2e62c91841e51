package io.relay.core.policy;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class BackoffScheduleTest {

    private final BackoffSchedule schedule = new BackoffSchedule(
        4, Duration.ofMillis(100), Duration.ofMillis(1000), 2.0, 0.2);

    @Test
    void shouldGrowExponentiallyWithoutJitterAtMidpoint() {
        assertThat(schedule.delayBeforeRetry(1, null, 0.5)).isEqualTo(Duration.ofMillis(100));
        assertThat(schedule.delayBeforeRetry(2, null, 0.5)).isEqualTo(Duration.ofMillis(200));
        assertThat(schedule.delayBeforeRetry(3, null, 0.5)).isEqualTo(Duration.ofMillis(400));
    }

    @Test
    void shouldKeepJitteredDelayWithinBoundsAndCeiling() {
        assertThat(schedule.delayBeforeRetry(1, null, 0.0)).isEqualTo(Duration.ofMillis(80));
        assertThat(schedule.delayBeforeRetry(1, null, 0.999)).isLessThanOrEqualTo(Duration.ofMillis(120));
        for (int retry = 1; retry < 20; retry++) {
            assertThat(schedule.delayBeforeRetry(retry, null, 0.999)).isLessThanOrEqualTo(Duration.ofMillis(1000));
        }
    }

    @Test
    void shouldWaitAtLeastTheProviderHintUpToItsCeiling() {
        assertThat(schedule.delayBeforeRetry(1, Duration.ofSeconds(5), 0.5)).isEqualTo(Duration.ofSeconds(5));
        assertThat(schedule.delayBeforeRetry(1, Duration.ofMinutes(10), 0.5)).isEqualTo(BackoffSchedule.HINT_CEILING);
        assertThat(schedule.delayBeforeRetry(3, Duration.ofMillis(10), 0.5)).isEqualTo(Duration.ofMillis(400));
    }

    @Test
    void shouldCountAttemptsAgainstMaximum() {
        assertThat(schedule.hasAttemptsLeft(3)).isTrue();
        assertThat(schedule.hasAttemptsLeft(4)).isFalse();
    }
}
