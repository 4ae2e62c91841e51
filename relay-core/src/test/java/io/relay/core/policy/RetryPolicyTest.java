package io.relay.core.policy;

import static org.assertj.core.api.Assertions.assertThat;

import io.relay.core.error.ErrorKind;
import io.relay.core.error.ProviderError;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(
        new BackoffSchedule(3, Duration.ofMillis(10), Duration.ofMillis(100), 2.0, 0.0),
        () -> 0.5
    );

    @Test
    void shouldRetryTransientErrorsWhileBudgetRemains() {
        ProviderError network = ProviderError.of(ErrorKind.NETWORK_ERROR, "reset");

        RetryDecision first = policy.decide(network, 1, false);
        assertThat(first.action()).isEqualTo(RetryDecision.Action.RETRY);
        assertThat(first.delay()).isEqualTo(Duration.ofMillis(10));
        assertThat(policy.decide(network, 2, false).delay()).isEqualTo(Duration.ofMillis(20));
        assertThat(policy.decide(network, 3, false).action()).isEqualTo(RetryDecision.Action.FAIL);
    }

    @Test
    void shouldHonorRateLimitHint() {
        ProviderError limited = new ProviderError(ErrorKind.RATE_LIMITED, "429", 429, Duration.ofSeconds(2));

        assertThat(policy.decide(limited, 1, false).delay()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void shouldNeverRetryFatalErrors() {
        for (ErrorKind kind : new ErrorKind[] {
            ErrorKind.AUTH_ERROR, ErrorKind.CONFIG_ERROR, ErrorKind.MALFORMED_STREAM, ErrorKind.REQUEST_REJECTED
        }) {
            assertThat(policy.decide(ProviderError.of(kind, "x"), 1, true).action())
                .isEqualTo(RetryDecision.Action.FAIL);
        }
    }

    @Test
    void shouldFallBackOnShapeMismatchOnlyWhenHopIsAvailable() {
        ProviderError mismatch = ProviderError.of(ErrorKind.SHAPE_MISMATCH, "404");

        assertThat(policy.decide(mismatch, 1, true).action()).isEqualTo(RetryDecision.Action.FALLBACK);
        assertThat(policy.decide(mismatch, 3, true).action()).isEqualTo(RetryDecision.Action.FALLBACK);
        assertThat(policy.decide(mismatch, 1, false).action()).isEqualTo(RetryDecision.Action.FAIL);
    }
}
