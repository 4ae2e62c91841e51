package io.relay.core.provider;

import io.relay.core.error.RelayException;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Cumulative-weight selection: a profile of weight w out of total W is picked with probability w/W.
 * Profiles of weight 0 are never picked.
 */
public final class WeightedSelector {
    private final Random random;

    public WeightedSelector() {
        this(new Random());
    }

    public WeightedSelector(Random random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public ProviderProfile select(List<ProviderProfile> candidates) {
        int total = 0;
        for (ProviderProfile candidate : candidates) {
            total += Math.max(0, candidate.weight());
        }
        if (total == 0) {
            throw RelayException.config("No chat provider with a non-zero weight is available for wildcard routing");
        }

        int cursor = random.nextInt(total);
        for (ProviderProfile candidate : candidates) {
            if (candidate.weight() <= 0) {
                continue;
            }
            if (cursor < candidate.weight()) {
                return candidate;
            }
            cursor -= candidate.weight();
        }
        throw new IllegalStateException("weighted selection fell through with cursor " + cursor);
    }
}
