package io.relay.core.policy;

import io.relay.core.provider.ApiShape;
import io.relay.core.provider.ProviderProfile;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Alternate api shape to try once when an endpoint reports that the requested shape does not exist.
 * A fallback configured on the profile wins over the table default.
 */
public final class FallbackTable {
    private final Map<ApiShape, ApiShape> defaults;

    public FallbackTable(Map<ApiShape, ApiShape> defaults) {
        this.defaults = defaults == null || defaults.isEmpty() ? Map.of() : new EnumMap<>(defaults);
    }

    public static FallbackTable defaults() {
        return new FallbackTable(Map.of(ApiShape.OPENAI_RESPONSES, ApiShape.OPENAI_COMPLETIONS));
    }

    public Optional<ApiShape> fallbackFor(ProviderProfile profile) {
        Optional<ApiShape> configured = profile.configuredFallback();
        if (configured.isPresent()) {
            return configured;
        }
        return Optional.ofNullable(defaults.get(profile.api()));
    }
}
