package io.relay.core.provider;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

public final class AdapterRegistry {
    private final Map<ApiShape, StreamAdapter> adapters = new EnumMap<>(ApiShape.class);

    public synchronized AdapterRegistry register(StreamAdapter adapter) {
        adapters.put(adapter.api(), adapter);
        return this;
    }

    public synchronized Optional<StreamAdapter> find(ApiShape api) {
        return Optional.ofNullable(adapters.get(api));
    }
}
