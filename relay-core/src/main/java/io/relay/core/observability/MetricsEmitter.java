package io.relay.core.observability;

import java.util.Map;

/**
 * Receives lifecycle events from agent loops. Implementations must return without blocking.
 */
public interface MetricsEmitter {

    void emit(String type, Map<String, Object> attributes);

    static MetricsEmitter noop() {
        return (type, attributes) -> { };
    }
}
