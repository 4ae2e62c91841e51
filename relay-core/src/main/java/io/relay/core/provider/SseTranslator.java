package io.relay.core.provider;

import io.relay.core.event.EventSink;

/**
 * Stateful translation of one attempt's server-sent events into canonical events.
 */
interface SseTranslator {
    void onEvent(SseEvent event, EventSink sink);

    /** Called once when the transport reaches end of input before a terminal event was emitted. */
    void onEnd(EventSink sink);
}
