package io.relay.core.provider;

import io.relay.core.event.EventStream;

/**
 * Translates one wire-protocol family to and from canonical form.
 * Implementations never throw for transport failures; they end the stream with an error event instead.
 */
public interface StreamAdapter {
    ApiShape api();

    EventStream send(LlmRequest request, RoutingDecision route);
}
