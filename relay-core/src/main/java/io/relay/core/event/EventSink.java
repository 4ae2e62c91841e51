package io.relay.core.event;

@FunctionalInterface
public interface EventSink {
    void emit(CanonicalEvent event);
}
