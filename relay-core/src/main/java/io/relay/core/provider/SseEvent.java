package io.relay.core.provider;

public record SseEvent(String event, String data) {

    public SseEvent {
        event = event == null ? "" : event;
        data = data == null ? "" : data;
    }
}
