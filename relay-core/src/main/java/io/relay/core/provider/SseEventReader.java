package io.relay.core.provider;

import java.io.IOException;
import java.util.Objects;
import okio.BufferedSource;

/**
 * Incremental server-sent-events reader. Multi-line {@code data:} fields are joined with a newline and an
 * event is dispatched on a blank line or at end of input.
 */
final class SseEventReader {
    private final BufferedSource source;

    SseEventReader(BufferedSource source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    /** Next event, or {@code null} at end of stream. */
    SseEvent next() throws IOException {
        String eventName = "";
        StringBuilder data = null;
        while (true) {
            String line = source.readUtf8Line();
            if (line == null) {
                return data == null ? null : new SseEvent(eventName, data.toString());
            }
            if (line.isEmpty()) {
                if (data != null) {
                    return new SseEvent(eventName, data.toString());
                }
                eventName = "";
                continue;
            }
            if (line.startsWith(":")) {
                continue;
            }
            int colon = line.indexOf(':');
            String field = colon < 0 ? line : line.substring(0, colon);
            String value = colon < 0 ? "" : line.substring(colon + 1);
            if (value.startsWith(" ")) {
                value = value.substring(1);
            }
            switch (field) {
                case "event" -> eventName = value.trim();
                case "data" -> {
                    if (data == null) {
                        data = new StringBuilder(value);
                    } else {
                        data.append('\n').append(value);
                    }
                }
                default -> {
                    // id and retry fields carry nothing we use
                }
            }
        }
    }
}
