package io.relay.core.provider;

/**
 * Accumulates streamed text and tolerates backends that resend the whole text so far instead of a delta.
 */
final class StreamText {
    private static final int MIN_REPLAY_CHARS = 16;

    private final StringBuilder text = new StringBuilder();

    /** Returns the part of {@code incoming} that is new. */
    String merge(String incoming) {
        if (incoming == null || incoming.isEmpty()) {
            return "";
        }
        String current = text.toString();
        String suffix;
        if (!current.isEmpty() && incoming.length() > current.length() && incoming.startsWith(current)) {
            suffix = incoming.substring(current.length());
        } else if (incoming.length() >= MIN_REPLAY_CHARS && current.endsWith(incoming)) {
            suffix = "";
        } else {
            suffix = incoming;
        }
        text.append(suffix);
        return suffix;
    }

    String value() {
        return text.toString();
    }
}
