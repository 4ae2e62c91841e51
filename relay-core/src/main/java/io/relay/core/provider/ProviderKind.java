package io.relay.core.provider;

import io.relay.core.error.RelayException;
import java.util.Locale;

public enum ProviderKind {
    CHAT,
    EMBEDDING;

    public static ProviderKind fromId(String raw) {
        if (raw == null || raw.isBlank()) {
            return CHAT;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "chat" -> CHAT;
            case "embedding", "embeddings" -> EMBEDDING;
            default -> throw RelayException.config("Unknown provider kind: " + raw);
        };
    }
}
