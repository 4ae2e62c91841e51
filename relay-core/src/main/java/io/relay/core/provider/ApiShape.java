package io.relay.core.provider;

import io.relay.core.error.RelayException;
import java.util.Locale;

public enum ApiShape {
    OPENAI_COMPLETIONS("openai-completions", "https://api.openai.com/v1"),
    OPENAI_RESPONSES("openai-responses", "https://api.openai.com/v1"),
    ANTHROPIC_MESSAGES("anthropic-messages", "https://api.anthropic.com/v1"),
    BEDROCK_CONVERSE_STREAM("bedrock-converse-stream", ""),
    GOOGLE_GENERATIVE_AI("google-generative-ai", "https://generativelanguage.googleapis.com/v1beta");

    private final String id;
    private final String defaultBaseUrl;

    ApiShape(String id, String defaultBaseUrl) {
        this.id = id;
        this.defaultBaseUrl = defaultBaseUrl;
    }

    public String id() {
        return id;
    }

    public String defaultBaseUrl() {
        return defaultBaseUrl;
    }

    public boolean requiresCredential() {
        return this != BEDROCK_CONVERSE_STREAM;
    }

    public static ApiShape fromId(String raw) {
        if (raw == null || raw.isBlank()) {
            throw RelayException.config("api shape must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ApiShape shape : values()) {
            if (shape.id.equals(normalized)) {
                return shape;
            }
        }
        throw RelayException.config("Unknown api shape: " + raw);
    }

    @Override
    public String toString() {
        return id;
    }
}
