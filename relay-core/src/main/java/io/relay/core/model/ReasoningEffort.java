package io.relay.core.model;

import java.util.Locale;

public enum ReasoningEffort {
    MINIMAL(1_024),
    LOW(2_048),
    MEDIUM(8_192),
    HIGH(16_384),
    XHIGH(32_000);

    private final int thinkingBudget;

    ReasoningEffort(int thinkingBudget) {
        this.thinkingBudget = thinkingBudget;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public int thinkingBudget() {
        return thinkingBudget;
    }

    public static ReasoningEffort fromId(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (ReasoningEffort effort : values()) {
            if (effort.name().equals(normalized)) {
                return effort;
            }
        }
        throw new IllegalArgumentException("Unknown reasoning effort: " + raw);
    }
}
