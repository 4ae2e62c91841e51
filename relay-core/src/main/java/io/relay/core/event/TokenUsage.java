package io.relay.core.event;

public record TokenUsage(long input, long output, long cachedInput) {

    public static final TokenUsage EMPTY = new TokenUsage(0, 0, 0);

    public TokenUsage {
        input = Math.max(0, input);
        output = Math.max(0, output);
        cachedInput = Math.max(0, cachedInput);
    }

    public TokenUsage plus(TokenUsage other) {
        if (other == null) {
            return this;
        }
        return new TokenUsage(input + other.input, output + other.output, cachedInput + other.cachedInput);
    }

    public long total() {
        return input + output;
    }
}
