package io.relay.core.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.relay.core.error.ErrorKind;
import io.relay.core.error.ProviderError;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps transport failures, HTTP statuses and provider error payloads onto {@link ErrorKind}.
 */
public final class ErrorClassifier {
    private static final int MAX_MESSAGE_CHARS = 500;
    private static final Pattern TRY_AGAIN = Pattern.compile(
        "(?i)try again in\\s+([0-9]+(?:\\.[0-9]+)?)\\s*(ms|s|sec|secs|seconds?)\\b"
    );
    private static final Pattern DURATION_PART = Pattern.compile("([0-9]+(?:\\.[0-9]+)?)(ms|h|m|s)");

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock;

    public ErrorClassifier() {
        this(Clock.systemUTC());
    }

    public ErrorClassifier(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ErrorKind kindForStatus(int status) {
        if (status == 401 || status == 403) {
            return ErrorKind.AUTH_ERROR;
        }
        if (status == 404 || status == 405) {
            return ErrorKind.SHAPE_MISMATCH;
        }
        if (status == 429) {
            return ErrorKind.RATE_LIMITED;
        }
        if (status == 408 || status == 425 || status >= 500) {
            return ErrorKind.NETWORK_ERROR;
        }
        return ErrorKind.REQUEST_REJECTED;
    }

    public ProviderError fromHttpStatus(int status, String body, Function<String, String> headers) {
        ErrorKind kind = kindForStatus(status);
        Duration hint = kind == ErrorKind.RATE_LIMITED || status == 503 ? retryAfter(headers, body) : null;
        return ProviderError.http(kind, status, "HTTP " + status + ": " + summarize(body), hint);
    }

    public ProviderError fromException(Throwable error) {
        if (error instanceof SocketTimeoutException) {
            return ProviderError.of(ErrorKind.NETWORK_ERROR, "read timed out: " + error.getMessage());
        }
        if (error instanceof InterruptedIOException) {
            return ProviderError.of(ErrorKind.NETWORK_ERROR, "request interrupted: " + error.getMessage());
        }
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return ProviderError.of(ErrorKind.NETWORK_ERROR, message);
    }

    /**
     * Classifies an error object delivered inside an otherwise successful stream.
     */
    public ProviderError fromErrorCode(String code, String message) {
        String normalized = code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
        String text = message == null || message.isBlank() ? normalized : message;
        ErrorKind kind = switch (normalized) {
            case "rate_limit_exceeded", "rate_limit_error", "rate_limited", "too_many_requests", "resource_exhausted",
                "429" ->
                ErrorKind.RATE_LIMITED;
            case "overloaded_error", "api_error", "server_error", "internal_error", "service_unavailable",
                "timeout", "unavailable", "internal", "deadline_exceeded", "500", "502", "503", "529" ->
                ErrorKind.NETWORK_ERROR;
            case "authentication_error", "permission_error", "invalid_api_key", "unauthenticated", "permission_denied",
                "401", "403" -> ErrorKind.AUTH_ERROR;
            default -> ErrorKind.REQUEST_REJECTED;
        };
        Duration hint = kind == ErrorKind.RATE_LIMITED ? hintFromText(text) : null;
        return new ProviderError(kind, text, null, hint);
    }

    public Duration retryAfter(Function<String, String> headers, String body) {
        if (headers != null) {
            Duration fromMillis = parseMillis(headers.apply("retry-after-ms"));
            if (fromMillis != null) {
                return fromMillis;
            }
            Duration fromRetryAfter = parseRetryAfter(headers.apply("retry-after"));
            if (fromRetryAfter != null) {
                return fromRetryAfter;
            }
            Duration fromReset = parseCompoundDuration(headers.apply("x-ratelimit-reset-requests"));
            if (fromReset != null) {
                return fromReset;
            }
            Duration fromTokenReset = parseCompoundDuration(headers.apply("x-ratelimit-reset-tokens"));
            if (fromTokenReset != null) {
                return fromTokenReset;
            }
        }
        return hintFromText(body);
    }

    private Duration parseMillis(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Duration.ofMillis(Math.round(Double.parseDouble(raw.trim())));
        } catch (NumberFormatException ignored) {
            return null;
        }
    }

    private Duration parseRetryAfter(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            return Duration.ofMillis(Math.round(Double.parseDouble(value) * 1000));
        } catch (NumberFormatException ignored) {
            // not delta-seconds, try the HTTP-date form
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration until = Duration.between(clock.instant(), at.toInstant());
            return until.isNegative() ? Duration.ZERO : until;
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private Duration parseCompoundDuration(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        Matcher matcher = DURATION_PART.matcher(raw.trim());
        double millis = 0;
        boolean matched = false;
        while (matcher.find()) {
            matched = true;
            double amount = Double.parseDouble(matcher.group(1));
            millis += switch (matcher.group(2)) {
                case "ms" -> amount;
                case "s" -> amount * 1_000;
                case "m" -> amount * 60_000;
                default -> amount * 3_600_000;
            };
        }
        return matched ? Duration.ofMillis(Math.round(millis)) : null;
    }

    private Duration hintFromText(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        Matcher matcher = TRY_AGAIN.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        double amount = Double.parseDouble(matcher.group(1));
        boolean millis = "ms".equalsIgnoreCase(matcher.group(2));
        return Duration.ofMillis(Math.round(millis ? amount : amount * 1_000));
    }

    private String summarize(String body) {
        if (body == null || body.isBlank()) {
            return "(empty body)";
        }
        String message = body.trim();
        try {
            JsonNode root = mapper.readTree(message);
            JsonNode error = root.path("error");
            String nested = error.isObject() ? error.path("message").asText("") : error.asText("");
            if (!nested.isBlank()) {
                message = nested;
            } else if (!root.path("message").asText("").isBlank()) {
                message = root.path("message").asText();
            }
        } catch (Exception ignored) {
            // plain-text body
        }
        return message.length() > MAX_MESSAGE_CHARS ? message.substring(0, MAX_MESSAGE_CHARS) + "..." : message;
    }
}
