package io.relay.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.relay.core.error.ErrorKind;
import io.relay.core.error.ProviderError;
import io.relay.core.error.RelayException;
import io.relay.core.event.CanonicalEvent;
import io.relay.core.event.EventSink;
import io.relay.core.event.EventStream;
import io.relay.core.event.FinishReason;
import io.relay.core.event.TokenUsage;
import io.relay.core.model.ChatMessage;
import io.relay.core.model.MessageRole;
import io.relay.core.model.ToolCall;
import io.relay.core.model.ToolDeclaration;
import io.relay.core.policy.ErrorClassifier;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

/**
 * Gemini {@code streamGenerateContent} family over SSE. Each chunk carries whole parts: a function call arrives
 * complete, so it is emitted as open, one argument delta and close. The stream has no end marker; the finish
 * reason of the last candidate is reported when the body ends.
 */
public final class GoogleGenerativeAiAdapter implements StreamAdapter {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final AtomicLong CALL_IDS = new AtomicLong();

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final ErrorClassifier classifier;

    public GoogleGenerativeAiAdapter(OkHttpClient client) {
        this(client, new ErrorClassifier());
    }

    public GoogleGenerativeAiAdapter(OkHttpClient client, ErrorClassifier classifier) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.mapper = new ObjectMapper();
    }

    @Override
    public ApiShape api() {
        return ApiShape.GOOGLE_GENERATIVE_AI;
    }

    @Override
    public EventStream send(LlmRequest request, RoutingDecision route) {
        Request httpRequest;
        try {
            httpRequest = buildRequest(request, route);
        } catch (JsonProcessingException e) {
            return EventStream.failed(ProviderError.of(ErrorKind.REQUEST_REJECTED, "Could not encode request: " + e.getMessage()));
        } catch (IllegalArgumentException e) {
            return EventStream.failed(ProviderError.of(ErrorKind.CONFIG_ERROR, "Invalid base URL for provider "
                + route.profile().name() + ": " + e.getMessage()));
        }
        return new SseEventStream(client.newCall(httpRequest), new Translator(mapper, classifier), classifier);
    }

    private Request buildRequest(LlmRequest request, RoutingDecision route) throws JsonProcessingException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("contents", toWireContents(request.messages()));

        String systemPrompt = extractSystemPrompt(request.messages());
        if (!systemPrompt.isBlank()) {
            payload.put("systemInstruction", Map.of("parts", List.of(Map.of("text", systemPrompt))));
        }
        if (!request.tools().isEmpty()) {
            payload.put("tools", List.of(Map.of("functionDeclarations", toFunctionDeclarations(request.tools()))));
        }
        Map<String, Object> generationConfig = new LinkedHashMap<>();
        if (request.maxTokens() != null) {
            generationConfig.put("maxOutputTokens", request.maxTokens());
        }
        if (request.reasoning() != null) {
            generationConfig.put("thinkingConfig", Map.of(
                "thinkingBudget", request.reasoning().thinkingBudget(),
                "includeThoughts", true));
        }
        if (!generationConfig.isEmpty()) {
            payload.put("generationConfig", generationConfig);
        }

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        Request.Builder builder = new Request.Builder()
            .url(streamUrl(route.baseUrl(), request.model()))
            .post(body)
            .header("x-goog-api-key", route.credential())
            .header("Content-Type", "application/json")
            .header("Accept", "text/event-stream");
        for (Map.Entry<String, String> header : route.profile().headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private HttpUrl streamUrl(String baseUrl, String model) {
        String id = model.trim();
        if (id.startsWith("models/")) {
            id = id.substring("models/".length());
        }
        return HttpUrl.get(baseUrl).newBuilder()
            .addPathSegment("models")
            .addPathSegment(id + ":streamGenerateContent")
            .addQueryParameter("alt", "sse")
            .build();
    }

    private List<Map<String, Object>> toWireContents(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        Map<String, String> toolNames = new HashMap<>();
        List<Map<String, Object>> pendingResponses = null;
        for (ChatMessage message : messages) {
            if (message.role() == MessageRole.SYSTEM) {
                continue;
            }
            if (message.role() == MessageRole.TOOL) {
                String id = message.toolCallId() == null ? "" : message.toolCallId();
                Map<String, Object> response = new LinkedHashMap<>();
                response.put("name", toolNames.getOrDefault(id, ""));
                response.put("id", id);
                response.put("response", Map.of(message.toolError() ? "error" : "output", message.content()));
                // consecutive responses share one user turn
                if (pendingResponses == null) {
                    pendingResponses = new ArrayList<>();
                    wire.add(Map.of("role", "user", "parts", pendingResponses));
                }
                pendingResponses.add(Map.of("functionResponse", response));
                continue;
            }
            pendingResponses = null;

            List<Map<String, Object>> parts = new ArrayList<>();
            if (!message.content().isBlank()) {
                parts.add(Map.of("text", message.content()));
            }
            if (message.role() == MessageRole.ASSISTANT) {
                for (ToolCall call : message.toolCalls()) {
                    toolNames.put(call.id(), call.name());
                    Map<String, Object> functionCall = new LinkedHashMap<>();
                    functionCall.put("name", call.name());
                    functionCall.put("args", call.arguments());
                    functionCall.put("id", call.id());
                    parts.add(Map.of("functionCall", functionCall));
                }
            }
            if (parts.isEmpty()) {
                parts.add(Map.of("text", ""));
            }
            wire.add(Map.of("role", message.role() == MessageRole.ASSISTANT ? "model" : "user", "parts", parts));
        }
        return wire;
    }

    private String extractSystemPrompt(List<ChatMessage> messages) {
        return messages.stream()
            .filter(m -> m.role() == MessageRole.SYSTEM)
            .map(ChatMessage::content)
            .reduce("", (a, b) -> a.isBlank() ? b : a + "\n\n" + b);
    }

    private List<Map<String, Object>> toFunctionDeclarations(List<ToolDeclaration> tools) {
        return tools.stream()
            .map(tool -> Map.<String, Object>of(
                "name", tool.name(),
                "description", tool.description(),
                "parameters", tool.parameters()))
            .toList();
    }

    private static final class Translator implements SseTranslator {
        private final ObjectMapper mapper;
        private final ErrorClassifier classifier;
        private TokenUsage usage;
        private String finishReason;
        private boolean emittedCall;

        private Translator(ObjectMapper mapper, ErrorClassifier classifier) {
            this.mapper = mapper;
            this.classifier = classifier;
        }

        @Override
        public void onEvent(SseEvent event, EventSink sink) {
            String data = event.data().trim();
            if (data.isEmpty()) {
                return;
            }
            JsonNode chunk = readChunk(data);
            JsonNode error = chunk.path("error");
            if (error.isObject()) {
                String code = error.path("status").asText(error.path("code").asText(""));
                sink.emit(new CanonicalEvent.StreamError(classifier.fromErrorCode(code, error.path("message").asText(""))));
                return;
            }
            JsonNode metadata = chunk.path("usageMetadata");
            if (metadata.isObject()) {
                usage = new TokenUsage(
                    metadata.path("promptTokenCount").asLong(0),
                    metadata.path("candidatesTokenCount").asLong(0) + metadata.path("thoughtsTokenCount").asLong(0),
                    metadata.path("cachedContentTokenCount").asLong(0)
                );
            }
            JsonNode candidates = chunk.path("candidates");
            if (!candidates.isArray() || candidates.isEmpty()) {
                return;
            }
            JsonNode candidate = candidates.get(0);
            for (JsonNode part : candidate.path("content").path("parts")) {
                onPart(part, sink);
            }
            String reason = candidate.path("finishReason").asText("");
            if (!reason.isBlank()) {
                finishReason = reason;
            }
        }

        @Override
        public void onEnd(EventSink sink) {
            if (finishReason == null) {
                sink.emit(new CanonicalEvent.StreamError(
                    ProviderError.of(ErrorKind.NETWORK_ERROR, "stream ended before a finish reason was received")
                ));
                return;
            }
            if ("MALFORMED_FUNCTION_CALL".equals(finishReason) || "UNEXPECTED_TOOL_CALL".equals(finishReason)) {
                sink.emit(new CanonicalEvent.StreamError(
                    ProviderError.of(ErrorKind.MALFORMED_STREAM, "model produced an unusable function call: " + finishReason)
                ));
                return;
            }
            if (usage != null) {
                sink.emit(new CanonicalEvent.Usage(usage));
            }
            sink.emit(new CanonicalEvent.Finish(mapFinishReason(finishReason)));
        }

        private void onPart(JsonNode part, EventSink sink) {
            JsonNode text = part.path("text");
            if (text.isTextual() && !text.asText().isEmpty()) {
                if (part.path("thought").asBoolean(false)) {
                    sink.emit(new CanonicalEvent.ReasoningDelta(text.asText()));
                } else {
                    sink.emit(new CanonicalEvent.TextDelta(text.asText()));
                }
            }
            JsonNode functionCall = part.path("functionCall");
            if (functionCall.isObject()) {
                String name = functionCall.path("name").asText("");
                if (name.isBlank()) {
                    throw RelayException.malformed("functionCall part is missing its name");
                }
                String id = functionCall.path("id").asText("");
                if (id.isBlank()) {
                    id = "google_call_" + CALL_IDS.incrementAndGet();
                }
                JsonNode args = functionCall.path("args");
                sink.emit(new CanonicalEvent.ToolCallOpen(id, name));
                sink.emit(new CanonicalEvent.ToolCallArgDelta(id, args.isObject() ? args.toString() : "{}"));
                sink.emit(new CanonicalEvent.ToolCallClose(id));
                emittedCall = true;
            }
        }

        private FinishReason mapFinishReason(String reason) {
            return switch (reason) {
                case "MAX_TOKENS" -> FinishReason.LENGTH;
                case "SAFETY", "RECITATION", "BLOCKLIST", "PROHIBITED_CONTENT", "SPII", "IMAGE_SAFETY" ->
                    FinishReason.CONTENT_FILTER;
                default -> emittedCall ? FinishReason.TOOL_USE : FinishReason.STOP;
            };
        }

        private JsonNode readChunk(String data) {
            try {
                return mapper.readTree(data);
            } catch (JsonProcessingException e) {
                throw RelayException.malformed("invalid JSON chunk: " + e.getOriginalMessage());
            }
        }
    }
}
