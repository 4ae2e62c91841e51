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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

/**
 * Token-delta SSE family ({@code /chat/completions}). Tool calls are keyed by index; the wire has no explicit
 * per-call close, so every open call is closed when the choice reports its finish reason.
 */
public final class OpenAiCompletionsAdapter implements StreamAdapter {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final ErrorClassifier classifier;

    public OpenAiCompletionsAdapter(OkHttpClient client) {
        this(client, new ErrorClassifier());
    }

    public OpenAiCompletionsAdapter(OkHttpClient client, ErrorClassifier classifier) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.mapper = new ObjectMapper();
    }

    @Override
    public ApiShape api() {
        return ApiShape.OPENAI_COMPLETIONS;
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
        payload.put("model", request.model());
        payload.put("messages", toWireMessages(request.messages()));
        payload.put("stream", true);
        payload.put("stream_options", Map.of("include_usage", true));
        if (!request.tools().isEmpty()) {
            payload.put("tools", toWireTools(request.tools()));
            payload.put("tool_choice", "auto");
        }
        if (request.reasoning() != null) {
            payload.put("reasoning_effort", request.reasoning().id());
        }
        if (request.maxTokens() != null) {
            payload.put("max_tokens", request.maxTokens());
        }

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        Request.Builder builder = new Request.Builder()
            .url(completionsUrl(route.baseUrl()))
            .post(body)
            .header("Authorization", "Bearer " + route.credential())
            .header("Content-Type", "application/json")
            .header("Accept", "text/event-stream");
        for (Map.Entry<String, String> header : route.profile().headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private HttpUrl completionsUrl(String baseUrl) {
        return HttpUrl.get(baseUrl).newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) throws JsonProcessingException {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", toRoleValue(message.role()));
            row.put("content", message.content());
            if (message.role() == MessageRole.ASSISTANT && message.hasToolCalls()) {
                row.put("tool_calls", toWireToolCalls(message.toolCalls()));
            }
            if (message.role() == MessageRole.TOOL && message.toolCallId() != null && !message.toolCallId().isBlank()) {
                row.put("tool_call_id", message.toolCallId());
            }
            wire.add(row);
        }
        return wire;
    }

    private List<Map<String, Object>> toWireToolCalls(List<ToolCall> toolCalls) throws JsonProcessingException {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ToolCall call : toolCalls) {
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", call.name());
            function.put("arguments", mapper.writeValueAsString(call.arguments()));

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", call.id());
            item.put("type", "function");
            item.put("function", function);
            wire.add(item);
        }
        return wire;
    }

    private List<Map<String, Object>> toWireTools(List<ToolDeclaration> tools) {
        return tools.stream()
            .map(tool -> Map.<String, Object>of(
                "type", "function",
                "function", Map.of(
                    "name", tool.name(),
                    "description", tool.description(),
                    "parameters", tool.parameters())))
            .toList();
    }

    private String toRoleValue(MessageRole role) {
        return switch (role) {
            case SYSTEM -> "system";
            case USER -> "user";
            case ASSISTANT -> "assistant";
            case TOOL -> "tool";
        };
    }

    private static final class Translator implements SseTranslator {
        private final ObjectMapper mapper;
        private final ErrorClassifier classifier;
        private final Map<Integer, PendingCall> calls = new TreeMap<>();
        private final StreamText text = new StreamText();
        private final StreamText reasoning = new StreamText();
        private FinishReason finishReason;
        private TokenUsage usage;
        private boolean closedAnyCall;

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
            if ("[DONE]".equals(data)) {
                complete(sink);
                return;
            }

            JsonNode chunk = readChunk(data);
            JsonNode error = chunk.path("error");
            if (error.isObject()) {
                String code = error.path("code").asText(error.path("type").asText(""));
                sink.emit(new CanonicalEvent.StreamError(classifier.fromErrorCode(code, error.path("message").asText(""))));
                return;
            }
            if (chunk.path("usage").isObject()) {
                JsonNode node = chunk.path("usage");
                usage = new TokenUsage(
                    node.path("prompt_tokens").asLong(0),
                    node.path("completion_tokens").asLong(0),
                    node.path("prompt_tokens_details").path("cached_tokens").asLong(0)
                );
            }

            for (JsonNode choice : chunk.path("choices")) {
                JsonNode delta = choice.path("delta");
                String reasoningText = textOf(delta, "reasoning_content");
                if (reasoningText.isEmpty()) {
                    reasoningText = textOf(delta, "reasoning");
                }
                String newReasoning = reasoning.merge(reasoningText);
                if (!newReasoning.isEmpty()) {
                    sink.emit(new CanonicalEvent.ReasoningDelta(newReasoning));
                }
                String newText = text.merge(textOf(delta, "content"));
                if (!newText.isEmpty()) {
                    sink.emit(new CanonicalEvent.TextDelta(newText));
                }
                collectToolCalls(delta.path("tool_calls"), sink);

                JsonNode finish = choice.path("finish_reason");
                if (finish.isTextual() && !finish.asText().isBlank()) {
                    finishReason = mapFinishReason(finish.asText());
                    closeAll(sink);
                }
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
            complete(sink);
        }

        private void complete(EventSink sink) {
            closeAll(sink);
            if (usage != null) {
                sink.emit(new CanonicalEvent.Usage(usage));
            }
            FinishReason reason = finishReason == null ? FinishReason.STOP : finishReason;
            if (reason == FinishReason.STOP && closedAnyCall) {
                reason = FinishReason.TOOL_USE;
            }
            sink.emit(new CanonicalEvent.Finish(reason));
        }

        private void collectToolCalls(JsonNode toolCalls, EventSink sink) {
            if (!toolCalls.isArray()) {
                return;
            }
            int position = 0;
            for (JsonNode toolCall : toolCalls) {
                int index = toolCall.path("index").asInt(position++);
                PendingCall call = calls.computeIfAbsent(index, PendingCall::new);
                if (call.closed) {
                    throw RelayException.malformed("tool call at index " + index + " received data after it was closed");
                }
                String id = toolCall.path("id").asText("");
                if (!id.isBlank() && call.id == null) {
                    call.id = id;
                }
                JsonNode function = toolCall.path("function");
                String name = function.path("name").asText("");
                if (!name.isBlank() && call.name == null) {
                    call.name = name;
                }
                String fragment = argumentFragment(function.path("arguments"));
                if (call.opened) {
                    if (!fragment.isEmpty()) {
                        sink.emit(new CanonicalEvent.ToolCallArgDelta(call.id, fragment));
                    }
                } else {
                    call.buffered.append(fragment);
                    if (call.name != null) {
                        open(call, sink);
                    }
                }
            }
        }

        private void open(PendingCall call, EventSink sink) {
            if (call.id == null) {
                call.id = "call_" + call.index;
            }
            call.opened = true;
            sink.emit(new CanonicalEvent.ToolCallOpen(call.id, call.name));
            if (call.buffered.length() > 0) {
                sink.emit(new CanonicalEvent.ToolCallArgDelta(call.id, call.buffered.toString()));
                call.buffered.setLength(0);
            }
        }

        private void closeAll(EventSink sink) {
            for (PendingCall call : calls.values()) {
                if (call.closed) {
                    continue;
                }
                if (!call.opened) {
                    if (call.name == null) {
                        throw RelayException.malformed("tool call at index " + call.index + " ended without a function name");
                    }
                    open(call, sink);
                }
                call.closed = true;
                closedAnyCall = true;
                sink.emit(new CanonicalEvent.ToolCallClose(call.id));
            }
        }

        private String argumentFragment(JsonNode arguments) {
            if (arguments.isMissingNode() || arguments.isNull()) {
                return "";
            }
            return arguments.isTextual() ? arguments.asText() : arguments.toString();
        }

        private String textOf(JsonNode node, String field) {
            JsonNode value = node.path(field);
            return value.isTextual() ? value.asText() : "";
        }

        private JsonNode readChunk(String data) {
            try {
                return mapper.readTree(data);
            } catch (JsonProcessingException e) {
                throw RelayException.malformed("invalid JSON chunk: " + e.getOriginalMessage());
            }
        }

        private FinishReason mapFinishReason(String raw) {
            return switch (raw) {
                case "length" -> FinishReason.LENGTH;
                case "tool_calls", "function_call" -> FinishReason.TOOL_USE;
                case "content_filter" -> FinishReason.CONTENT_FILTER;
                default -> FinishReason.STOP;
            };
        }
    }

    private static final class PendingCall {
        private final int index;
        private final StringBuilder buffered = new StringBuilder();
        private String id;
        private String name;
        private boolean opened;
        private boolean closed;

        private PendingCall(int index) {
            this.index = index;
        }
    }
}
