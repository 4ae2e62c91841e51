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
import java.util.stream.Collectors;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

/**
 * Responses API family ({@code /responses}). Function calls are announced by {@code output_item.added},
 * keyed by item id on the wire and exposed by their {@code call_id}.
 */
public final class OpenAiResponsesAdapter implements StreamAdapter {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final ErrorClassifier classifier;

    public OpenAiResponsesAdapter(OkHttpClient client) {
        this(client, new ErrorClassifier());
    }

    public OpenAiResponsesAdapter(OkHttpClient client, ErrorClassifier classifier) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.mapper = new ObjectMapper();
    }

    @Override
    public ApiShape api() {
        return ApiShape.OPENAI_RESPONSES;
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
        payload.put("stream", true);
        payload.put("store", false);
        payload.put("input", toInput(request.messages()));

        String instructions = request.messages().stream()
            .filter(message -> message.role() == MessageRole.SYSTEM)
            .map(ChatMessage::content)
            .filter(content -> !content.isBlank())
            .collect(Collectors.joining("\n\n"));
        if (!instructions.isBlank()) {
            payload.put("instructions", instructions);
        }
        if (!request.tools().isEmpty()) {
            payload.put("tools", toWireTools(request.tools()));
            payload.put("tool_choice", "auto");
            payload.put("parallel_tool_calls", true);
        }
        if (request.reasoning() != null) {
            payload.put("reasoning", Map.of("effort", request.reasoning().id()));
        }
        if (request.maxTokens() != null) {
            payload.put("max_output_tokens", request.maxTokens());
        }

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        Request.Builder builder = new Request.Builder()
            .url(HttpUrl.get(route.baseUrl()).newBuilder().addPathSegment("responses").build())
            .post(body)
            .header("Authorization", "Bearer " + route.credential())
            .header("Content-Type", "application/json")
            .header("Accept", "text/event-stream");
        for (Map.Entry<String, String> header : route.profile().headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private List<Map<String, Object>> toInput(List<ChatMessage> messages) throws JsonProcessingException {
        List<Map<String, Object>> items = new ArrayList<>();
        for (ChatMessage message : messages) {
            switch (message.role()) {
                case SYSTEM -> {
                    // sent as instructions
                }
                case USER -> items.add(Map.of(
                    "role", "user",
                    "content", List.of(Map.of("type", "input_text", "text", message.content()))
                ));
                case ASSISTANT -> {
                    if (!message.content().isBlank()) {
                        items.add(Map.of(
                            "type", "message",
                            "role", "assistant",
                            "content", List.of(Map.of("type", "output_text", "text", message.content())),
                            "status", "completed"
                        ));
                    }
                    for (ToolCall call : message.toolCalls()) {
                        items.add(Map.of(
                            "type", "function_call",
                            "call_id", call.id(),
                            "name", call.name(),
                            "arguments", mapper.writeValueAsString(call.arguments())
                        ));
                    }
                }
                case TOOL -> items.add(Map.of(
                    "type", "function_call_output",
                    "call_id", message.toolCallId() == null ? "" : message.toolCallId(),
                    "output", message.content()
                ));
            }
        }
        return items;
    }

    private List<Map<String, Object>> toWireTools(List<ToolDeclaration> tools) {
        return tools.stream()
            .map(tool -> Map.<String, Object>of(
                "type", "function",
                "name", tool.name(),
                "description", tool.description(),
                "parameters", tool.parameters()))
            .toList();
    }

    private static final class Translator implements SseTranslator {
        private final ObjectMapper mapper;
        private final ErrorClassifier classifier;
        private final Map<String, FunctionCall> callsByItem = new LinkedHashMap<>();
        private final Map<String, StringBuilder> orphanArguments = new HashMap<>();
        private boolean closedAnyCall;
        private boolean finished;

        private Translator(ObjectMapper mapper, ErrorClassifier classifier) {
            this.mapper = mapper;
            this.classifier = classifier;
        }

        @Override
        public void onEvent(SseEvent event, EventSink sink) {
            String data = event.data().trim();
            if (data.isEmpty() || "[DONE]".equals(data)) {
                return;
            }
            JsonNode node = readChunk(data);
            String type = node.path("type").asText(event.event());
            switch (type) {
                case "response.output_item.added" -> onItemAdded(node.path("item"), sink);
                case "response.function_call_arguments.delta" -> onArgumentsDelta(node, sink);
                case "response.function_call_arguments.done" -> onArgumentsDone(node, sink);
                case "response.output_item.done" -> onItemDone(node.path("item"), sink);
                case "response.output_text.delta", "response.refusal.delta" -> {
                    String delta = node.path("delta").asText("");
                    if (!delta.isEmpty()) {
                        sink.emit(new CanonicalEvent.TextDelta(delta));
                    }
                }
                case "response.reasoning_summary_text.delta", "response.reasoning_text.delta" -> {
                    String delta = node.path("delta").asText("");
                    if (!delta.isEmpty()) {
                        sink.emit(new CanonicalEvent.ReasoningDelta(delta));
                    }
                }
                case "response.completed", "response.incomplete", "response.done" -> onCompleted(node.path("response"), sink);
                case "response.failed" -> {
                    JsonNode error = node.path("response").path("error");
                    sink.emit(new CanonicalEvent.StreamError(
                        classifier.fromErrorCode(error.path("code").asText(""), error.path("message").asText("response failed"))
                    ));
                }
                case "error" -> {
                    JsonNode error = node.path("error").isObject() ? node.path("error") : node;
                    sink.emit(new CanonicalEvent.StreamError(
                        classifier.fromErrorCode(
                            error.path("code").asText(error.path("type").asText("")),
                            error.path("message").asText("")
                        )
                    ));
                }
                default -> {
                    // lifecycle events that carry nothing canonical
                }
            }
        }

        @Override
        public void onEnd(EventSink sink) {
            if (!finished) {
                sink.emit(new CanonicalEvent.StreamError(
                    ProviderError.of(ErrorKind.NETWORK_ERROR, "stream ended before the response completed")
                ));
            }
        }

        private void onItemAdded(JsonNode item, EventSink sink) {
            if (!"function_call".equals(item.path("type").asText())) {
                return;
            }
            FunctionCall call = register(item, sink);
            String initial = item.path("arguments").asText("");
            if (!initial.isEmpty() && !call.sawArguments) {
                call.sawArguments = true;
                sink.emit(new CanonicalEvent.ToolCallArgDelta(call.callId, initial));
            }
        }

        private void onArgumentsDelta(JsonNode node, EventSink sink) {
            String itemId = node.path("item_id").asText("");
            String delta = node.path("delta").asText("");
            FunctionCall call = callsByItem.get(itemId);
            if (call == null) {
                orphanArguments.computeIfAbsent(itemId, ignored -> new StringBuilder()).append(delta);
                return;
            }
            if (call.closed) {
                throw RelayException.malformed("arguments received for function call " + call.callId + " after it was closed");
            }
            if (!delta.isEmpty()) {
                call.sawArguments = true;
                sink.emit(new CanonicalEvent.ToolCallArgDelta(call.callId, delta));
            }
        }

        private void onArgumentsDone(JsonNode node, EventSink sink) {
            String itemId = node.path("item_id").asText("");
            String arguments = node.path("arguments").asText("");
            FunctionCall call = callsByItem.get(itemId);
            if (call == null) {
                StringBuilder orphan = orphanArguments.computeIfAbsent(itemId, ignored -> new StringBuilder());
                if (orphan.length() == 0) {
                    orphan.append(arguments);
                }
                return;
            }
            if (!call.closed && !call.sawArguments && !arguments.isEmpty()) {
                call.sawArguments = true;
                sink.emit(new CanonicalEvent.ToolCallArgDelta(call.callId, arguments));
            }
        }

        private void onItemDone(JsonNode item, EventSink sink) {
            if (!"function_call".equals(item.path("type").asText())) {
                return;
            }
            FunctionCall call = callsByItem.get(item.path("id").asText(""));
            if (call == null) {
                call = register(item, sink);
            }
            if (call.closed) {
                return;
            }
            String arguments = item.path("arguments").asText("");
            if (!call.sawArguments && !arguments.isEmpty()) {
                call.sawArguments = true;
                sink.emit(new CanonicalEvent.ToolCallArgDelta(call.callId, arguments));
            }
            call.closed = true;
            closedAnyCall = true;
            sink.emit(new CanonicalEvent.ToolCallClose(call.callId));
        }

        private FunctionCall register(JsonNode item, EventSink sink) {
            String itemId = item.path("id").asText("");
            FunctionCall existing = callsByItem.get(itemId);
            if (existing != null) {
                return existing;
            }
            String callId = item.path("call_id").asText("");
            if (callId.isBlank()) {
                callId = itemId.isBlank() ? "call_" + callsByItem.size() : itemId;
            }
            String name = item.path("name").asText("");
            if (name.isBlank()) {
                throw RelayException.malformed("function call " + callId + " has no name");
            }
            FunctionCall call = new FunctionCall(callId);
            callsByItem.put(itemId, call);
            sink.emit(new CanonicalEvent.ToolCallOpen(callId, name));
            StringBuilder orphan = orphanArguments.remove(itemId);
            if (orphan != null && orphan.length() > 0) {
                call.sawArguments = true;
                sink.emit(new CanonicalEvent.ToolCallArgDelta(callId, orphan.toString()));
            }
            return call;
        }

        private void onCompleted(JsonNode response, EventSink sink) {
            JsonNode usage = response.path("usage");
            if (usage.isObject()) {
                sink.emit(new CanonicalEvent.Usage(new TokenUsage(
                    usage.path("input_tokens").asLong(0),
                    usage.path("output_tokens").asLong(0),
                    usage.path("input_tokens_details").path("cached_tokens").asLong(0)
                )));
            }
            String status = response.path("status").asText("completed");
            FinishReason reason = switch (status) {
                case "incomplete" -> "content_filter".equals(response.path("incomplete_details").path("reason").asText(""))
                    ? FinishReason.CONTENT_FILTER
                    : FinishReason.LENGTH;
                case "failed", "cancelled" -> null;
                default -> FinishReason.STOP;
            };
            finished = true;
            if (reason == null) {
                JsonNode error = response.path("error");
                sink.emit(new CanonicalEvent.StreamError(
                    classifier.fromErrorCode(error.path("code").asText(""), error.path("message").asText("response " + status))
                ));
                return;
            }
            if (reason == FinishReason.STOP && closedAnyCall) {
                reason = FinishReason.TOOL_USE;
            }
            sink.emit(new CanonicalEvent.Finish(reason));
        }

        private JsonNode readChunk(String data) {
            try {
                return mapper.readTree(data);
            } catch (JsonProcessingException e) {
                throw RelayException.malformed("invalid JSON event: " + e.getOriginalMessage());
            }
        }
    }

    private static final class FunctionCall {
        private final String callId;
        private boolean sawArguments;
        private boolean closed;

        private FunctionCall(String callId) {
            this.callId = callId;
        }
    }
}
