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
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

/**
 * Message-block family ({@code /messages}). Content blocks are addressed by index; a tool-use block opens a
 * call and its {@code content_block_stop} closes it.
 */
public final class AnthropicMessagesAdapter implements StreamAdapter {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String API_VERSION = "2023-06-01";
    private static final int DEFAULT_MAX_TOKENS = 4096;

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final ErrorClassifier classifier;

    public AnthropicMessagesAdapter(OkHttpClient client) {
        this(client, new ErrorClassifier());
    }

    public AnthropicMessagesAdapter(OkHttpClient client, ErrorClassifier classifier) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.mapper = new ObjectMapper();
    }

    @Override
    public ApiShape api() {
        return ApiShape.ANTHROPIC_MESSAGES;
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
        int maxTokens = request.maxTokens() == null ? DEFAULT_MAX_TOKENS : request.maxTokens();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", request.model());
        payload.put("stream", true);
        payload.put("messages", toWireMessages(request.messages()));

        String systemPrompt = extractSystemPrompt(request.messages());
        if (!systemPrompt.isBlank()) {
            payload.put("system", systemPrompt);
        }
        if (!request.tools().isEmpty()) {
            payload.put("tools", toAnthropicTools(request.tools()));
        }
        if (request.reasoning() != null) {
            int budget = request.reasoning().thinkingBudget();
            payload.put("thinking", Map.of("type", "enabled", "budget_tokens", budget));
            maxTokens = Math.max(maxTokens, budget + DEFAULT_MAX_TOKENS);
        }
        payload.put("max_tokens", maxTokens);

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        Request.Builder builder = new Request.Builder()
            .url(HttpUrl.get(route.baseUrl()).newBuilder().addPathSegment("messages").build())
            .post(body)
            .header("x-api-key", route.credential())
            .header("anthropic-version", API_VERSION)
            .header("content-type", "application/json")
            .header("accept", "text/event-stream");
        for (Map.Entry<String, String> header : route.profile().headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        List<Map<String, Object>> pendingResults = null;
        for (ChatMessage message : messages) {
            if (message.role() == MessageRole.SYSTEM) {
                continue;
            }
            if (message.role() == MessageRole.TOOL) {
                Map<String, Object> result = new LinkedHashMap<>();
                result.put("type", "tool_result");
                result.put("tool_use_id", message.toolCallId() == null ? "" : message.toolCallId());
                result.put("content", message.content());
                if (message.toolError()) {
                    result.put("is_error", true);
                }
                // consecutive results share one user turn
                if (pendingResults == null) {
                    pendingResults = new ArrayList<>();
                    wire.add(Map.of("role", "user", "content", pendingResults));
                }
                pendingResults.add(result);
                continue;
            }
            pendingResults = null;

            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", message.role() == MessageRole.ASSISTANT ? "assistant" : "user");
            if (message.role() == MessageRole.ASSISTANT && (message.hasToolCalls() || message.hasSignedReasoning())) {
                List<Map<String, Object>> content = new ArrayList<>();
                // signed thinking must precede the blocks it produced
                if (message.hasSignedReasoning()) {
                    Map<String, Object> thinking = new LinkedHashMap<>();
                    thinking.put("type", "thinking");
                    thinking.put("thinking", message.reasoning());
                    thinking.put("signature", message.reasoningSignature());
                    content.add(thinking);
                }
                if (!message.content().isBlank()) {
                    content.add(Map.of("type", "text", "text", message.content()));
                }
                for (ToolCall call : message.toolCalls()) {
                    content.add(Map.of(
                        "type", "tool_use",
                        "id", call.id(),
                        "name", call.name(),
                        "input", call.arguments()
                    ));
                }
                row.put("content", content);
            } else {
                row.put("content", message.content());
            }
            wire.add(row);
        }
        return wire;
    }

    private String extractSystemPrompt(List<ChatMessage> messages) {
        return messages.stream()
            .filter(m -> m.role() == MessageRole.SYSTEM)
            .map(ChatMessage::content)
            .reduce("", (a, b) -> a.isBlank() ? b : a + "\n\n" + b);
    }

    private List<Map<String, Object>> toAnthropicTools(List<ToolDeclaration> tools) {
        return tools.stream()
            .map(tool -> Map.<String, Object>of(
                "name", tool.name(),
                "description", tool.description(),
                "input_schema", tool.parameters()))
            .toList();
    }

    private static final class Translator implements SseTranslator {
        private final ObjectMapper mapper;
        private final ErrorClassifier classifier;
        private final Map<Integer, Block> blocks = new HashMap<>();
        private final Map<Integer, StringBuilder> orphanJson = new HashMap<>();
        private long inputTokens;
        private long outputTokens;
        private long cachedTokens;
        private String stopReason = "";
        private boolean closedAnyCall;
        private boolean finished;

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
            JsonNode node = readChunk(data);
            String type = node.path("type").asText(event.event());
            switch (type) {
                case "message_start" -> readUsage(node.path("message").path("usage"));
                case "content_block_start" -> onBlockStart(node.path("index").asInt(), node.path("content_block"), sink);
                case "content_block_delta" -> onBlockDelta(node.path("index").asInt(), node.path("delta"), sink);
                case "content_block_stop" -> onBlockStop(node.path("index").asInt(), sink);
                case "message_delta" -> {
                    String reason = node.path("delta").path("stop_reason").asText("");
                    if (!reason.isBlank() && !"null".equals(reason)) {
                        stopReason = reason;
                    }
                    readUsage(node.path("usage"));
                }
                case "message_stop" -> onMessageStop(sink);
                case "error" -> {
                    JsonNode error = node.path("error");
                    sink.emit(new CanonicalEvent.StreamError(
                        classifier.fromErrorCode(error.path("type").asText(""), error.path("message").asText(""))
                    ));
                }
                default -> {
                    // ping and unknown events
                }
            }
        }

        @Override
        public void onEnd(EventSink sink) {
            if (!finished) {
                sink.emit(new CanonicalEvent.StreamError(
                    ProviderError.of(ErrorKind.NETWORK_ERROR, "stream ended before message_stop")
                ));
            }
        }

        private void onBlockStart(int index, JsonNode contentBlock, EventSink sink) {
            String type = contentBlock.path("type").asText("");
            switch (type) {
                case "tool_use", "server_tool_use" -> {
                    String id = contentBlock.path("id").asText("");
                    String name = contentBlock.path("name").asText("");
                    if (id.isBlank() || name.isBlank()) {
                        throw RelayException.malformed("tool_use block " + index + " is missing its id or name");
                    }
                    Block block = new Block(BlockKind.TOOL, id);
                    blocks.put(index, block);
                    sink.emit(new CanonicalEvent.ToolCallOpen(id, name));
                    JsonNode input = contentBlock.path("input");
                    if (input.isObject() && input.size() > 0) {
                        sink.emit(new CanonicalEvent.ToolCallArgDelta(id, input.toString()));
                    }
                    StringBuilder orphan = orphanJson.remove(index);
                    if (orphan != null && orphan.length() > 0) {
                        sink.emit(new CanonicalEvent.ToolCallArgDelta(id, orphan.toString()));
                    }
                }
                case "thinking" -> {
                    blocks.put(index, new Block(BlockKind.THINKING, null));
                    emitReasoning(contentBlock.path("thinking").asText(""), sink);
                }
                default -> {
                    blocks.put(index, new Block(BlockKind.TEXT, null));
                    emitText(contentBlock.path("text").asText(""), sink);
                }
            }
        }

        private void onBlockDelta(int index, JsonNode delta, EventSink sink) {
            switch (delta.path("type").asText("")) {
                case "text_delta" -> emitText(delta.path("text").asText(""), sink);
                case "thinking_delta" -> emitReasoning(delta.path("thinking").asText(""), sink);
                case "input_json_delta" -> {
                    String fragment = delta.path("partial_json").asText("");
                    Block block = blocks.get(index);
                    if (block == null) {
                        orphanJson.computeIfAbsent(index, ignored -> new StringBuilder()).append(fragment);
                        return;
                    }
                    if (block.kind != BlockKind.TOOL) {
                        throw RelayException.malformed("input_json_delta received for non-tool block " + index);
                    }
                    if (block.closed) {
                        throw RelayException.malformed("input received for tool call " + block.toolId + " after it was closed");
                    }
                    if (!fragment.isEmpty()) {
                        sink.emit(new CanonicalEvent.ToolCallArgDelta(block.toolId, fragment));
                    }
                }
                case "signature_delta" -> {
                    String signature = delta.path("signature").asText("");
                    Block block = blocks.get(index);
                    if (!signature.isEmpty() && block != null && block.kind == BlockKind.THINKING) {
                        sink.emit(new CanonicalEvent.ReasoningDelta("", signature));
                    }
                }
                default -> {
                    // citation deltas
                }
            }
        }

        private void onBlockStop(int index, EventSink sink) {
            Block block = blocks.get(index);
            if (block == null || block.closed) {
                return;
            }
            block.closed = true;
            if (block.kind == BlockKind.TOOL) {
                closedAnyCall = true;
                sink.emit(new CanonicalEvent.ToolCallClose(block.toolId));
            }
        }

        private void onMessageStop(EventSink sink) {
            finished = true;
            sink.emit(new CanonicalEvent.Usage(new TokenUsage(inputTokens, outputTokens, cachedTokens)));
            FinishReason reason = switch (stopReason) {
                case "max_tokens" -> FinishReason.LENGTH;
                case "tool_use" -> FinishReason.TOOL_USE;
                case "refusal", "sensitive" -> FinishReason.CONTENT_FILTER;
                default -> closedAnyCall ? FinishReason.TOOL_USE : FinishReason.STOP;
            };
            sink.emit(new CanonicalEvent.Finish(reason));
        }

        private void readUsage(JsonNode usage) {
            if (!usage.isObject()) {
                return;
            }
            if (usage.has("input_tokens")) {
                inputTokens = usage.path("input_tokens").asLong(inputTokens);
            }
            if (usage.has("output_tokens")) {
                outputTokens = usage.path("output_tokens").asLong(outputTokens);
            }
            if (usage.has("cache_read_input_tokens")) {
                cachedTokens = usage.path("cache_read_input_tokens").asLong(cachedTokens);
            }
        }

        private void emitText(String text, EventSink sink) {
            if (!text.isEmpty()) {
                sink.emit(new CanonicalEvent.TextDelta(text));
            }
        }

        private void emitReasoning(String text, EventSink sink) {
            if (!text.isEmpty()) {
                sink.emit(new CanonicalEvent.ReasoningDelta(text));
            }
        }

        private JsonNode readChunk(String data) {
            try {
                return mapper.readTree(data);
            } catch (JsonProcessingException e) {
                throw RelayException.malformed("invalid JSON event: " + e.getOriginalMessage());
            }
        }
    }

    private enum BlockKind {
        TEXT,
        THINKING,
        TOOL
    }

    private static final class Block {
        private final BlockKind kind;
        private final String toolId;
        private boolean closed;

        private Block(BlockKind kind, String toolId) {
            this.kind = kind;
            this.toolId = toolId;
        }
    }
}
