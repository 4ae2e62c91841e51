package io.relay.core.provider;

import static io.relay.core.provider.OpenAiCompletionsAdapterTest.drain;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.relay.core.error.ErrorKind;
import io.relay.core.event.CanonicalEvent;
import io.relay.core.event.FinishReason;
import io.relay.core.event.TokenUsage;
import io.relay.core.model.ChatMessage;
import io.relay.core.model.ReasoningEffort;
import io.relay.core.model.ToolCall;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnthropicMessagesAdapterTest {

    private MockWebServer server;
    private AnthropicMessagesAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        adapter = new AnthropicMessagesAdapter(HttpClients.defaults());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldTranslateTextThinkingAndToolUseBlocks() throws Exception {
        server.enqueue(sse("""
            event: message_start
            data: {"type":"message_start","message":{"usage":{"input_tokens":30,"output_tokens":1,"cache_read_input_tokens":10}}}

            event: content_block_start
            data: {"type":"content_block_start","index":0,"content_block":{"type":"thinking","thinking":""}}

            event: content_block_delta
            data: {"type":"content_block_delta","index":0,"delta":{"type":"thinking_delta","thinking":"need the file"}}

            event: content_block_delta
            data: {"type":"content_block_delta","index":0,"delta":{"type":"signature_delta","signature":"EqQBsig"}}

            event: content_block_stop
            data: {"type":"content_block_stop","index":0}

            event: content_block_start
            data: {"type":"content_block_start","index":1,"content_block":{"type":"text","text":""}}

            event: content_block_delta
            data: {"type":"content_block_delta","index":1,"delta":{"type":"text_delta","text":"Reading."}}

            event: content_block_stop
            data: {"type":"content_block_stop","index":1}

            event: content_block_start
            data: {"type":"content_block_start","index":2,"content_block":{"type":"tool_use","id":"toolu_1","name":"read_file","input":{}}}

            event: content_block_delta
            data: {"type":"content_block_delta","index":2,"delta":{"type":"input_json_delta","partial_json":"{\\"path\\": "}}

            event: content_block_delta
            data: {"type":"content_block_delta","index":2,"delta":{"type":"input_json_delta","partial_json":"\\"a.txt\\"}"}}

            event: content_block_stop
            data: {"type":"content_block_stop","index":2}

            event: ping
            data: {"type":"ping"}

            event: message_delta
            data: {"type":"message_delta","delta":{"stop_reason":"tool_use"},"usage":{"output_tokens":42}}

            event: message_stop
            data: {"type":"message_stop"}

            """));

        List<CanonicalEvent> events = drain(adapter.send(request(), route()));

        assertThat(events).containsExactly(
            new CanonicalEvent.ReasoningDelta("need the file"),
            new CanonicalEvent.ReasoningDelta("", "EqQBsig"),
            new CanonicalEvent.TextDelta("Reading."),
            new CanonicalEvent.ToolCallOpen("toolu_1", "read_file"),
            new CanonicalEvent.ToolCallArgDelta("toolu_1", "{\"path\": "),
            new CanonicalEvent.ToolCallArgDelta("toolu_1", "\"a.txt\"}"),
            new CanonicalEvent.ToolCallClose("toolu_1"),
            new CanonicalEvent.Usage(new TokenUsage(30, 42, 10)),
            new CanonicalEvent.Finish(FinishReason.TOOL_USE)
        );
    }

    @Test
    void shouldMapOverloadedErrorEventToTransientError() throws Exception {
        server.enqueue(sse("""
            event: error
            data: {"type":"error","error":{"type":"overloaded_error","message":"Overloaded"}}

            """));

        List<CanonicalEvent> events = drain(adapter.send(request(), route()));

        assertThat(events).hasSize(1);
        CanonicalEvent.StreamError error = (CanonicalEvent.StreamError) events.get(0);
        assertThat(error.error().kind()).isEqualTo(ErrorKind.NETWORK_ERROR);
        assertThat(error.error().isTransient()).isTrue();
    }

    @Test
    void shouldMapMaxTokensStopToLength() throws Exception {
        server.enqueue(sse("""
            data: {"type":"content_block_start","index":0,"content_block":{"type":"text","text":"abc"}}

            data: {"type":"content_block_stop","index":0}

            data: {"type":"message_delta","delta":{"stop_reason":"max_tokens"}}

            data: {"type":"message_stop"}

            """));

        List<CanonicalEvent> events = drain(adapter.send(request(), route()));

        assertThat(events.get(0)).isEqualTo(new CanonicalEvent.TextDelta("abc"));
        assertThat(events).endsWith(new CanonicalEvent.Finish(FinishReason.LENGTH));
    }

    @Test
    void shouldSendHeadersThinkingBudgetAndGroupedToolResults() throws Exception {
        server.enqueue(sse("""
            data: {"type":"message_stop"}

            """));
        List<ChatMessage> messages = List.of(
            ChatMessage.system("sys"),
            ChatMessage.user("read both"),
            ChatMessage.assistantWithToolCalls("", List.of(
                new ToolCall("t1", "read_file", Map.of("path", "a")),
                new ToolCall("t2", "read_file", Map.of("path", "b"))
            )),
            ChatMessage.tool("A", "t1"),
            ChatMessage.toolError("missing", "t2")
        );
        LlmRequest request = LlmRequest.forRoute(route(), messages, List.of(), ReasoningEffort.MEDIUM, null);

        drain(adapter.send(request, route()));

        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getPath()).isEqualTo("/v1/messages");
        assertThat(recorded.getHeader("x-api-key")).isEqualTo("sk-ant");
        assertThat(recorded.getHeader("anthropic-version")).isEqualTo("2023-06-01");
        String body = recorded.getBody().readUtf8();
        assertThat(body).contains("\"system\":\"sys\"");
        assertThat(body).contains("\"budget_tokens\":8192");
        assertThat(body).contains("\"is_error\":true");
        assertThat(body.indexOf("\"tool_use_id\":\"t1\"")).isLessThan(body.indexOf("\"tool_use_id\":\"t2\""));
        assertThat(body.split("\"role\":\"user\"", -1)).hasSize(3);
    }

    @Test
    void shouldReplaySignedThinkingAheadOfToolUse() throws Exception {
        server.enqueue(sse("""
            data: {"type":"message_stop"}

            """));
        List<ChatMessage> messages = List.of(
            ChatMessage.user("read a"),
            ChatMessage.assistantWithReasoning("Reading.", List.of(new ToolCall("toolu_1", "read_file",
                Map.of("path", "a"))), "need the file", "EqQBsig"),
            ChatMessage.tool("A", "toolu_1")
        );
        LlmRequest request = LlmRequest.forRoute(route(), messages, List.of(), ReasoningEffort.HIGH, null);

        drain(adapter.send(request, route()));

        JsonNode body = new ObjectMapper().readTree(server.takeRequest().getBody().readUtf8());
        JsonNode assistant = body.path("messages").get(1);
        assertThat(assistant.path("role").asText()).isEqualTo("assistant");
        assertThat(assistant.path("content")).hasSize(3);
        JsonNode thinking = assistant.path("content").get(0);
        assertThat(thinking.path("type").asText()).isEqualTo("thinking");
        assertThat(thinking.path("thinking").asText()).isEqualTo("need the file");
        assertThat(thinking.path("signature").asText()).isEqualTo("EqQBsig");
        assertThat(assistant.path("content").get(1).path("type").asText()).isEqualTo("text");
        assertThat(assistant.path("content").get(2).path("type").asText()).isEqualTo("tool_use");
    }

    @Test
    void shouldOmitThinkingBlockWithoutSignature() throws Exception {
        server.enqueue(sse("""
            data: {"type":"message_stop"}

            """));
        List<ChatMessage> messages = List.of(
            ChatMessage.user("read a"),
            ChatMessage.assistantWithReasoning("", List.of(new ToolCall("toolu_1", "read_file", Map.of())),
                "unsigned", ""),
            ChatMessage.tool("A", "toolu_1")
        );

        drain(adapter.send(LlmRequest.forRoute(route(), messages, List.of(), null, null), route()));

        String body = server.takeRequest().getBody().readUtf8();
        assertThat(body).doesNotContain("\"type\":\"thinking\"").contains("\"type\":\"tool_use\"");
    }

    private MockResponse sse(String body) {
        return new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setChunkedBody(body, 32);
    }

    private RoutingDecision route() {
        ProviderProfile profile = ProviderProfile.chat(
            "anthropic", ApiShape.ANTHROPIC_MESSAGES, server.url("/v1").toString(), "sk-ant", 1);
        return new RoutingDecision(profile, ApiShape.ANTHROPIC_MESSAGES, "claude-sonnet-4-5", "sk-ant", false);
    }

    private LlmRequest request() {
        return LlmRequest.forRoute(route(), List.of(ChatMessage.user("hi")), List.of(), null, null);
    }
}
