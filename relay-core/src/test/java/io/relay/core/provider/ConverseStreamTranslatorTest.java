package io.relay.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.relay.core.error.ErrorKind;
import io.relay.core.error.RelayException;
import io.relay.core.event.CanonicalEvent;
import io.relay.core.event.FinishReason;
import io.relay.core.event.TokenUsage;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlockDelta;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlockDeltaEvent;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlockStart;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlockStartEvent;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlockStopEvent;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseStreamMetadataEvent;
import software.amazon.awssdk.services.bedrockruntime.model.MessageStopEvent;
import software.amazon.awssdk.services.bedrockruntime.model.StopReason;
import software.amazon.awssdk.services.bedrockruntime.model.ToolUseBlockDelta;
import software.amazon.awssdk.services.bedrockruntime.model.ToolUseBlockStart;

class ConverseStreamTranslatorTest {

    private final ConverseStreamTranslator translator = new ConverseStreamTranslator();
    private final List<CanonicalEvent> events = new ArrayList<>();

    @Test
    void shouldHoldFinishUntilMetadataArrives() {
        translator.onContentBlockDelta(textDelta(0, "Hi"), events::add);
        translator.onContentBlockStart(toolStart(1, "tooluse_1", "read_file"), events::add);
        translator.onContentBlockDelta(toolDelta(1, "{\"path\":"), events::add);
        translator.onContentBlockDelta(toolDelta(1, "\"a.txt\"}"), events::add);
        translator.onContentBlockStop(ContentBlockStopEvent.builder().contentBlockIndex(1).build(), events::add);
        translator.onMessageStop(MessageStopEvent.builder().stopReason(StopReason.TOOL_USE).build());

        assertThat(events).noneMatch(CanonicalEvent::isTerminal);

        translator.onMetadata(ConverseStreamMetadataEvent.builder()
            .usage(software.amazon.awssdk.services.bedrockruntime.model.TokenUsage.builder()
                .inputTokens(15).outputTokens(6).totalTokens(21).build())
            .build());
        translator.complete(events::add);

        assertThat(events).containsExactly(
            new CanonicalEvent.TextDelta("Hi"),
            new CanonicalEvent.ToolCallOpen("tooluse_1", "read_file"),
            new CanonicalEvent.ToolCallArgDelta("tooluse_1", "{\"path\":"),
            new CanonicalEvent.ToolCallArgDelta("tooluse_1", "\"a.txt\"}"),
            new CanonicalEvent.ToolCallClose("tooluse_1"),
            new CanonicalEvent.Usage(new TokenUsage(15, 6, 0)),
            new CanonicalEvent.Finish(FinishReason.TOOL_USE)
        );
    }

    @Test
    void shouldMapStopReasons() {
        translator.onMessageStop(MessageStopEvent.builder().stopReason(StopReason.MAX_TOKENS).build());
        translator.complete(events::add);

        assertThat(events).containsExactly(new CanonicalEvent.Finish(FinishReason.LENGTH));
    }

    @Test
    void shouldMapGuardrailToContentFilter() {
        translator.onMessageStop(MessageStopEvent.builder().stopReason(StopReason.GUARDRAIL_INTERVENED).build());
        translator.complete(events::add);

        assertThat(events).containsExactly(new CanonicalEvent.Finish(FinishReason.CONTENT_FILTER));
    }

    @Test
    void shouldReportNetworkErrorWhenCompletedWithoutMessageStop() {
        translator.onContentBlockDelta(textDelta(0, "partial"), events::add);
        translator.complete(events::add);

        assertThat(events).hasSize(2);
        CanonicalEvent.StreamError error = (CanonicalEvent.StreamError) events.get(1);
        assertThat(error.error().kind()).isEqualTo(ErrorKind.NETWORK_ERROR);
    }

    @Test
    void shouldRejectInputAfterClose() {
        translator.onContentBlockStart(toolStart(0, "t1", "read_file"), events::add);
        translator.onContentBlockStop(ContentBlockStopEvent.builder().contentBlockIndex(0).build(), events::add);

        assertThatThrownBy(() -> translator.onContentBlockDelta(toolDelta(0, "{}"), events::add))
            .isInstanceOf(RelayException.class)
            .extracting(error -> ((RelayException) error).kind())
            .isEqualTo(ErrorKind.MALFORMED_STREAM);
    }

    private static ContentBlockDeltaEvent textDelta(int index, String text) {
        return ContentBlockDeltaEvent.builder()
            .contentBlockIndex(index)
            .delta(ContentBlockDelta.fromText(text))
            .build();
    }

    private static ContentBlockDeltaEvent toolDelta(int index, String input) {
        return ContentBlockDeltaEvent.builder()
            .contentBlockIndex(index)
            .delta(ContentBlockDelta.fromToolUse(ToolUseBlockDelta.builder().input(input).build()))
            .build();
    }

    private static ContentBlockStartEvent toolStart(int index, String id, String name) {
        return ContentBlockStartEvent.builder()
            .contentBlockIndex(index)
            .start(ContentBlockStart.fromToolUse(ToolUseBlockStart.builder().toolUseId(id).name(name).build()))
            .build();
    }
}
