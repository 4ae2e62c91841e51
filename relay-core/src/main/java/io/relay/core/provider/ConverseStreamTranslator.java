package io.relay.core.provider;

import io.relay.core.error.ErrorKind;
import io.relay.core.error.ProviderError;
import io.relay.core.error.RelayException;
import io.relay.core.event.CanonicalEvent;
import io.relay.core.event.EventSink;
import io.relay.core.event.FinishReason;
import io.relay.core.event.TokenUsage;
import java.util.HashMap;
import java.util.Map;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlockDelta;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlockDeltaEvent;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlockStartEvent;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlockStopEvent;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseStreamMetadataEvent;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseStreamOutput;
import software.amazon.awssdk.services.bedrockruntime.model.MessageStopEvent;
import software.amazon.awssdk.services.bedrockruntime.model.ToolUseBlockStart;

/**
 * Converse-stream family. Bedrock sends {@code messageStop} before the usage metadata, so the finish event is
 * held back until the SDK reports that the stream completed.
 */
final class ConverseStreamTranslator {
    private final Map<Integer, ToolBlock> toolBlocks = new HashMap<>();
    private final Map<Integer, StringBuilder> orphanInput = new HashMap<>();
    private String stopReason;
    private TokenUsage usage;
    private boolean closedAnyCall;

    void accept(ConverseStreamOutput output, EventSink sink) {
        if (output instanceof ContentBlockStartEvent start) {
            onContentBlockStart(start, sink);
        } else if (output instanceof ContentBlockDeltaEvent delta) {
            onContentBlockDelta(delta, sink);
        } else if (output instanceof ContentBlockStopEvent stop) {
            onContentBlockStop(stop, sink);
        } else if (output instanceof MessageStopEvent stop) {
            onMessageStop(stop);
        } else if (output instanceof ConverseStreamMetadataEvent metadata) {
            onMetadata(metadata);
        }
    }

    void onContentBlockStart(ContentBlockStartEvent event, EventSink sink) {
        if (event.start() == null || event.start().toolUse() == null) {
            return;
        }
        ToolUseBlockStart toolUse = event.start().toolUse();
        int index = indexOf(event.contentBlockIndex());
        if (toolUse.toolUseId() == null || toolUse.name() == null) {
            throw RelayException.malformed("toolUse block " + index + " is missing its id or name");
        }
        ToolBlock block = new ToolBlock(toolUse.toolUseId());
        toolBlocks.put(index, block);
        sink.emit(new CanonicalEvent.ToolCallOpen(block.id, toolUse.name()));
        StringBuilder orphan = orphanInput.remove(index);
        if (orphan != null && orphan.length() > 0) {
            sink.emit(new CanonicalEvent.ToolCallArgDelta(block.id, orphan.toString()));
        }
    }

    void onContentBlockDelta(ContentBlockDeltaEvent event, EventSink sink) {
        ContentBlockDelta delta = event.delta();
        if (delta == null) {
            return;
        }
        if (delta.text() != null && !delta.text().isEmpty()) {
            sink.emit(new CanonicalEvent.TextDelta(delta.text()));
        }
        if (delta.reasoningContent() != null && delta.reasoningContent().text() != null
            && !delta.reasoningContent().text().isEmpty()) {
            sink.emit(new CanonicalEvent.ReasoningDelta(delta.reasoningContent().text()));
        }
        if (delta.toolUse() != null) {
            int index = indexOf(event.contentBlockIndex());
            String fragment = delta.toolUse().input() == null ? "" : delta.toolUse().input();
            ToolBlock block = toolBlocks.get(index);
            if (block == null) {
                orphanInput.computeIfAbsent(index, ignored -> new StringBuilder()).append(fragment);
                return;
            }
            if (block.closed) {
                throw RelayException.malformed("input received for tool call " + block.id + " after it was closed");
            }
            if (!fragment.isEmpty()) {
                sink.emit(new CanonicalEvent.ToolCallArgDelta(block.id, fragment));
            }
        }
    }

    void onContentBlockStop(ContentBlockStopEvent event, EventSink sink) {
        ToolBlock block = toolBlocks.get(indexOf(event.contentBlockIndex()));
        if (block == null || block.closed) {
            return;
        }
        block.closed = true;
        closedAnyCall = true;
        sink.emit(new CanonicalEvent.ToolCallClose(block.id));
    }

    void onMessageStop(MessageStopEvent event) {
        stopReason = event.stopReasonAsString() == null ? "end_turn" : event.stopReasonAsString();
    }

    void onMetadata(ConverseStreamMetadataEvent event) {
        if (event.usage() == null) {
            return;
        }
        usage = new TokenUsage(
            event.usage().inputTokens() == null ? 0 : event.usage().inputTokens(),
            event.usage().outputTokens() == null ? 0 : event.usage().outputTokens(),
            0
        );
    }

    void complete(EventSink sink) {
        if (stopReason == null) {
            sink.emit(new CanonicalEvent.StreamError(
                ProviderError.of(ErrorKind.NETWORK_ERROR, "stream ended before messageStop")
            ));
            return;
        }
        if (usage != null) {
            sink.emit(new CanonicalEvent.Usage(usage));
        }
        FinishReason reason = switch (stopReason) {
            case "max_tokens" -> FinishReason.LENGTH;
            case "tool_use" -> FinishReason.TOOL_USE;
            case "guardrail_intervened", "content_filtered" -> FinishReason.CONTENT_FILTER;
            default -> closedAnyCall ? FinishReason.TOOL_USE : FinishReason.STOP;
        };
        sink.emit(new CanonicalEvent.Finish(reason));
    }

    private int indexOf(Integer index) {
        return index == null ? 0 : index;
    }

    private static final class ToolBlock {
        private final String id;
        private boolean closed;

        private ToolBlock(String id) {
            this.id = id;
        }
    }
}
