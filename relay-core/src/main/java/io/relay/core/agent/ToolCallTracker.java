package io.relay.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.relay.core.error.RelayException;
import io.relay.core.event.CanonicalEvent;
import io.relay.core.model.ToolCall;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assembles tool calls from the canonical events of one attempt and rejects events that break the
 * open, delta, close order for an id.
 */
final class ToolCallTracker {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Map<String, OpenCall> open = new LinkedHashMap<>();
    private final Set<String> closedIds = new HashSet<>();
    private final List<CompletedCall> completed = new ArrayList<>();

    void apply(CanonicalEvent event) {
        switch (event.type()) {
            case TOOL_CALL_OPEN -> {
                CanonicalEvent.ToolCallOpen opened = (CanonicalEvent.ToolCallOpen) event;
                if (open.containsKey(opened.id()) || closedIds.contains(opened.id())) {
                    throw RelayException.malformed("Tool call " + opened.id() + " was opened twice");
                }
                open.put(opened.id(), new OpenCall(opened.id(), opened.name()));
            }
            case TOOL_CALL_ARG_DELTA -> {
                CanonicalEvent.ToolCallArgDelta delta = (CanonicalEvent.ToolCallArgDelta) event;
                requireOpen(delta.id(), "received arguments").arguments.append(delta.fragment());
            }
            case TOOL_CALL_CLOSE -> {
                String id = event.toolCallId();
                OpenCall call = requireOpen(id, "was closed");
                open.remove(id);
                closedIds.add(id);
                completed.add(finish(call));
            }
            default -> {
            }
        }
    }

    boolean hasOpen() {
        return !open.isEmpty();
    }

    List<String> openIds() {
        return List.copyOf(open.keySet());
    }

    List<CompletedCall> completed() {
        return List.copyOf(completed);
    }

    private OpenCall requireOpen(String id, String action) {
        OpenCall call = open.get(id);
        if (call == null) {
            String state = closedIds.contains(id) ? "after it was closed" : "before it was opened";
            throw RelayException.malformed("Tool call " + id + " " + action + " " + state);
        }
        return call;
    }

    private static CompletedCall finish(OpenCall call) {
        String raw = call.arguments.toString();
        if (raw.isBlank()) {
            return new CompletedCall(call.id, call.name, raw, Map.of(), null);
        }
        try {
            Object parsed = JSON.readValue(raw, Object.class);
            if (!(parsed instanceof Map)) {
                return new CompletedCall(call.id, call.name, raw, Map.of(), "arguments must be a JSON object");
            }
            return new CompletedCall(call.id, call.name, raw, JSON.convertValue(parsed, MAP_TYPE), null);
        } catch (JsonProcessingException e) {
            return new CompletedCall(call.id, call.name, raw, Map.of(), "arguments are not valid JSON: "
                + e.getOriginalMessage());
        }
    }

    /**
     * @param argumentError why the arguments could not be used, or {@code null} when they parsed
     */
    record CompletedCall(String id, String name, String rawArguments, Map<String, Object> arguments,
                         String argumentError) {

        boolean hasValidArguments() {
            return argumentError == null;
        }

        ToolCall toToolCall() {
            return new ToolCall(id, name, arguments);
        }
    }

    private static final class OpenCall {
        private final String id;
        private final String name;
        private final StringBuilder arguments = new StringBuilder();

        private OpenCall(String id, String name) {
            this.id = id;
            this.name = name;
        }
    }
}
