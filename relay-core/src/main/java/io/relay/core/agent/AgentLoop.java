package io.relay.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.relay.core.error.ErrorKind;
import io.relay.core.error.ProviderError;
import io.relay.core.error.RelayException;
import io.relay.core.event.CanonicalEvent;
import io.relay.core.event.EventStream;
import io.relay.core.event.FinishReason;
import io.relay.core.event.TokenUsage;
import io.relay.core.model.ChatMessage;
import io.relay.core.model.MessageRole;
import io.relay.core.model.ToolCall;
import io.relay.core.model.ToolDeclaration;
import io.relay.core.observability.MetricsEmitter;
import io.relay.core.policy.RetryDecision;
import io.relay.core.policy.RetryPolicy;
import io.relay.core.provider.AdapterRegistry;
import io.relay.core.provider.LlmRequest;
import io.relay.core.provider.ProviderRouter;
import io.relay.core.provider.RoutingDecision;
import io.relay.core.provider.StreamAdapter;
import io.relay.core.tool.ToolExecutionException;
import io.relay.core.tool.ToolExecutor;
import io.relay.core.tool.ToolResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one conversation: sends the transcript to the routed provider, forwards the streamed events,
 * dispatches requested tools one at a time and repeats until the model stops asking for tools.
 *
 * <p>Transient failures are retried on the same endpoint with backoff. An endpoint that rejects the request
 * shape gets one hop to its fallback shape, which does not count against the retry budget and is remembered
 * for later turns of this loop. Only one turn may be active at a time.
 *
 * <p>A loop built without an executor owns a private pool and must be closed; a supplied executor stays owned
 * by the caller.
 */
public final class AgentLoop implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AgentLoop.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final AtomicInteger THREADS = new AtomicInteger();
    static final String SKIPPED_BY_ABORT = "Skipped due to abort signal.";
    static final String SKIPPED_BY_LIMIT = "Skipped: tool iteration limit reached.";

    private final ProviderRouter router;
    private final AdapterRegistry adapters;
    private final ToolExecutor tools;
    private final MetricsEmitter metrics;
    private final RetryPolicy retryPolicy;
    private final AgentSettings settings;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final Set<String> fallbackMemo = ConcurrentHashMap.newKeySet();
    private TurnHandle activeTurn;

    public AgentLoop(ProviderRouter router, AdapterRegistry adapters, ToolExecutor tools, AgentSettings settings) {
        this(router, adapters, tools, MetricsEmitter.noop(), RetryPolicy.defaults(), settings, null);
    }

    public AgentLoop(
        ProviderRouter router,
        AdapterRegistry adapters,
        ToolExecutor tools,
        MetricsEmitter metrics,
        RetryPolicy retryPolicy,
        AgentSettings settings,
        Executor executor
    ) {
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.adapters = Objects.requireNonNull(adapters, "adapters must not be null");
        this.tools = Objects.requireNonNull(tools, "tools must not be null");
        this.metrics = metrics == null ? MetricsEmitter.noop() : metrics;
        this.retryPolicy = retryPolicy == null ? RetryPolicy.defaults() : retryPolicy;
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.ownedExecutor = executor == null ? newTurnExecutor() : null;
        this.executor = executor == null ? ownedExecutor : executor;
    }

    public AgentSettings settings() {
        return settings;
    }

    /**
     * Starts a turn on the loop's executor and returns immediately.
     *
     * @throws IllegalStateException when a turn of this loop is still running
     */
    public synchronized TurnHandle beginTurn(ConversationState conversation, TurnListener listener) {
        Objects.requireNonNull(conversation, "conversation must not be null");
        if (activeTurn != null && !activeTurn.isDone()) {
            throw new IllegalStateException("Turn " + activeTurn.id() + " is still running");
        }
        TurnHandle handle = new TurnHandle(UUID.randomUUID().toString(), new AbortSignal());
        activeTurn = handle;
        TurnRun run = new TurnRun(handle, conversation, listener == null ? TurnListener.NONE : listener);
        try {
            executor.execute(() -> {
                try {
                    handle.complete(run.run());
                } catch (RuntimeException | Error e) {
                    LOG.error("Turn {} failed unexpectedly", handle.id(), e);
                    handle.fail(e);
                }
            });
        } catch (RejectedExecutionException e) {
            handle.fail(e);
            throw e;
        }
        return handle;
    }

    /** Runs a turn on the calling thread's behalf and waits for its result. */
    public TurnResult runTurn(ConversationState conversation, TurnListener listener) {
        return beginTurn(conversation, listener).result().join();
    }

    /** Stops the loop's own pool once the running turn ends. A supplied executor is left alone. */
    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    /** Daemon pool for running turns; the caller owns it and shuts it down. */
    public static ExecutorService newTurnExecutor() {
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "relay-turn-" + THREADS.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    private final class TurnRun {
        private final TurnHandle handle;
        private final AbortSignal signal;
        private final TurnListener listener;
        private final List<ToolDeclaration> declarations;
        private final List<ChatMessage> transcript = new ArrayList<>();
        private final List<ChatMessage> appended = new ArrayList<>();
        private final long startedNanos = System.nanoTime();
        private TokenUsage usage = TokenUsage.EMPTY;
        private int retries;
        private int fallbacks;
        private int requests;
        private int attemptCounter;

        private TurnRun(TurnHandle handle, ConversationState conversation, TurnListener listener) {
            this.handle = handle;
            this.signal = handle.signal();
            this.listener = listener;
            this.declarations = conversation.tools().isEmpty() ? tools.declarations() : conversation.tools();
            List<ChatMessage> history = conversation.messages();
            boolean hasSystem = !history.isEmpty() && history.get(0).role() == MessageRole.SYSTEM;
            if (!hasSystem && !settings.systemPrompt().isBlank()) {
                transcript.add(ChatMessage.system(settings.systemPrompt()));
            }
            transcript.addAll(history);
        }

        private TurnResult run() {
            metrics.emit("turn_started", attributes("turn_id", handle.id(), "provider", settings.provider(),
                "model", settings.model()));
            TurnResult result;
            try {
                result = loop();
            } catch (RelayException e) {
                LOG.warn("Turn {} failed: {}", handle.id(), e.error());
                result = failed(e.error(), null);
            }
            finishMetrics(result);
            return result;
        }

        private TurnResult loop() {
            int toolRounds = 0;
            while (true) {
                if (signal.isAborted()) {
                    return aborted(List.of());
                }
                Attempt attempt = send();
                if (attempt.aborted) {
                    return abortedDuringStream(attempt);
                }
                if (attempt.error != null) {
                    return failed(attempt.error, null);
                }
                usage = usage.plus(attempt.usage);
                List<ToolCallTracker.CompletedCall> calls = attempt.calls;
                append(attempt.assistantMessage());
                if (calls.isEmpty()) {
                    return completed(attempt.finish, attempt.text, false);
                }
                if (toolRounds >= settings.maxToolIterations()) {
                    LOG.info("Turn {} reached the limit of {} tool iterations", handle.id(),
                        settings.maxToolIterations());
                    calls.forEach(call -> append(ChatMessage.toolError(SKIPPED_BY_LIMIT, call.id())));
                    return completed(attempt.finish, attempt.text, true);
                }
                toolRounds++;
                transition(TurnState.TOOL_DISPATCH);
                TurnResult stopped = dispatch(calls);
                if (stopped != null) {
                    return stopped;
                }
            }
        }

        private Attempt send() {
            RoutingDecision route = router.route(settings.provider(), settings.model());
            if (!route.fallbackHop() && fallbackMemo.contains(route.profile().name())) {
                route = router.fallback(route).orElse(route);
            }
            int charged = 0;
            boolean charge = true;
            while (true) {
                if (signal.isAborted()) {
                    return Attempt.abortedBeforeStream();
                }
                if (charge) {
                    charged++;
                }
                charge = true;
                int attemptNumber = ++attemptCounter;
                Attempt attempt = attempt(route, attemptNumber);
                if (attempt.aborted || attempt.error == null) {
                    return attempt;
                }
                ProviderError error = attempt.error;
                RetryDecision decision = retryPolicy.decide(error, charged, router.hasFallback(route));
                metrics.emit("attempt_failed", attributes("turn_id", handle.id(), "attempt", attemptNumber,
                    "provider", route.profile().name(), "api", route.api().id(), "error_kind", error.kind().name(),
                    "http_status", error.httpStatus()));
                switch (decision.action()) {
                    case FAIL -> {
                        return attempt;
                    }
                    case FALLBACK -> {
                        RoutingDecision next = router.fallback(route)
                            .orElseThrow(() -> new RelayException(error));
                        LOG.info("Provider {} rejected the {} request shape; falling back to {}",
                            route.profile().name(), route.api(), next.api());
                        metrics.emit("shape_fallback", attributes("turn_id", handle.id(),
                            "provider", route.profile().name(), "from_api", route.api().id(),
                            "to_api", next.api().id()));
                        fallbackMemo.add(route.profile().name());
                        fallbacks++;
                        discard(attemptNumber, error);
                        route = next;
                        charge = false;
                    }
                    case RETRY -> {
                        retries++;
                        LOG.info("Attempt {} of turn {} via {} failed with {}; retrying in {} ms",
                            attemptNumber, handle.id(), route.profile().name(), error, decision.delay().toMillis());
                        metrics.emit("retry_scheduled", attributes("turn_id", handle.id(), "attempt", attemptNumber,
                            "delay_ms", decision.delay().toMillis(), "error_kind", error.kind().name()));
                        discard(attemptNumber, error);
                        transition(TurnState.SENDING);
                        if (signal.await(decision.delay())) {
                            return Attempt.abortedBeforeStream();
                        }
                        route = router.refresh(route);
                    }
                }
            }
        }

        private Attempt attempt(RoutingDecision route, int attemptNumber) {
            StreamAdapter adapter = adapters.find(route.api())
                .orElseThrow(() -> RelayException.config("No stream adapter registered for api " + route.api()));
            LlmRequest request = LlmRequest.forRoute(route, transcript, declarations, settings.reasoning(),
                settings.maxTokens());
            requests++;
            transition(TurnState.SENDING);
            metrics.emit("attempt_started", attributes("turn_id", handle.id(), "attempt", attemptNumber,
                "provider", route.profile().name(), "api", route.api().id(), "model", route.model(),
                "fallback_hop", route.fallbackHop()));
            LOG.debug("Attempt {} of turn {} using {}", attemptNumber, handle.id(), route);

            ToolCallTracker tracker = new ToolCallTracker();
            StringBuilder text = new StringBuilder();
            StringBuilder reasoning = new StringBuilder();
            StringBuilder signature = new StringBuilder();
            TokenUsage attemptUsage = TokenUsage.EMPTY;
            try (EventStream stream = adapter.send(request, route);
                 AbortSignal.Registration ignored = signal.onAbort(stream::cancel)) {
                while (true) {
                    if (signal.isAborted()) {
                        return Attempt.abortedDuringStream(text.toString(), reasoning.toString(), signature.toString(),
                            tracker);
                    }
                    if (!stream.hasNext()) {
                        return Attempt.failed(ProviderError.of(ErrorKind.MALFORMED_STREAM,
                            "Stream ended without a finish or error event"));
                    }
                    CanonicalEvent event = stream.next();
                    if (signal.isAborted()) {
                        return Attempt.abortedDuringStream(text.toString(), reasoning.toString(), signature.toString(),
                            tracker);
                    }
                    transition(TurnState.STREAMING);
                    switch (event.type()) {
                        case ERROR -> {
                            return Attempt.failed(((CanonicalEvent.StreamError) event).error());
                        }
                        case FINISH -> {
                            if (tracker.hasOpen()) {
                                return Attempt.failed(ProviderError.of(ErrorKind.MALFORMED_STREAM,
                                    "Stream finished with open tool calls " + tracker.openIds()));
                            }
                            forward(event);
                            FinishReason reason = ((CanonicalEvent.Finish) event).reason();
                            return Attempt.finished(text.toString(), reasoning.toString(), signature.toString(),
                                tracker.completed(), reason, attemptUsage);
                        }
                        case TOOL_CALL_OPEN, TOOL_CALL_ARG_DELTA, TOOL_CALL_CLOSE -> {
                            try {
                                tracker.apply(event);
                            } catch (RelayException e) {
                                return Attempt.failed(e.error());
                            }
                            forward(event);
                        }
                        case TEXT_DELTA -> {
                            text.append(((CanonicalEvent.TextDelta) event).text());
                            forward(event);
                        }
                        case REASONING_DELTA -> {
                            CanonicalEvent.ReasoningDelta delta = (CanonicalEvent.ReasoningDelta) event;
                            reasoning.append(delta.text());
                            signature.append(delta.signature());
                            forward(event);
                        }
                        case USAGE -> {
                            attemptUsage = ((CanonicalEvent.Usage) event).usage();
                            forward(event);
                        }
                        default -> forward(event);
                    }
                }
            }
        }

        /** Returns the result that ends the turn, or {@code null} when the loop should continue. */
        private TurnResult dispatch(List<ToolCallTracker.CompletedCall> calls) {
            for (int i = 0; i < calls.size(); i++) {
                if (signal.isAborted()) {
                    for (ToolCallTracker.CompletedCall skipped : calls.subList(i, calls.size())) {
                        append(ChatMessage.toolError(SKIPPED_BY_ABORT, skipped.id()));
                    }
                    return aborted(List.of());
                }
                ToolCallTracker.CompletedCall call = calls.get(i);
                try {
                    ChatMessage result = execute(call);
                    append(result);
                    notifyToolResult(call.toToolCall(), result);
                } catch (ToolExecutionException e) {
                    ChatMessage result = ChatMessage.toolError(e.getMessage(), call.id());
                    append(result);
                    notifyToolResult(call.toToolCall(), result);
                    for (ToolCallTracker.CompletedCall remaining : calls.subList(i + 1, calls.size())) {
                        append(ChatMessage.toolError("Skipped: an earlier tool failed fatally.", remaining.id()));
                    }
                    LOG.error("Tool {} failed fatally in turn {}", call.name(), handle.id(), e);
                    return failed(ProviderError.of(ErrorKind.TOOL_EXECUTION_ERROR,
                        "Tool '" + call.name() + "' failed: " + e.getMessage()), null);
                }
            }
            return null;
        }

        /** @throws ToolExecutionException only for failures the executor marks fatal */
        private ChatMessage execute(ToolCallTracker.CompletedCall call) throws ToolExecutionException {
            if (!call.hasValidArguments()) {
                LOG.warn("Tool call {} to {} has unusable arguments: {}", call.id(), call.name(), call.argumentError());
                return ChatMessage.toolError("Error: invalid arguments for tool '" + call.name() + "': "
                    + call.argumentError(), call.id());
            }
            long started = System.nanoTime();
            try {
                ToolResult result = tools.execute(call.name(), call.arguments());
                toolMetrics(call, started, true);
                return ChatMessage.tool(render(result), call.id());
            } catch (ToolExecutionException e) {
                toolMetrics(call, started, false);
                if (e.isFatal()) {
                    throw e;
                }
                LOG.warn("Tool {} failed: {}", call.name(), e.getMessage());
                return ChatMessage.toolError("Error: " + e.getMessage(), call.id());
            } catch (RuntimeException e) {
                toolMetrics(call, started, false);
                LOG.warn("Tool {} failed", call.name(), e);
                return ChatMessage.toolError("Error executing tool '" + call.name() + "': " + e.getMessage(),
                    call.id());
            }
        }

        private void toolMetrics(ToolCallTracker.CompletedCall call, long startedNanos, boolean success) {
            metrics.emit("tool_executed", attributes("turn_id", handle.id(), "tool", call.name(),
                "tool_call_id", call.id(), "success", success, "duration_ms", elapsedMillis(startedNanos)));
        }

        private TurnResult abortedDuringStream(Attempt attempt) {
            List<ToolCallTracker.CompletedCall> closed = attempt.calls;
            if (!attempt.text.isEmpty() || !closed.isEmpty()) {
                append(attempt.assistantMessage());
                closed.forEach(call -> append(ChatMessage.toolError(SKIPPED_BY_ABORT, call.id())));
            }
            if (!attempt.openIds.isEmpty()) {
                LOG.debug("Turn {} cancelled open tool calls {}", handle.id(), attempt.openIds);
            }
            return aborted(attempt.openIds);
        }

        private TurnResult completed(FinishReason reason, String text, boolean limitReached) {
            return new TurnResult(TurnOutcome.COMPLETED, appended, text, reason, usage, null, retries, fallbacks,
                List.of(), limitReached);
        }

        private TurnResult aborted(List<String> cancelled) {
            LOG.info("Turn {} aborted", handle.id());
            return new TurnResult(TurnOutcome.ABORTED, appended, lastAssistantText(), null, usage, null, retries,
                fallbacks, cancelled, false);
        }

        private TurnResult failed(ProviderError error, FinishReason reason) {
            return new TurnResult(TurnOutcome.FAILED, appended, lastAssistantText(), reason, usage, error, retries,
                fallbacks, List.of(), false);
        }

        private void finishMetrics(TurnResult result) {
            metrics.emit("turn_finished", attributes("turn_id", handle.id(), "outcome", result.outcome().name(),
                "duration_ms", elapsedMillis(startedNanos), "requests", requests, "retries", retries,
                "fallbacks", fallbacks, "input_tokens", result.usage().input(),
                "output_tokens", result.usage().output(),
                "error_kind", result.error() == null ? null : result.error().kind().name()));
        }

        private String lastAssistantText() {
            for (int i = appended.size() - 1; i >= 0; i--) {
                if (appended.get(i).role() == MessageRole.ASSISTANT) {
                    return appended.get(i).content();
                }
            }
            return "";
        }

        private void append(ChatMessage message) {
            transcript.add(message);
            appended.add(message);
        }

        private void transition(TurnState next) {
            if (handle.transition(next)) {
                notifyListener(() -> listener.onStateChanged(next));
            }
        }

        private void forward(CanonicalEvent event) {
            notifyListener(() -> listener.onEvent(event));
        }

        private void discard(int attemptNumber, ProviderError error) {
            notifyListener(() -> listener.onAttemptDiscarded(attemptNumber, error));
        }

        private void notifyToolResult(ToolCall call, ChatMessage result) {
            notifyListener(() -> listener.onToolResult(call, result));
        }

        private void notifyListener(Runnable callback) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                LOG.warn("Turn listener failed in turn {}", handle.id(), e);
            }
        }
    }

    private static List<ToolCall> toToolCalls(List<ToolCallTracker.CompletedCall> calls) {
        return calls.stream().map(ToolCallTracker.CompletedCall::toToolCall).toList();
    }

    private static String render(ToolResult result) {
        Object value = result == null ? null : result.value();
        if (value == null) {
            return "";
        }
        if (value instanceof String text) {
            return text;
        }
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            LOG.debug("Tool result is not JSON serializable, using toString", e);
            return String.valueOf(value);
        }
    }

    private static long elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }

    private static Map<String, Object> attributes(Object... keyValues) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                attributes.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return attributes;
    }

    private static final class Attempt {
        private final boolean aborted;
        private final ProviderError error;
        private final String text;
        private final String reasoning;
        private final String signature;
        private final List<ToolCallTracker.CompletedCall> calls;
        private final List<String> openIds;
        private final FinishReason finish;
        private final TokenUsage usage;

        private Attempt(
            boolean aborted,
            ProviderError error,
            String text,
            String reasoning,
            String signature,
            List<ToolCallTracker.CompletedCall> calls,
            List<String> openIds,
            FinishReason finish,
            TokenUsage usage
        ) {
            this.aborted = aborted;
            this.error = error;
            this.text = text;
            this.reasoning = reasoning;
            this.signature = signature;
            this.calls = calls;
            this.openIds = openIds;
            this.finish = finish;
            this.usage = usage;
        }

        static Attempt finished(String text, String reasoning, String signature,
                                List<ToolCallTracker.CompletedCall> calls, FinishReason finish, TokenUsage usage) {
            return new Attempt(false, null, text, reasoning, signature, calls, List.of(), finish, usage);
        }

        static Attempt failed(ProviderError error) {
            return new Attempt(false, error, "", "", "", List.of(), List.of(), null, TokenUsage.EMPTY);
        }

        static Attempt abortedBeforeStream() {
            return new Attempt(true, null, "", "", "", List.of(), List.of(), null, TokenUsage.EMPTY);
        }

        static Attempt abortedDuringStream(String text, String reasoning, String signature,
                                           ToolCallTracker tracker) {
            return new Attempt(true, null, text, reasoning, signature, tracker.completed(), tracker.openIds(), null,
                TokenUsage.EMPTY);
        }

        ChatMessage assistantMessage() {
            return ChatMessage.assistantWithReasoning(text, toToolCalls(calls), reasoning, signature);
        }
    }
}
