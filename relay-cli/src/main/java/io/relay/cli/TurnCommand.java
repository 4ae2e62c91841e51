package io.relay.cli;

import io.relay.core.agent.AgentLoop;
import io.relay.core.agent.AgentSettings;
import io.relay.core.agent.ConversationState;
import io.relay.core.agent.TurnHandle;
import io.relay.core.agent.TurnListener;
import io.relay.core.agent.TurnResult;
import io.relay.core.config.RelayRuntime;
import io.relay.core.error.ProviderError;
import io.relay.core.event.CanonicalEvent;
import io.relay.core.model.ChatMessage;
import io.relay.core.model.ReasoningEffort;
import io.relay.core.model.ToolCall;
import io.relay.core.tool.RegistryToolExecutor;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "turn", description = "Send a prompt and stream the reply")
public final class TurnCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Prompt to send")
    String prompt;

    @Option(names = {"-m", "--model"}, description = "Model override")
    String model;

    @Option(names = {"-p", "--provider"}, description = "Provider, alias, provider/model or *")
    String provider;

    @Option(names = {"-r", "--reasoning"}, description = "Reasoning effort: minimal, low, medium, high, xhigh")
    String reasoning;

    public TurnCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        PrintStream out = System.out;
        PrintStream err = System.err;
        try (RelayRuntime runtime = context.openRuntime()) {
            AgentSettings defaults = runtime.settings();
            AgentSettings settings = new AgentSettings(
                defaults.systemPrompt(),
                provider != null ? provider : defaults.provider(),
                model != null ? model : defaults.model(),
                defaults.maxToolIterations(),
                reasoning != null ? ReasoningEffort.fromId(reasoning) : defaults.reasoning(),
                defaults.maxTokens()
            );
            AgentLoop loop = runtime.newAgentLoop(new RegistryToolExecutor(context.tools()), settings);
            TurnHandle handle = loop.beginTurn(
                ConversationState.of(List.of(ChatMessage.user(prompt))),
                new ConsoleListener(out, err)
            );
            Thread abortOnExit = new Thread(handle::abort, "relay-abort");
            Runtime.getRuntime().addShutdownHook(abortOnExit);
            TurnResult result;
            try {
                result = handle.result().join();
            } finally {
                removeHook(abortOnExit);
            }
            out.println();
            err.println(statusLine(result));
            return switch (result.outcome()) {
                case COMPLETED -> 0;
                case ABORTED -> 130;
                case FAILED -> 1;
            };
        } catch (Exception e) {
            err.println("Turn failed: " + e.getMessage());
            return 1;
        }
    }

    static String statusLine(TurnResult result) {
        StringBuilder line = new StringBuilder("[").append(result.outcome().name().toLowerCase(Locale.ROOT));
        if (result.finishReason() != null) {
            line.append(" finish=").append(result.finishReason().name().toLowerCase(Locale.ROOT));
        }
        line.append(" tokens=").append(result.usage().input()).append('/').append(result.usage().output());
        line.append(" retries=").append(result.retries());
        line.append(" fallbacks=").append(result.fallbacks());
        if (result.iterationLimitReached()) {
            line.append(" tool-limit");
        }
        if (result.error() != null) {
            line.append(" error=").append(result.error());
        }
        return line.append(']').toString();
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down, the hook has run
        }
    }

    private static final class ConsoleListener implements TurnListener {
        private final PrintStream out;
        private final PrintStream err;

        private ConsoleListener(PrintStream out, PrintStream err) {
            this.out = out;
            this.err = err;
        }

        @Override
        public void onEvent(CanonicalEvent event) {
            if (event instanceof CanonicalEvent.TextDelta delta) {
                out.print(delta.text());
                out.flush();
            } else if (event instanceof CanonicalEvent.ToolCallOpen open) {
                err.println();
                err.println("[tool " + open.name() + "]");
            }
        }

        @Override
        public void onToolResult(ToolCall call, ChatMessage result) {
            if (result.toolError()) {
                err.println("[tool " + call.name() + " failed: " + result.content() + "]");
            }
        }

        @Override
        public void onAttemptDiscarded(int attempt, ProviderError error) {
            err.println();
            err.println("[attempt " + attempt + " discarded: " + error.kind() + "]");
        }
    }
}
