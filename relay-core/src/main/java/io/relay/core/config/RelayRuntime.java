package io.relay.core.config;

import io.relay.core.agent.AgentLoop;
import io.relay.core.agent.AgentSettings;
import io.relay.core.config.model.AgentConfig;
import io.relay.core.config.model.ProviderConfig;
import io.relay.core.config.model.RelayConfig;
import io.relay.core.config.model.TimeoutConfig;
import io.relay.core.model.ReasoningEffort;
import io.relay.core.observability.BufferedMetricsEmitter;
import io.relay.core.observability.JsonlMetricsSink;
import io.relay.core.observability.LoggingMetricsSink;
import io.relay.core.observability.MetricsSink;
import io.relay.core.policy.RetryPolicy;
import io.relay.core.provider.AdapterRegistry;
import io.relay.core.provider.AnthropicMessagesAdapter;
import io.relay.core.provider.ApiShape;
import io.relay.core.provider.BedrockConverseStreamAdapter;
import io.relay.core.provider.CredentialResolver;
import io.relay.core.provider.GoogleGenerativeAiAdapter;
import io.relay.core.provider.HttpClients;
import io.relay.core.provider.OpenAiCompletionsAdapter;
import io.relay.core.provider.OpenAiResponsesAdapter;
import io.relay.core.provider.ProviderKind;
import io.relay.core.provider.ProviderProfile;
import io.relay.core.provider.ProviderRouter;
import io.relay.core.tool.ToolExecutor;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the router, adapters, retry policy and metrics buffer described by a {@link RelayConfig}.
 * Construction validates every profile, so configuration errors surface before any request is sent.
 */
public final class RelayRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(RelayRuntime.class);

    private final ProviderRouter router;
    private final AdapterRegistry adapters;
    private final RetryPolicy retryPolicy;
    private final BufferedMetricsEmitter metrics;
    private final AgentSettings settings;
    private final OkHttpClient httpClient;
    private final BedrockConverseStreamAdapter bedrock;
    private final ExecutorService turnExecutor;

    private RelayRuntime(
        ProviderRouter router,
        AdapterRegistry adapters,
        RetryPolicy retryPolicy,
        BufferedMetricsEmitter metrics,
        AgentSettings settings,
        OkHttpClient httpClient,
        BedrockConverseStreamAdapter bedrock,
        ExecutorService turnExecutor
    ) {
        this.router = router;
        this.adapters = adapters;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
        this.settings = settings;
        this.httpClient = httpClient;
        this.bedrock = bedrock;
        this.turnExecutor = turnExecutor;
    }

    public static RelayRuntime create(RelayConfig config) {
        return create(config, new CredentialResolver(config.env()));
    }

    public static RelayRuntime create(RelayConfig config, CredentialResolver credentials) {
        Objects.requireNonNull(config, "config must not be null");
        List<ProviderProfile> profiles = config.providers().stream().map(RelayRuntime::toProfile).toList();
        ProviderRouter router = new ProviderRouter(profiles, config.aliases(), credentials);

        TimeoutConfig timeouts = config.timeouts();
        OkHttpClient httpClient = HttpClients.streaming(timeouts.connect(), timeouts.read(), timeouts.attempt());
        BedrockConverseStreamAdapter bedrock = new BedrockConverseStreamAdapter(timeouts.read());
        AdapterRegistry adapters = new AdapterRegistry()
            .register(new OpenAiCompletionsAdapter(httpClient))
            .register(new OpenAiResponsesAdapter(httpClient))
            .register(new AnthropicMessagesAdapter(httpClient))
            .register(new GoogleGenerativeAiAdapter(httpClient))
            .register(bedrock);

        BufferedMetricsEmitter metrics = new BufferedMetricsEmitter(
            metricsSink(config.metrics().path()),
            config.metrics().bufferSize(),
            Clock.systemUTC()
        );
        LOG.debug("Configured {} provider profiles and {} aliases", profiles.size(), config.aliases().size());
        return new RelayRuntime(
            router,
            adapters,
            new RetryPolicy(config.retry().toSchedule()),
            metrics,
            toSettings(config.agent()),
            httpClient,
            bedrock,
            AgentLoop.newTurnExecutor()
        );
    }

    public AgentLoop newAgentLoop(ToolExecutor tools) {
        return newAgentLoop(tools, settings);
    }

    /** Loops built here share the runtime's turn pool, which {@link #close()} shuts down. */
    public AgentLoop newAgentLoop(ToolExecutor tools, AgentSettings agentSettings) {
        return new AgentLoop(router, adapters, tools, metrics, retryPolicy, agentSettings, turnExecutor);
    }

    public ProviderRouter router() {
        return router;
    }

    public AdapterRegistry adapters() {
        return adapters;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public BufferedMetricsEmitter metrics() {
        return metrics;
    }

    public AgentSettings settings() {
        return settings;
    }

    ExecutorService turnExecutor() {
        return turnExecutor;
    }

    @Override
    public void close() {
        turnExecutor.shutdown();
        metrics.close();
        bedrock.close();
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    static ProviderProfile toProfile(ProviderConfig provider) {
        ApiShape api = ApiShape.fromId(provider.api());
        ApiShape fallback = provider.fallbackApi() == null || provider.fallbackApi().isBlank()
            ? null
            : ApiShape.fromId(provider.fallbackApi());
        return new ProviderProfile(
            provider.name(),
            ProviderKind.fromId(provider.kind()),
            api,
            fallback,
            provider.baseUrl(),
            provider.apiKey(),
            provider.weightOrDefault(),
            provider.model(),
            provider.region(),
            provider.awsProfile(),
            provider.headers(),
            provider.maxTokens()
        );
    }

    static AgentSettings toSettings(AgentConfig agent) {
        return new AgentSettings(
            agent.systemPrompt(),
            agent.provider(),
            agent.model(),
            agent.maxToolIterations(),
            ReasoningEffort.fromId(agent.reasoning()),
            agent.maxTokens()
        );
    }

    private static MetricsSink metricsSink(String rawPath) {
        Path path = ConfigPaths.resolve(rawPath);
        return path == null ? new LoggingMetricsSink() : new JsonlMetricsSink(path);
    }
}
