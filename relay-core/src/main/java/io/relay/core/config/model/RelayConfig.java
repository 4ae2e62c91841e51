package io.relay.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RelayConfig(
    List<ProviderConfig> providers,
    Map<String, String> aliases,
    Map<String, String> env,
    AgentConfig agent,
    RetryConfig retry,
    TimeoutConfig timeouts,
    MetricsConfig metrics
) {

    public RelayConfig {
        providers = providers == null ? List.of() : List.copyOf(providers);
        aliases = aliases == null ? Map.of() : Map.copyOf(aliases);
        env = env == null ? Map.of() : Map.copyOf(env);
        agent = agent == null ? AgentConfig.defaults() : agent;
        retry = retry == null ? RetryConfig.defaults() : retry;
        timeouts = timeouts == null ? TimeoutConfig.defaults() : timeouts;
        metrics = metrics == null ? MetricsConfig.defaults() : metrics;
    }

    public static RelayConfig defaults() {
        return new RelayConfig(
            List.of(
                ProviderConfig.of("openai", "openai-responses", "$OPENAI_API_KEY", "gpt-4.1"),
                ProviderConfig.of("anthropic", "anthropic-messages", "$ANTHROPIC_API_KEY", "claude-sonnet-4-5")
            ),
            Map.of("fast", "openai/gpt-4.1-mini"),
            Map.of(),
            AgentConfig.defaults(),
            RetryConfig.defaults(),
            TimeoutConfig.defaults(),
            MetricsConfig.defaults()
        );
    }
}
