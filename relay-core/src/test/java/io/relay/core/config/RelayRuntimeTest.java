package io.relay.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.relay.core.agent.AgentLoop;
import io.relay.core.config.model.ProviderConfig;
import io.relay.core.config.model.RelayConfig;
import io.relay.core.error.ErrorKind;
import io.relay.core.error.RelayException;
import io.relay.core.provider.ApiShape;
import io.relay.core.provider.ProviderProfile;
import io.relay.core.provider.RoutingDecision;
import io.relay.core.tool.ToolRegistry;
import io.relay.core.tool.RegistryToolExecutor;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RelayRuntimeTest {

    private final ConfigService configService = new ConfigService();

    @Test
    void shouldBuildProfilesFromProviderConfig() {
        ProviderConfig config = new ProviderConfig("gateway", "chat", "openai-responses", "openai_completions",
            "https://llm.internal/v1", "$GATEWAY_KEY", "gpt-4.1", 40, null, null, Map.of("X-Team", "infra"), 4096);

        ProviderProfile profile = RelayRuntime.toProfile(config);

        assertThat(profile.api()).isEqualTo(ApiShape.OPENAI_RESPONSES);
        assertThat(profile.fallbackApi()).isEqualTo(ApiShape.OPENAI_COMPLETIONS);
        assertThat(profile.weight()).isEqualTo(40);
        assertThat(profile.headers()).containsEntry("X-Team", "infra");
        assertThat(profile.maxTokens()).isEqualTo(4096);
    }

    @Test
    void shouldResolveCredentialsFromEnvOverlay() {
        RelayConfig config = configService.parse("""
            {
              "providers": [{"name": "local", "api": "openai-completions", "api_key": "$LOCAL_KEY", "model": "m"}],
              "env": {"LOCAL_KEY": "sk-overlay"},
              "agent": {"provider": "local"}
            }
            """);

        try (RelayRuntime runtime = RelayRuntime.create(config)) {
            RoutingDecision decision = runtime.router().route("local", "");

            assertThat(decision.credential()).isEqualTo("sk-overlay");
            assertThat(decision.model()).isEqualTo("m");
            assertThat(runtime.adapters().find(ApiShape.BEDROCK_CONVERSE_STREAM)).isPresent();
            assertThat(runtime.settings().provider()).isEqualTo("local");
            AgentLoop loop = runtime.newAgentLoop(new RegistryToolExecutor(new ToolRegistry()));
            assertThat(loop.settings().maxToolIterations()).isEqualTo(20);
        }
    }

    @Test
    void shouldShutDownSharedTurnPoolOnClose() {
        RelayConfig config = withProviders(ProviderConfig.of("local", "openai-completions", "sk", "m"));
        RelayRuntime runtime = RelayRuntime.create(config);
        runtime.newAgentLoop(new RegistryToolExecutor(new ToolRegistry()));
        runtime.newAgentLoop(new RegistryToolExecutor(new ToolRegistry()));

        assertThat(runtime.turnExecutor().isShutdown()).isFalse();
        assertThat(runtime.adapters().find(ApiShape.GOOGLE_GENERATIVE_AI)).isPresent();

        runtime.close();

        assertThat(runtime.turnExecutor().isShutdown()).isTrue();
    }

    @Test
    void shouldRejectUnknownApiShape() {
        RelayConfig config = withProviders(ProviderConfig.of("bad", "openai-chat", "sk", "m"));

        assertConfigError(config, "Unknown api shape");
    }

    @Test
    void shouldRejectWeightOutsideRange() {
        ProviderConfig heavy = new ProviderConfig("heavy", null, "openai-completions", null, null, "sk", "m", 100,
            null, null, null, null);

        assertConfigError(withProviders(heavy), "weight 100");
    }

    @Test
    void shouldRejectDuplicateProviderNames() {
        RelayConfig config = withProviders(
            ProviderConfig.of("twin", "openai-completions", "sk", "m"),
            ProviderConfig.of("Twin", "anthropic-messages", "sk", "m")
        );

        assertConfigError(config, "Duplicate provider name");
    }

    private static RelayConfig withProviders(ProviderConfig... providers) {
        RelayConfig defaults = RelayConfig.defaults();
        return new RelayConfig(List.of(providers), Map.of(), Map.of(), defaults.agent(), defaults.retry(),
            defaults.timeouts(), defaults.metrics());
    }

    private static void assertConfigError(RelayConfig config, String message) {
        assertThatThrownBy(() -> RelayRuntime.create(config))
            .isInstanceOfSatisfying(RelayException.class,
                error -> assertThat(error.kind()).isEqualTo(ErrorKind.CONFIG_ERROR))
            .hasMessageContaining(message);
    }
}
