package io.relay.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.relay.core.config.model.ProviderConfig;
import io.relay.core.config.model.RelayConfig;
import io.relay.core.error.ErrorKind;
import io.relay.core.error.RelayException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    private final ConfigService service = new ConfigService();

    @Test
    void shouldReturnDefaultsWhenFileIsMissing() throws IOException {
        RelayConfig config = service.load(tempDir.resolve("missing.json"));

        assertThat(config).isEqualTo(RelayConfig.defaults());
        assertThat(config.providers()).extracting(ProviderConfig::name).containsExactly("openai", "anthropic");
    }

    @Test
    void shouldMergePartialConfigOverDefaults() {
        RelayConfig config = service.parse("""
            {
              "retry": {"max_attempts": 6, "initial_backoff": "PT0.5S"},
              "aliases": {"smart": "anthropic/claude-opus-4-1"},
              "agent": {"provider": "anthropic", "max_tool_iterations": 5},
              "unknown_section": {"ignored": true}
            }
            """);

        assertThat(config.retry().maxAttempts()).isEqualTo(6);
        assertThat(config.retry().initialBackoff()).isEqualTo(Duration.ofMillis(500));
        assertThat(config.retry().maxBackoff()).isEqualTo(Duration.ofSeconds(2));
        assertThat(config.aliases())
            .containsEntry("fast", "openai/gpt-4.1-mini")
            .containsEntry("smart", "anthropic/claude-opus-4-1");
        assertThat(config.agent().provider()).isEqualTo("anthropic");
        assertThat(config.agent().maxToolIterations()).isEqualTo(5);
        assertThat(config.agent().systemPrompt()).isEqualTo(RelayConfig.defaults().agent().systemPrompt());
        assertThat(config.providers()).hasSize(2);
        assertThat(config.timeouts().read()).isEqualTo(Duration.ofSeconds(90));
    }

    @Test
    void shouldReplaceProviderListAsAWhole() {
        RelayConfig config = service.parse("""
            {
              "providers": [
                {
                  "name": "local",
                  "api": "openai-completions",
                  "base_url": "http://localhost:8080/v1",
                  "api_key": "none",
                  "model": "llama-3.1-8b",
                  "weight": 10,
                  "headers": {"X-Team": "infra"}
                },
                {"name": "claude", "api": "anthropic-messages", "apiKey": "$ANTHROPIC_API_KEY", "maxTokens": 2048}
              ]
            }
            """);

        assertThat(config.providers()).hasSize(2);
        ProviderConfig local = config.providers().get(0);
        assertThat(local.baseUrl()).isEqualTo("http://localhost:8080/v1");
        assertThat(local.weightOrDefault()).isEqualTo(10);
        assertThat(local.headers()).containsEntry("X-Team", "infra");
        ProviderConfig claude = config.providers().get(1);
        assertThat(claude.apiKey()).isEqualTo("$ANTHROPIC_API_KEY");
        assertThat(claude.maxTokens()).isEqualTo(2048);
        assertThat(claude.weightOrDefault()).isEqualTo(1);
    }

    @Test
    void shouldRejectInvalidJsonAsConfigError() {
        assertThatThrownBy(() -> service.parse("{\"providers\": ["))
            .isInstanceOfSatisfying(RelayException.class,
                error -> assertThat(error.kind()).isEqualTo(ErrorKind.CONFIG_ERROR))
            .hasMessageContaining("Invalid configuration");
    }

    @Test
    void shouldRoundTripSavedConfig() throws IOException {
        Path path = tempDir.resolve("nested/config.json");
        RelayConfig config = service.parse("{\"env\": {\"OPENAI_API_KEY\": \"sk-local\"}}");

        service.save(path, config);

        assertThat(Files.readString(path)).contains("\"initial_backoff\" : \"PT0.2S\"");
        assertThat(service.load(path)).isEqualTo(config);
    }

    @Test
    void shouldCreateThenPreserveThenOverwriteOnInit() throws IOException {
        Path path = tempDir.resolve("config.json");

        InitResult created = service.init(path, false);
        assertThat(created.createdConfig()).isTrue();
        assertThat(created.overwrittenConfig()).isFalse();

        Files.writeString(path, "{\"agent\": {\"provider\": \"anthropic\"}}");
        InitResult preserved = service.init(path, false);
        assertThat(preserved.createdConfig()).isFalse();
        assertThat(service.load(path).agent().provider()).isEqualTo("anthropic");

        InitResult overwritten = service.init(path, true);
        assertThat(overwritten.overwrittenConfig()).isTrue();
        assertThat(service.load(path).agent().provider()).isEqualTo("*");
    }
}
