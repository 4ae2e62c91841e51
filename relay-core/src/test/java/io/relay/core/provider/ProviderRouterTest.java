package io.relay.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.relay.core.error.ErrorKind;
import io.relay.core.error.RelayException;
import io.relay.core.policy.FallbackTable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class ProviderRouterTest {

    private final CredentialResolver credentials = new CredentialResolver(
        Map.of("OPENAI_KEY", "sk-openai", "ANTHROPIC_KEY", "sk-ant"),
        name -> null
    );

    @Test
    void shouldSplitWildcardTrafficByWeight() {
        ProviderRouter router = new ProviderRouter(
            List.of(
                profile("a", ApiShape.OPENAI_COMPLETIONS, 70),
                profile("b", ApiShape.OPENAI_COMPLETIONS, 30)
            ),
            Map.of(),
            credentials,
            new WeightedSelector(new Random(42)),
            FallbackTable.defaults()
        );

        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < 10_000; i++) {
            counts.merge(router.route("*", "gpt-4.1").profile().name(), 1, Integer::sum);
        }

        assertThat(counts.get("a") / 10_000.0).isBetween(0.65, 0.75);
        assertThat(counts.get("b") / 10_000.0).isBetween(0.25, 0.35);
    }

    @Test
    void shouldNeverSelectZeroWeightOrEmbeddingProfiles() {
        ProviderProfile embedding = new ProviderProfile("embed", ProviderKind.EMBEDDING, ApiShape.OPENAI_COMPLETIONS,
            null, null, "$OPENAI_KEY", 50, "text-embedding-3-small", "", "", Map.of(), null);
        ProviderRouter router = new ProviderRouter(
            List.of(profile("a", ApiShape.OPENAI_COMPLETIONS, 1), profile("zero", ApiShape.OPENAI_COMPLETIONS, 0), embedding),
            Map.of(),
            credentials
        );

        for (int i = 0; i < 1_000; i++) {
            assertThat(router.route("*", "gpt-4.1").profile().name()).isEqualTo("a");
        }
        assertThat(router.chatProfiles()).extracting(ProviderProfile::name).containsExactly("a", "zero");
    }

    @Test
    void shouldRejectChatRequestForEmbeddingProfile() {
        ProviderProfile embedding = new ProviderProfile("embed", ProviderKind.EMBEDDING, ApiShape.OPENAI_COMPLETIONS,
            null, null, "$OPENAI_KEY", 1, "text-embedding-3-small", "", "", Map.of(), null);
        ProviderRouter router = new ProviderRouter(List.of(embedding), Map.of(), credentials);

        assertThatThrownBy(() -> router.route("embed", ""))
            .isInstanceOf(RelayException.class)
            .hasMessageContaining("does not accept chat requests");
    }

    @Test
    void shouldRejectWildcardWhenAllWeightsAreZero() {
        ProviderRouter router = new ProviderRouter(
            List.of(profile("zero", ApiShape.OPENAI_COMPLETIONS, 0)), Map.of(), credentials);

        assertThatThrownBy(() -> router.route("*", "gpt-4.1"))
            .isInstanceOfSatisfying(RelayException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.CONFIG_ERROR));
    }

    @Test
    void shouldResolveAliasAndProviderModelTargets() {
        ProviderRouter router = new ProviderRouter(
            List.of(profile("openai", ApiShape.OPENAI_RESPONSES, 1), anthropic()),
            Map.of("fast", "openai/gpt-4.1-mini", "smart", "anthropic"),
            credentials
        );

        RoutingDecision fast = router.route("fast", "");
        assertThat(fast.profile().name()).isEqualTo("openai");
        assertThat(fast.model()).isEqualTo("gpt-4.1-mini");
        assertThat(fast.credential()).isEqualTo("sk-openai");

        RoutingDecision smart = router.route("smart", "");
        assertThat(smart.api()).isEqualTo(ApiShape.ANTHROPIC_MESSAGES);
        assertThat(smart.model()).isEqualTo("claude-sonnet-4-5");

        RoutingDecision explicit = router.route("anthropic/claude-opus-4-1", "");
        assertThat(explicit.model()).isEqualTo("claude-opus-4-1");
    }

    @Test
    void shouldInferProviderFromModelName() {
        ProviderRouter router = new ProviderRouter(
            List.of(profile("openai", ApiShape.OPENAI_RESPONSES, 1), anthropic(),
                profile("gemini", ApiShape.GOOGLE_GENERATIVE_AI, 1)), Map.of(), credentials);

        assertThat(router.route("", "claude-3-7-sonnet").profile().name()).isEqualTo("anthropic");
        assertThat(router.route("", "gemini-2.5-flash").api()).isEqualTo(ApiShape.GOOGLE_GENERATIVE_AI);
        assertThat(router.route(null, "gpt-4o").profile().name()).isEqualTo("openai");
        assertThatThrownBy(() -> router.route("", "mistral-large"))
            .isInstanceOf(RelayException.class)
            .hasMessageContaining("Cannot infer a provider");
    }

    @Test
    void shouldFailWithConfigErrorWhenCredentialVariableIsMissing() {
        ProviderProfile profile = ProviderProfile.chat("x", ApiShape.OPENAI_COMPLETIONS, null, "$MISSING_KEY", 1)
            .withModel("gpt-4.1");
        ProviderRouter router = new ProviderRouter(List.of(profile), Map.of(), credentials);

        assertThatThrownBy(() -> router.route("x", ""))
            .isInstanceOfSatisfying(RelayException.class, e -> {
                assertThat(e.kind()).isEqualTo(ErrorKind.CONFIG_ERROR);
                assertThat(e.getMessage()).contains("MISSING_KEY").doesNotContain("sk-");
            });
        assertThat(router.credentialResolves(profile)).isFalse();
    }

    @Test
    void shouldRejectUnknownProviderAndDuplicates() {
        ProviderRouter router = new ProviderRouter(List.of(anthropic()), Map.of(), credentials);

        assertThatThrownBy(() -> router.route("nope", "m")).hasMessage("Unknown provider: nope");
        assertThatThrownBy(() -> new ProviderRouter(List.of(anthropic(), anthropic()), Map.of(), credentials))
            .isInstanceOf(RelayException.class)
            .hasMessageContaining("Duplicate provider name");
    }

    @Test
    void shouldRejectOutOfRangeWeights() {
        assertThatThrownBy(() -> profile("heavy", ApiShape.OPENAI_COMPLETIONS, 100))
            .isInstanceOfSatisfying(RelayException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.CONFIG_ERROR));
        assertThatThrownBy(() -> profile("negative", ApiShape.OPENAI_COMPLETIONS, -1))
            .isInstanceOf(RelayException.class);
    }

    @Test
    void shouldOfferOneFallbackHopFromResponsesToCompletions() {
        ProviderRouter router = new ProviderRouter(
            List.of(profile("openai", ApiShape.OPENAI_RESPONSES, 1)), Map.of(), credentials);

        RoutingDecision primary = router.route("openai", "gpt-4.1");
        assertThat(router.hasFallback(primary)).isTrue();

        RoutingDecision fallback = router.fallback(primary).orElseThrow();
        assertThat(fallback.api()).isEqualTo(ApiShape.OPENAI_COMPLETIONS);
        assertThat(fallback.fallbackHop()).isTrue();
        assertThat(fallback.model()).isEqualTo("gpt-4.1");
        assertThat(router.hasFallback(fallback)).isFalse();
        assertThat(router.fallback(fallback)).isEmpty();
    }

    @Test
    void shouldNotOfferFallbackForShapesWithoutOne() {
        ProviderRouter router = new ProviderRouter(List.of(anthropic()), Map.of(), credentials);

        assertThat(router.hasFallback(router.route("anthropic", ""))).isFalse();
    }

    @Test
    void shouldRedactCredentialInDecisionToString() {
        ProviderRouter router = new ProviderRouter(List.of(anthropic()), Map.of(), credentials);

        assertThat(router.route("anthropic", "").toString()).doesNotContain("sk-ant");
    }

    private ProviderProfile profile(String name, ApiShape api, int weight) {
        return ProviderProfile.chat(name, api, null, "$OPENAI_KEY", weight);
    }

    private ProviderProfile anthropic() {
        return ProviderProfile.chat("anthropic", ApiShape.ANTHROPIC_MESSAGES, null, "${ANTHROPIC_KEY}", 1)
            .withModel("claude-sonnet-4-5");
    }
}
