package io.relay.core.provider;

import io.relay.core.error.RelayException;
import io.relay.core.policy.FallbackTable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ProviderRouter {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderRouter.class);
    public static final String WILDCARD = "*";

    private final Map<String, ProviderProfile> profiles = new LinkedHashMap<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();
    private final CredentialResolver credentials;
    private final WeightedSelector selector;
    private final FallbackTable fallbacks;

    public ProviderRouter(List<ProviderProfile> profiles, Map<String, String> aliases, CredentialResolver credentials) {
        this(profiles, aliases, credentials, new WeightedSelector(), FallbackTable.defaults());
    }

    public ProviderRouter(
        List<ProviderProfile> profiles,
        Map<String, String> aliases,
        CredentialResolver credentials,
        WeightedSelector selector,
        FallbackTable fallbacks
    ) {
        Objects.requireNonNull(profiles, "profiles must not be null");
        for (ProviderProfile profile : profiles) {
            if (this.profiles.putIfAbsent(normalize(profile.name()), profile) != null) {
                throw RelayException.config("Duplicate provider name: " + profile.name());
            }
        }
        if (aliases != null) {
            aliases.forEach((alias, target) -> this.aliases.put(normalize(alias), target == null ? "" : target.trim()));
        }
        this.credentials = Objects.requireNonNull(credentials, "credentials must not be null");
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.fallbacks = Objects.requireNonNull(fallbacks, "fallbacks must not be null");
    }

    /**
     * Resolves a target to a concrete profile. The target may be a provider name, an alias,
     * {@code provider/model}, or {@link #WILDCARD}; a blank target infers the provider from the model.
     */
    public RoutingDecision route(String target, String model) {
        String requested = target == null ? "" : target.trim();
        String requestedModel = model == null ? "" : model.trim();

        String aliased = aliases.get(normalize(requested));
        if (aliased != null) {
            Target resolved = split(aliased);
            requested = resolved.provider();
            requestedModel = requestedModel.isEmpty() ? resolved.model() : requestedModel;
        }

        ProviderProfile profile;
        if (requested.isEmpty()) {
            if (requestedModel.isEmpty()) {
                throw RelayException.config("No provider or model was requested");
            }
            profile = inferFromModel(requestedModel);
        } else if (WILDCARD.equals(requested)) {
            profile = selector.select(chatProfiles());
        } else {
            ProviderProfile exact = profiles.get(normalize(requested));
            if (exact != null) {
                profile = exact;
            } else {
                Target explicit = split(requested);
                profile = profiles.get(normalize(explicit.provider()));
                if (profile == null) {
                    throw RelayException.config("Unknown provider: " + requested);
                }
                requestedModel = requestedModel.isEmpty() ? explicit.model() : requestedModel;
            }
        }

        if (!profile.routable()) {
            throw RelayException.config(
                "Provider " + profile.name() + " has kind " + profile.kind().name().toLowerCase(Locale.ROOT)
                    + " and does not accept chat requests"
            );
        }
        RoutingDecision decision = decide(profile, profile.api(), requestedModel, false);
        LOG.debug("Routed {} to {}", target, decision);
        return decision;
    }

    public boolean hasFallback(RoutingDecision decision) {
        return !decision.fallbackHop()
            && fallbacks.fallbackFor(decision.profile()).filter(api -> api != decision.api()).isPresent();
    }

    /**
     * Decision for the designated fallback shape of the same provider, or empty when the hop was already used
     * or no fallback shape exists.
     */
    public Optional<RoutingDecision> fallback(RoutingDecision failed) {
        if (!hasFallback(failed)) {
            return Optional.empty();
        }
        ApiShape api = fallbacks.fallbackFor(failed.profile()).orElseThrow();
        return Optional.of(decide(failed.profile(), api, failed.model(), true));
    }

    /**
     * Fresh decision for the same profile and shape, with the credential resolved again.
     */
    public RoutingDecision refresh(RoutingDecision previous) {
        return decide(previous.profile(), previous.api(), previous.model(), previous.fallbackHop());
    }

    public List<ProviderProfile> profiles() {
        return List.copyOf(profiles.values());
    }

    public List<ProviderProfile> chatProfiles() {
        return profiles.values().stream().filter(ProviderProfile::routable).toList();
    }

    public Optional<ProviderProfile> find(String name) {
        return Optional.ofNullable(profiles.get(normalize(name)));
    }

    public boolean credentialResolves(ProviderProfile profile) {
        try {
            String credential = credentials.resolve(profile.credentialRef(), profile.name());
            return !credential.isBlank() || !profile.api().requiresCredential();
        } catch (RelayException e) {
            return false;
        }
    }

    private RoutingDecision decide(ProviderProfile profile, ApiShape api, String model, boolean fallbackHop) {
        String effectiveModel = model == null || model.isBlank() ? profile.model() : model;
        if (effectiveModel.isBlank()) {
            throw RelayException.config("No model configured or requested for provider " + profile.name());
        }
        String credential = credentials.resolve(profile.credentialRef(), profile.name());
        if (credential.isBlank() && api.requiresCredential()) {
            throw RelayException.config("Provider " + profile.name() + " has no credential configured");
        }
        return new RoutingDecision(profile, api, effectiveModel, credential, fallbackHop);
    }

    private ProviderProfile inferFromModel(String model) {
        String normalized = model.toLowerCase(Locale.ROOT);
        List<ApiShape> preferred = new ArrayList<>();
        if (normalized.startsWith("bedrock/") || normalized.startsWith("anthropic.")
            || normalized.startsWith("amazon.") || normalized.startsWith("meta.")) {
            preferred.add(ApiShape.BEDROCK_CONVERSE_STREAM);
        } else if (normalized.contains("claude")) {
            preferred.add(ApiShape.ANTHROPIC_MESSAGES);
        } else if (normalized.contains("gpt") || normalized.contains("codex") || normalized.matches("^o[0-9].*")) {
            preferred.add(ApiShape.OPENAI_RESPONSES);
            preferred.add(ApiShape.OPENAI_COMPLETIONS);
        } else if (normalized.contains("gemini")) {
            preferred.add(ApiShape.GOOGLE_GENERATIVE_AI);
        }

        List<ProviderProfile> chat = chatProfiles();
        for (ApiShape api : preferred) {
            for (ProviderProfile profile : chat) {
                if (profile.api() == api) {
                    return profile;
                }
            }
        }
        if (chat.size() == 1) {
            return chat.get(0);
        }
        throw RelayException.config("Cannot infer a provider for model " + model + "; name a provider explicitly");
    }

    private Target split(String raw) {
        String value = raw == null ? "" : raw.trim();
        int slash = value.indexOf('/');
        if (slash < 0) {
            return new Target(value, "");
        }
        return new Target(value.substring(0, slash).trim(), value.substring(slash + 1).trim());
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }

    private record Target(String provider, String model) {
    }
}
