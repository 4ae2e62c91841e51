package io.relay.core.provider;

import io.relay.core.error.RelayException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public record ProviderProfile(
    String name,
    ProviderKind kind,
    ApiShape api,
    ApiShape fallbackApi,
    String baseUrl,
    String credentialRef,
    int weight,
    String model,
    String region,
    String awsProfile,
    Map<String, String> headers,
    Integer maxTokens
) {
    public static final int MAX_WEIGHT = 100;

    public ProviderProfile {
        if (name == null || name.isBlank()) {
            throw RelayException.config("provider name must not be blank");
        }
        name = name.trim();
        kind = kind == null ? ProviderKind.CHAT : kind;
        Objects.requireNonNull(api, "api must not be null");
        if (fallbackApi == api) {
            fallbackApi = null;
        }
        if (weight < 0 || weight >= MAX_WEIGHT) {
            throw RelayException.config(
                "Provider " + name + " has weight " + weight + "; expected 0 <= weight < " + MAX_WEIGHT
            );
        }
        baseUrl = baseUrl == null || baseUrl.isBlank() ? api.defaultBaseUrl() : baseUrl.trim();
        credentialRef = credentialRef == null ? "" : credentialRef.trim();
        model = model == null ? "" : model.trim();
        region = region == null ? "" : region.trim();
        awsProfile = awsProfile == null ? "" : awsProfile.trim();
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        maxTokens = maxTokens == null || maxTokens <= 0 ? null : maxTokens;
    }

    public static ProviderProfile chat(String name, ApiShape api, String baseUrl, String credentialRef, int weight) {
        return new ProviderProfile(name, ProviderKind.CHAT, api, null, baseUrl, credentialRef, weight, "", "", "", Map.of(), null);
    }

    public boolean routable() {
        return kind == ProviderKind.CHAT;
    }

    public Optional<ApiShape> configuredFallback() {
        return Optional.ofNullable(fallbackApi);
    }

    public ProviderProfile withModel(String defaultModel) {
        return new ProviderProfile(name, kind, api, fallbackApi, baseUrl, credentialRef, weight, defaultModel, region, awsProfile, headers, maxTokens);
    }

    public ProviderProfile withFallbackApi(ApiShape fallback) {
        return new ProviderProfile(name, kind, api, fallback, baseUrl, credentialRef, weight, model, region, awsProfile, headers, maxTokens);
    }
}
