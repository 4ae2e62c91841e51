package io.relay.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ProviderConfig(
    String name,
    String kind,
    String api,
    @JsonProperty("fallback_api") @JsonAlias({"fallbackApi"}) String fallbackApi,
    @JsonProperty("base_url") @JsonAlias({"baseUrl", "api_base"}) String baseUrl,
    @JsonProperty("api_key") @JsonAlias({"apiKey"}) String apiKey,
    String model,
    Integer weight,
    String region,
    @JsonProperty("aws_profile") @JsonAlias({"awsProfile", "profile"}) String awsProfile,
    @JsonAlias({"extra_headers"}) Map<String, String> headers,
    @JsonProperty("max_tokens") @JsonAlias({"maxTokens"}) Integer maxTokens
) {

    public static ProviderConfig of(String name, String api, String apiKey, String model) {
        return new ProviderConfig(name, "chat", api, null, null, apiKey, model, 1, null, null, Map.of(), null);
    }

    public int weightOrDefault() {
        return weight == null ? 1 : weight;
    }
}
