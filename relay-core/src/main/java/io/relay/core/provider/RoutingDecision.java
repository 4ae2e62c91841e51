package io.relay.core.provider;

import java.util.Objects;

public record RoutingDecision(ProviderProfile profile, ApiShape api, String model, String credential, boolean fallbackHop) {

    public RoutingDecision {
        Objects.requireNonNull(profile, "profile must not be null");
        Objects.requireNonNull(api, "api must not be null");
        Objects.requireNonNull(model, "model must not be null");
        credential = credential == null ? "" : credential;
    }

    public String baseUrl() {
        return profile.baseUrl();
    }

    @Override
    public String toString() {
        return "RoutingDecision[provider=" + profile.name() + ", api=" + api + ", model=" + model
            + ", fallbackHop=" + fallbackHop + "]";
    }
}
