package io.relay.core.provider;

import io.relay.core.error.RelayException;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Resolves credential references. A reference of the form {@code $NAME} or {@code ${NAME}} is looked up
 * in the local overlay first and then in the process environment; anything else is a literal value.
 */
public final class CredentialResolver {
    private static final String MARKER = "$";

    private final Map<String, String> overlay;
    private final Function<String, String> environment;

    public CredentialResolver(Map<String, String> overlay) {
        this(overlay, System::getenv);
    }

    public CredentialResolver(Map<String, String> overlay, Function<String, String> environment) {
        this.overlay = overlay == null ? Map.of() : Map.copyOf(overlay);
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    public static boolean isIndirect(String reference) {
        return reference != null && reference.trim().startsWith(MARKER);
    }

    public String resolve(String reference, String providerName) {
        if (reference == null || reference.isBlank()) {
            return "";
        }
        String trimmed = reference.trim();
        if (!isIndirect(trimmed)) {
            return trimmed;
        }
        String variable = variableName(trimmed);
        if (variable.isEmpty()) {
            throw RelayException.config("Provider " + providerName + " has an empty credential reference");
        }
        String fromOverlay = overlay.get(variable);
        if (fromOverlay != null && !fromOverlay.isBlank()) {
            return fromOverlay.trim();
        }
        String fromEnvironment = environment.apply(variable);
        if (fromEnvironment != null && !fromEnvironment.isBlank()) {
            return fromEnvironment.trim();
        }
        throw RelayException.config(
            "Credential variable " + variable + " for provider " + providerName + " is not set"
        );
    }

    private String variableName(String reference) {
        String name = reference.substring(MARKER.length());
        if (name.startsWith("{") && name.endsWith("}")) {
            name = name.substring(1, name.length() - 1);
        }
        return name.trim();
    }
}
