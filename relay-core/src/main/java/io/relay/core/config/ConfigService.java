package io.relay.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.relay.core.config.model.RelayConfig;
import io.relay.core.error.ErrorKind;
import io.relay.core.error.ProviderError;
import io.relay.core.error.RelayException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and writes the JSON configuration. Keys missing from the file fall back to {@link RelayConfig#defaults()};
 * arrays in the file replace the default arrays as a whole.
 */
public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    }

    public RelayConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return RelayConfig.defaults();
        }
        return parse(Files.readString(configPath));
    }

    /** @throws RelayException with a config error when the document is not valid configuration JSON */
    public RelayConfig parse(String json) {
        try {
            JsonNode defaultsNode = mapper.valueToTree(RelayConfig.defaults());
            JsonNode existingNode = mapper.readTree(json);
            JsonNode merged = deepMerge(defaultsNode, existingNode);
            return mapper.treeToValue(merged, RelayConfig.class);
        } catch (JsonProcessingException e) {
            throw new RelayException(
                ProviderError.of(ErrorKind.CONFIG_ERROR,
                    "Invalid configuration: " + e.getOriginalMessage()),
                e
            );
        }
    }

    public void save(Path configPath, RelayConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (configPath.getParent() != null) {
            Files.createDirectories(configPath.getParent());
        }
        Files.writeString(configPath, toPrettyJson(config) + System.lineSeparator());
    }

    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        RelayConfig config;
        if (created || overwrite) {
            config = RelayConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);
        return new InitResult(configPath, created, overwritten);
    }

    public String toPrettyJson(RelayConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null || override.isNull() || override.isMissingNode()) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
