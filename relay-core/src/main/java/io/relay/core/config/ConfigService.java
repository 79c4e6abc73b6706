package io.relay.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.relay.core.config.model.RelayConfig;
import io.relay.core.config.model.StoreConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public RelayConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return RelayConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(RelayConfig.defaults());
        JsonNode existingNode = camelCaseKeys(mapper.readTree(Files.readString(configPath)));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return validate(mapper.treeToValue(merged, RelayConfig.class));
    }

    /**
     * Rejects values the runtime cannot work with. Returns the config unchanged when it is valid.
     */
    public static RelayConfig validate(RelayConfig config) {
        List<String> problems = new ArrayList<>();
        String storeType = normalized(config.store().type());
        if (!storeType.equals("file") && !storeType.equals("sqlite")) {
            problems.add("store.type must be file or sqlite, got '" + config.store().type() + "'");
        }
        String claudeMode = normalized(config.backends().claude().mode());
        if (!claudeMode.equals("cli") && !claudeMode.equals("bridge")) {
            problems.add("backends.claude.mode must be cli or bridge, got '" + config.backends().claude().mode() + "'");
        }
        if (config.backends().research().timeoutSeconds() <= 0) {
            problems.add("backends.research.timeoutSeconds must be positive");
        }
        if (config.permissions().timeoutSeconds() <= 0) {
            problems.add("permissions.timeoutSeconds must be positive");
        }
        if (config.sessions().maxAgeDays() <= 0) {
            problems.add("sessions.maxAgeDays must be positive");
        }
        int port = config.gateway().port();
        if (port < 1 || port > 65535) {
            problems.add("gateway.port must be between 1 and 65535, got " + port);
        }
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid config: " + String.join("; ", problems));
        }
        return config;
    }

    public void save(Path configPath, RelayConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
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

        Path storePath = storeDirectory(config.store());
        Files.createDirectories(storePath);
        return new OnboardResult(configPath, storePath, created, overwritten);
    }

    public String toPrettyJson(RelayConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    public static Path storeDirectory(StoreConfig store) {
        Path fallback = ConfigPaths.relayHome().resolve("sessions");
        if (store.sqlite()) {
            Path db = ConfigPaths.resolve(store.sqlitePath(), ConfigPaths.relayHome().resolve("relay.db"));
            return db.toAbsolutePath().getParent();
        }
        return ConfigPaths.resolve(store.directory(), fallback);
    }

    private static String normalized(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    // normalize snake_case so user keys override the camelCase defaults
    private static JsonNode camelCaseKeys(JsonNode node) {
        if (!node.isObject()) {
            return node;
        }
        ObjectNode renamed = ((ObjectNode) node).objectNode();
        for (Map.Entry<String, JsonNode> entry : (Iterable<Map.Entry<String, JsonNode>>) node::fields) {
            renamed.set(camelCase(entry.getKey()), camelCaseKeys(entry.getValue()));
        }
        return renamed;
    }

    static String camelCase(String key) {
        if (key.indexOf('_') < 0) {
            return key;
        }
        StringBuilder out = new StringBuilder(key.length());
        boolean upper = false;
        for (char c : key.toCharArray()) {
            if (c == '_') {
                upper = out.length() > 0;
            } else {
                out.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return out.toString();
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
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
