package io.relay.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path relayHome() {
        return Path.of(System.getProperty("user.home"), ".relay");
    }

    public static Path defaultConfigPath() {
        return relayHome().resolve("config.json");
    }

    public static Path resolve(String rawPath, Path fallback) {
        if (rawPath == null || rawPath.isBlank()) {
            return fallback;
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
