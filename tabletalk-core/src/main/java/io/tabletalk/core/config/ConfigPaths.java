package io.tabletalk.core.config;

import java.nio.file.Path;

public final class ConfigPaths {
    public static final String CONFIG_ENV = "TABLETALK_CONFIG";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return configPath(System.getenv(CONFIG_ENV));
    }

    static Path configPath(String override) {
        if (override != null && !override.isBlank()) {
            return expandHome(override.trim());
        }
        return home().resolve("config.json");
    }

    public static Path resolveWorkspace(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return home().resolve("workspace");
        }
        return expandHome(rawPath.trim());
    }

    private static Path home() {
        return Path.of(System.getProperty("user.home"), ".tabletalk");
    }

    private static Path expandHome(String rawPath) {
        Path userHome = Path.of(System.getProperty("user.home"));
        if (rawPath.equals("~")) {
            return userHome;
        }
        if (rawPath.startsWith("~/")) {
            return userHome.resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
