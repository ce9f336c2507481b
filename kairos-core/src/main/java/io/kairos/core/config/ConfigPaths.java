package io.kairos.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path home() {
        return Path.of(System.getProperty("user.home"), ".kairos");
    }

    public static Path defaultConfigPath() {
        return home().resolve("config.json");
    }

    public static Path resolveWorkspace(String rawPath) {
        return resolve(rawPath, home().resolve("workspace"));
    }

    public static Path resolveStorePath(String rawPath) {
        return resolve(rawPath, home().resolve("cron").resolve("jobs.json"));
    }

    static Path resolve(String rawPath, Path fallback) {
        if (rawPath == null || rawPath.isBlank()) {
            return fallback;
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
