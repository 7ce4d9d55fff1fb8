package io.instancegate.config;

import io.instancegate.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public record GatewaySettings(
        String persistRoot,
        String bindHost,
        int port,
        int storageRetryAttempts,
        int maxRequestBytes
) {
    public static final String DEFAULT_PERSIST_ROOT = "/";
    public static final String DEFAULT_BIND_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 3001;
    public static final int DEFAULT_STORAGE_RETRY_ATTEMPTS = 3;
    public static final int DEFAULT_MAX_REQUEST_BYTES = 64 * 1024;

    public static GatewaySettings defaults() {
        return new GatewaySettings(
                DEFAULT_PERSIST_ROOT,
                DEFAULT_BIND_HOST,
                DEFAULT_PORT,
                DEFAULT_STORAGE_RETRY_ATTEMPTS,
                DEFAULT_MAX_REQUEST_BYTES
        );
    }

    public static GatewaySettings load(Path file) {
        GatewaySettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load gateway settings: " + file, e);
        }
    }

    static GatewaySettings fromFile(SettingsFile file, GatewaySettings defaults) {
        if (file == null) {
            return defaults;
        }
        String persistRoot = file.persistRoot() == null || file.persistRoot().isBlank()
                ? defaults.persistRoot()
                : file.persistRoot().trim();
        if (!persistRoot.startsWith("/")) {
            throw new IllegalArgumentException("persistRoot must be absolute: " + persistRoot);
        }
        String bindHost = file.bindHost() == null || file.bindHost().isBlank()
                ? defaults.bindHost()
                : file.bindHost().trim();
        int port = file.port() == null ? defaults.port() : clamp(file.port(), 0, 65535);
        int retries = file.storageRetryAttempts() == null
                ? defaults.storageRetryAttempts()
                : clamp(file.storageRetryAttempts(), 1, 10);
        int maxBytes = file.maxRequestBytes() == null
                ? defaults.maxRequestBytes()
                : clamp(file.maxRequestBytes(), 1024, 1024 * 1024);
        return new GatewaySettings(persistRoot, bindHost, port, retries, maxBytes);
    }

    public GatewaySettings withPort(int newPort) {
        return new GatewaySettings(persistRoot, bindHost, clamp(newPort, 0, 65535), storageRetryAttempts, maxRequestBytes);
    }

    public GatewaySettings withBindHost(String newHost) {
        String host = newHost == null || newHost.isBlank() ? bindHost : newHost.trim();
        return new GatewaySettings(persistRoot, host, port, storageRetryAttempts, maxRequestBytes);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    record SettingsFile(
            String persistRoot,
            String bindHost,
            Integer port,
            Integer storageRetryAttempts,
            Integer maxRequestBytes
    ) {
    }
}
