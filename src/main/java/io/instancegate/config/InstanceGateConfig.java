package io.instancegate.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class InstanceGateConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "instancegate-settings.json";

    private final Path rootDir;

    public InstanceGateConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static InstanceGateConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new InstanceGateConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("instancegate.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path instanceKeyFile() {
        return securityRoot().resolve("instance.key");
    }

    public Path auditSigningKeyFile() {
        return securityRoot().resolve("audit-signing.key");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
