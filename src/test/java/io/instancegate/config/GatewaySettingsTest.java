package io.instancegate.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

final class GatewaySettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("instancegate-test-settings-missing-");
        try {
            GatewaySettings settings = GatewaySettings.load(root.resolve("absent.json"));
            Assertions.assertEquals(GatewaySettings.defaults(), settings);
            Assertions.assertEquals("/", settings.persistRoot());
            Assertions.assertEquals(3001, settings.port());
        } finally {
            Files.deleteIfExists(root);
        }
    }

    @Test
    void fileOverridesAndClampsValues() throws Exception {
        Path root = Files.createTempDirectory("instancegate-test-settings-");
        Path file = root.resolve(InstanceGateConfig.SETTINGS_FILE);
        try {
            Files.writeString(file, """
                    {
                      "persistRoot": "/srv/workloads",
                      "port": 70000,
                      "storageRetryAttempts": 0,
                      "unknownField": true
                    }
                    """);
            GatewaySettings settings = GatewaySettings.load(file);
            Assertions.assertEquals("/srv/workloads", settings.persistRoot());
            Assertions.assertEquals(65535, settings.port());
            Assertions.assertEquals(1, settings.storageRetryAttempts());
            Assertions.assertEquals(GatewaySettings.DEFAULT_BIND_HOST, settings.bindHost());
            Assertions.assertEquals(8080, settings.withPort(8080).port());
        } finally {
            Files.deleteIfExists(file);
            Files.deleteIfExists(root);
        }
    }

    @Test
    void relativePersistRootIsRejected() {
        GatewaySettings.SettingsFile raw = new GatewaySettings.SettingsFile("srv", null, null, null, null);
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> GatewaySettings.fromFile(raw, GatewaySettings.defaults()));
    }
}
