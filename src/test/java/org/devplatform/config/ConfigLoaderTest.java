package org.devplatform.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Precedence: system properties over the workspace file over reference.conf.
 */
@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("supervisor.grace-period");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Defaults come from reference.conf when no file exists")
    void load_defaultsWithoutFile() {
        final Config config = ConfigLoader.load(tempDir.resolve("absent.conf").toFile());

        assertEquals(Duration.ofSeconds(5), config.getDuration("supervisor.grace-period"));
        assertEquals(".logs", config.getString("logs.directory"));
        assertEquals(3, config.getInt("health.default-retries"));
        assertTrue(config.getObject("services").isEmpty());
    }

    @Test
    @DisplayName("The workspace file overrides defaults")
    void load_fileOverridesDefaults() throws IOException {
        final Path file = tempDir.resolve("devplatform.conf");
        Files.writeString(file, """
            supervisor.grace-period = 2s
            services.api.command = "./run.sh"
            """);

        final Config config = ConfigLoader.load(file.toFile());

        assertEquals(Duration.ofSeconds(2), config.getDuration("supervisor.grace-period"));
        assertEquals(Duration.ofSeconds(1), config.getDuration("supervisor.settle-delay"));
        assertEquals("./run.sh", config.getString("services.api.command"));
    }

    @Test
    @DisplayName("System properties override the workspace file")
    void load_systemPropertyOverridesFile() throws IOException {
        final Path file = tempDir.resolve("devplatform.conf");
        Files.writeString(file, "supervisor.grace-period = 2s\n");
        System.setProperty("supervisor.grace-period", "7s");
        ConfigFactory.invalidateCaches();

        final Config config = ConfigLoader.load(file.toFile());

        assertEquals(Duration.ofSeconds(7), config.getDuration("supervisor.grace-period"));
    }
}
