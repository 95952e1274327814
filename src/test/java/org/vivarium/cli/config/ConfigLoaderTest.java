package org.vivarium.cli.config;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import org.assertj.core.api.InstanceOfAssertFactories;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final List<String> messages = new ArrayList<>();

    @AfterEach
    void clearOverrides() {
        System.clearProperty("vivarium.seed");
        ConfigFactory.invalidateCaches();
    }

    @Test
    void explicitFileOverridesClasspathDefaults() throws URISyntaxException {
        File file = new File(getClass().getResource("/config/test-vivarium.conf").toURI());

        Config config = ConfigLoader.resolve(file, tempDir.toFile(), this::record);

        assertEquals(7, config.getInt("vivarium.seed"));
        assertEquals(5, config.getInt("vivarium.queue.capacity"));
        assertEquals(10, config.getInt("vivarium.snapshots.periodTicks"));
        assertThat(messages).singleElement(InstanceOfAssertFactories.STRING).startsWith("INFO").contains("--config");
    }

    @Test
    void missingExplicitFileIsRejected() {
        File missing = tempDir.resolve("nope.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.resolve(missing, tempDir.toFile(), this::record))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("nope.conf");
    }

    @Test
    void findsConfigInWorkingDirectory() throws IOException {
        Path configDir = Files.createDirectories(tempDir.resolve("config"));
        Files.writeString(configDir.resolve("vivarium.conf"), "vivarium.feedback.maxDelayTicks = 12");

        Config config = ConfigLoader.resolve(null, tempDir.toFile(), this::record);

        assertEquals(12, config.getInt("vivarium.feedback.maxDelayTicks"));
        assertEquals(3, config.getInt("vivarium.feedback.minDelayTicks"));
        assertThat(messages).singleElement(InstanceOfAssertFactories.STRING).contains("working directory");
    }

    @Test
    void fallsBackToClasspathDefaultsWithWarning() {
        Config config = ConfigLoader.resolve(null, tempDir.toFile(), this::record);

        assertEquals(42, config.getInt("vivarium.seed"));
        assertEquals(100, config.getInt("vivarium.queue.capacity"));
        assertThat(messages).singleElement(InstanceOfAssertFactories.STRING).startsWith("WARN");
    }

    @Test
    void systemPropertiesWinOverTheFile() throws URISyntaxException {
        System.setProperty("vivarium.seed", "99");
        ConfigFactory.invalidateCaches();
        File file = new File(getClass().getResource("/config/test-vivarium.conf").toURI());

        Config config = ConfigLoader.resolve(file, tempDir.toFile(), this::record);

        assertEquals(99, config.getInt("vivarium.seed"));
    }

    private void record(ConfigLoader.MessageLevel level, String message) {
        messages.add(level + " " + message);
    }
}
