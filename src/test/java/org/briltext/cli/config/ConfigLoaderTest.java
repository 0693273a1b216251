package org.briltext.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * system properties, then the configuration file, then reference.conf.
 */
@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path dir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("bril.modules.directory");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Defaults from reference.conf are loaded when no file is given")
    void load_shouldProvideReferenceDefaults() {
        BrilSettings settings = BrilSettings.from(ConfigLoader.load());

        assertThat(settings).isEqualTo(new BrilSettings(".", ".bril", false, true));
    }

    @Test
    @DisplayName("Configuration file overrides reference.conf")
    void load_fileShouldOverrideDefaults() throws Exception {
        // Arrange
        File file = dir.resolve("custom.conf").toFile();
        Files.writeString(file.toPath(), """
                bril {
                  modules.directory = "lib"
                  printer.emit-signatures = true
                }
                """);

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        BrilSettings settings = BrilSettings.from(config);
        assertThat(settings.moduleDirectory()).isEqualTo("lib");
        assertThat(settings.emitSignatures()).isTrue();
        assertThat(settings.moduleExtension()).isEqualTo(".bril");
        assertThat(config.getString("logging.default-level")).isEqualTo("WARN");
    }

    @Test
    @DisplayName("System property overrides the configuration file")
    void load_systemPropertyShouldOverrideFile() throws Exception {
        // Arrange
        File file = dir.resolve("custom.conf").toFile();
        Files.writeString(file.toPath(), "bril.modules.directory = \"from-file\"\n");
        System.setProperty("bril.modules.directory", "from-property");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertThat(config.getString("bril.modules.directory")).isEqualTo("from-property");
    }

    @Test
    @DisplayName("An explicit file that does not exist is an error")
    void load_missingExplicitFileShouldFail() {
        File missing = dir.resolve("missing.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.load(missing))
                .isInstanceOf(ConfigException.class);
    }
}
