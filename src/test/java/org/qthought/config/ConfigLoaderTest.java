package org.qthought.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies the precedence of configuration sources: system properties over the configuration
 * file over {@code reference.conf}.
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
        System.clearProperty("qthought.max-qubits");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Should fall back to reference.conf when no file exists")
    void load_shouldUseDefaultsWithoutFile() {
        Config config = ConfigLoader.load(tempDir.resolve("missing.conf").toFile());

        assertThat(config.getDouble("qthought.tolerance")).isEqualTo(1e-9);
        assertThat(config.getInt("qthought.max-qubits")).isEqualTo(24);
        assertThat(config.getLong("qthought.random-seed")).isEqualTo(42L);
        assertThat(config.getInt("qthought.inference.parallelism")).isEqualTo(1);
        assertThat(config.getString("logging.format")).isEqualTo("PLAIN");
    }

    @Test
    @DisplayName("Should let the configuration file override defaults")
    void load_shouldApplyFileOverDefaults() throws IOException {
        File file = writeConfig("qthought { random-seed = 7, max-qubits = 16 }");

        Config config = ConfigLoader.load(file);

        assertThat(config.getLong("qthought.random-seed")).isEqualTo(7L);
        assertThat(config.getInt("qthought.max-qubits")).isEqualTo(16);
        assertThat(config.getDouble("qthought.tolerance")).isEqualTo(1e-9);
    }

    @Test
    @DisplayName("Should let system properties override the configuration file")
    void load_shouldApplySystemPropertiesOverFile() throws IOException {
        File file = writeConfig("qthought { max-qubits = 16 }");
        System.setProperty("qthought.max-qubits", "12");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(file);

        assertThat(config.getInt("qthought.max-qubits")).isEqualTo(12);
    }

    private File writeConfig(String content) throws IOException {
        Path path = tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME);
        Files.write(path, content.getBytes(StandardCharsets.UTF_8));
        return path.toFile();
    }
}
