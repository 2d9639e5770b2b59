package org.ecosysx.cli.config;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final List<String> messages = new ArrayList<>();
    private final ConfigLoader.ConfigMessageHandler handler = (level, message) -> messages.add(level + " " + message);

    @BeforeEach
    void setUp() {
        clearProperties();
    }

    @AfterEach
    void tearDown() {
        clearProperties();
    }

    private static void clearProperties() {
        System.clearProperty("config.file");
        System.clearProperty("ecosysx.seed");
        ConfigFactory.invalidateCaches();
    }

    private File write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file.toFile();
    }

    @Test
    void explicitFileOverridesDefaults() throws IOException {
        File file = write("custom.conf", "ecosysx { seed = 7, population.basic = 2 }");

        Config config = ConfigLoader.resolve(file, handler);

        assertThat(config.getLong("ecosysx.seed")).isEqualTo(7);
        assertThat(config.getInt("ecosysx.population.basic")).isEqualTo(2);
        assertThat(config.getInt("ecosysx.population.rl")).isEqualTo(9);
        assertThat(messages).singleElement().asString().startsWith("INFO Using configuration file from --config");
    }

    @Test
    void missingExplicitFileIsRejected() {
        File missing = tempDir.resolve("absent.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.resolve(missing, handler))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Configuration file not found");
    }

    @Test
    void configFilePropertyIsUsedWithoutExplicitFile() throws IOException {
        File file = write("prop.conf", "ecosysx.contact.distance = 3.5");
        System.setProperty("config.file", file.getAbsolutePath());
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.resolve(null, handler);

        assertThat(config.getDouble("ecosysx.contact.distance")).isEqualTo(3.5);
        assertThat(messages).singleElement().asString().contains("-Dconfig.file");
    }

    @Test
    void missingConfigFilePropertyIsRejected() {
        System.setProperty("config.file", tempDir.resolve("nope.conf").toString());

        assertThatThrownBy(() -> ConfigLoader.resolve(null, handler))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-Dconfig.file");
    }

    @Test
    void systemPropertiesWinOverTheFile() throws IOException {
        File file = write("seeded.conf", "ecosysx.seed = 7");
        System.setProperty("ecosysx.seed", "99");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.resolve(file, handler);

        assertThat(config.getLong("ecosysx.seed")).isEqualTo(99);
    }

    @Test
    void fileCanReferToDefaults() throws IOException {
        File file = write("subst.conf", "ecosysx.population.rl = ${ecosysx.population.basic}");

        Config config = ConfigLoader.resolve(file, handler);

        assertThat(config.getInt("ecosysx.population.rl")).isEqualTo(8);
    }

    @Test
    void fallsBackToDefaultsWithWarning() {
        Config config = ConfigLoader.resolve(null, handler);

        assertThat(config.getLong("ecosysx.seed")).isEqualTo(42);
        assertThat(config.getString("ecosysx.reasoning.mode")).isEqualTo("deferred");
        assertThat(messages).singleElement().asString()
                .isEqualTo("WARN No config/ecosysx.conf found, using built-in defaults");
    }

    @Test
    void malformedFileFailsToParse() throws IOException {
        File file = write("broken.conf", "ecosysx { seed = ");

        assertThatThrownBy(() -> ConfigLoader.resolve(file, handler)).isInstanceOf(ConfigException.class);
    }
}
