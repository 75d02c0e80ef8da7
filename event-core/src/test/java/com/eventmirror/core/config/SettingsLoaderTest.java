package com.eventmirror.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SettingsLoader}.
 */
class SettingsLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should load test settings from classpath")
    void shouldLoadFromClasspath() {
        CollectorSettings settings = SettingsLoader.fromClasspath("test-collector.yml");

        assertThat(settings.getHost()).isEqualTo("0.0.0.0");
        assertThat(settings.getPort()).isEqualTo(8123);
        assertThat(settings.getNameField()).isEqualTo("meta.type");
        assertThat(settings.getEnvelopeField()).isEqualTo("batch");
        assertThat(settings.getHandlerThreads()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> SettingsLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should report every invalid setting at once")
    void shouldReportAllValidationErrors() {
        assertThatThrownBy(() -> SettingsLoader.fromClasspath("invalid-collector.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'port'")
                .hasMessageContaining("'handlerThreads'");
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys() {
        assertThatThrownBy(() -> SettingsLoader.fromClasspath("duplicate-collector.yml"))
                .isInstanceOf(YAMLException.class);
    }

    @Test
    @DisplayName("Should prefer the file named by the environment variable")
    void shouldLoadFromEnvironmentPath() throws IOException {
        Path file = tempDir.resolve("collector.yml");
        Files.writeString(file, "port: 9100\nnameField: event.name\n");

        CollectorSettings settings = SettingsLoader.load(
                Map.of(SettingsLoader.ENV_CONFIG_PATH, file.toString()));

        assertThat(settings.getPort()).isEqualTo(9100);
        assertThat(settings.getNameField()).isEqualTo("event.name");
        assertThat(settings.getHost()).isEqualTo("127.0.0.1");
    }

    @Test
    @DisplayName("Should fall back to defaults when nothing is configured")
    void shouldFallBackToDefaults() {
        CollectorSettings settings = SettingsLoader.load(
                Map.of(SettingsLoader.ENV_CONFIG_PATH, tempDir.resolve("missing.yml").toString()));

        assertThat(settings.getHost()).isEqualTo("127.0.0.1");
        assertThat(settings.getPort()).isEqualTo(8000);
        assertThat(settings.getNameField()).isEqualTo("name");
        assertThat(settings.getEnvelopeField()).isEqualTo("events");
        assertThat(settings.getHandlerThreads()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should use defaults for an empty file")
    void shouldUseDefaultsForEmptyFile() throws IOException {
        Path file = tempDir.resolve("empty.yml");
        Files.writeString(file, "");

        CollectorSettings settings = SettingsLoader.fromFile(file.toString());

        assertThat(settings.getPort()).isEqualTo(8000);
    }

    @Test
    @DisplayName("Should throw when the settings file does not exist")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> SettingsLoader.fromFile(tempDir.resolve("nope.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should treat a directory as a missing settings file")
    void shouldRejectDirectory() {
        assertThatThrownBy(() -> SettingsLoader.fromFile(tempDir.toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }
}
