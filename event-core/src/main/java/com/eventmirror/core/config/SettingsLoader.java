package com.eventmirror.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Loads and validates {@link CollectorSettings} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * <li>Built-in defaults</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Every {@code load*} method calls {@link CollectorSettings#validate()} after
 * parsing, so a bad file fails the session at startup instead of producing
 * misleading "event not found" failures later.
 * </p>
 *
 * @since 1.0.0
 */
public final class SettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "EVENT_COLLECTOR_CONFIG";

    public static final String DEFAULT_RESOURCE = "event-collector.yml";

    private SettingsLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load settings using automatic resolution against the process
     * environment.
     *
     * @return parsed and validated settings
     * @throws IllegalStateException if validation fails
     */
    public static CollectorSettings load() {
        return load(System.getenv());
    }

    /**
     * Load settings using automatic resolution against {@code env}.
     *
     * @param env environment variables to consult; must not be {@code null}
     * @return parsed and validated settings
     * @throws IllegalStateException if validation fails
     */
    public static CollectorSettings load(Map<String, String> env) {
        Objects.requireNonNull(env, "Environment must not be null");
        String envPath = env.get(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading collector settings from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (SettingsLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            LOG.info("Loading collector settings from classpath: {}", DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.info("No collector settings found; using defaults");
        CollectorSettings defaults = new CollectorSettings();
        defaults.validate();
        return defaults;
    }

    /**
     * Read collector settings from a YAML file, typically the one named by
     * {@value #ENV_CONFIG_PATH}.
     *
     * @param path location of the YAML file
     * @return validated settings; defaults if the file is empty
     * @throws IllegalArgumentException if nothing exists at {@code path}
     * @throws IllegalStateException    on an I/O error or invalid values
     */
    public static CollectorSettings fromFile(String path) {
        Objects.requireNonNull(path, "Settings file path must not be null");
        Path file = Path.of(path);
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Settings file not found: " + file.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.toString());
        } catch (IOException e) {
            throw new IllegalStateException("Could not read settings file " + file, e);
        }
    }

    /**
     * Read collector settings bundled on the classpath, such as
     * {@value #DEFAULT_RESOURCE} or a test fixture.
     *
     * @param resource resource name relative to the classpath root
     * @return validated settings; defaults if the resource is empty
     * @throws IllegalArgumentException if no such resource is visible
     * @throws IllegalStateException    on an I/O error or invalid values
     */
    public static CollectorSettings fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        ClassLoader loader = SettingsLoader.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Settings resource not found on classpath: " + resource);
            }
            return read(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read settings resource " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * Bind one YAML document onto {@link CollectorSettings}. Unknown
     * properties and repeated keys are YAML errors; out-of-range values are
     * collected by {@link CollectorSettings#validate()}.
     */
    private static CollectorSettings read(InputStream in, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        CollectorSettings settings = new Yaml(new Constructor(CollectorSettings.class, options)).load(in);
        if (settings == null) {
            LOG.warn("{} holds no settings; falling back to defaults", origin);
            settings = new CollectorSettings();
        }
        settings.validate();
        LOG.info("Collector settings from {}: {}", origin, settings);
        return settings;
    }
}
