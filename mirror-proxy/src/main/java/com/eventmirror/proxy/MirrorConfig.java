package com.eventmirror.proxy;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration of the mirror proxy process.
 *
 * <p>
 * Values are resolved from environment variables with defaults that work
 * against a collector on its default port, so the proxy runs with zero
 * configuration. {@link ProxySupervisor} passes the configuration to the
 * child process the same way, through {@link #toEnvironment()}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} in the proxy process, or the
 * {@link Builder} for programmatic / test scenarios. The builder validates
 * inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class MirrorConfig {

    public static final String ENV_ENABLED = "MIRROR_ENABLED";
    public static final String ENV_TARGET_HOST = "MIRROR_TARGET_HOST";
    public static final String ENV_TARGET_PATH = "MIRROR_TARGET_PATH";
    public static final String ENV_COLLECTOR_URL = "MIRROR_COLLECTOR_URL";
    public static final String ENV_TIMEOUT_MS = "MIRROR_TIMEOUT_MS";
    public static final String ENV_LISTEN_HOST = "PROXY_LISTEN_HOST";
    public static final String ENV_LISTEN_PORT = "PROXY_LISTEN_PORT";
    public static final String ENV_HEALTH_PORT = "PROXY_HEALTH_PORT";
    public static final String ENV_LOG_DIR = "PROXY_LOG_DIR";
    public static final String ENV_INTERCEPT_TLS = "MIRROR_INTERCEPT_TLS";
    public static final String ENV_CA_DIR = "PROXY_CA_DIR";

    // ---------------------------------------------------------------
    // Mirroring
    // ---------------------------------------------------------------
    private final boolean enabled;
    private final MirrorTarget target;
    private final URI collectorUrl;
    private final long timeoutMs;

    // ---------------------------------------------------------------
    // Proxy process
    // ---------------------------------------------------------------
    private final String listenHost;
    private final int listenPort;
    private final int healthPort;
    private final Path logDir;

    // ---------------------------------------------------------------
    // HTTPS
    // ---------------------------------------------------------------
    private final boolean interceptTls;
    private final Path caDir;

    private MirrorConfig(Builder b) {
        this.enabled = b.enabled;
        this.target = MirrorTarget.of(b.targetHost, b.targetPath);
        this.collectorUrl = b.collectorUrl;
        this.timeoutMs = b.timeoutMs;
        this.listenHost = b.listenHost;
        this.listenPort = b.listenPort;
        this.healthPort = b.healthPort;
        this.logDir = b.logDir;
        this.interceptTls = b.interceptTls;
        this.caDir = b.caDir;
    }

    // ---------------------------------------------------------------
    // Factory, resolved from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link MirrorConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static MirrorConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link MirrorConfig} from the given variables. Blank values
     * count as unset.
     *
     * @param env environment variables; must not be {@code null}
     * @return fully populated configuration
     * @throws IllegalStateException    if a value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static MirrorConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "Environment must not be null");
        Builder defaults = new Builder();
        try {
            return new Builder()
                    .enabled(parseBoolean(env, ENV_ENABLED, defaults.enabled))
                    .targetHost(env(env, ENV_TARGET_HOST, defaults.targetHost))
                    .targetPath(env(env, ENV_TARGET_PATH, defaults.targetPath))
                    .collectorUrl(URI.create(env(env, ENV_COLLECTOR_URL, defaults.collectorUrl.toString())))
                    .timeoutMs(Long.parseLong(env(env, ENV_TIMEOUT_MS, String.valueOf(defaults.timeoutMs))))
                    .listenHost(env(env, ENV_LISTEN_HOST, defaults.listenHost))
                    .listenPort(Integer.parseInt(env(env, ENV_LISTEN_PORT, String.valueOf(defaults.listenPort))))
                    .healthPort(Integer.parseInt(env(env, ENV_HEALTH_PORT, String.valueOf(defaults.healthPort))))
                    .logDir(Path.of(env(env, ENV_LOG_DIR, defaults.logDir.toString())))
                    .interceptTls(parseBoolean(env, ENV_INTERCEPT_TLS, defaults.interceptTls))
                    .caDir(Path.of(env(env, ENV_CA_DIR, defaults.caDir.toString())))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * Render this configuration as the environment variables
     * {@link #fromEnvironment(Map)} reads.
     *
     * @return insertion-ordered variable map
     */
    public Map<String, String> toEnvironment() {
        Map<String, String> env = new LinkedHashMap<>();
        env.put(ENV_ENABLED, String.valueOf(enabled));
        env.put(ENV_TARGET_HOST, target.getHost());
        env.put(ENV_TARGET_PATH, target.getPath());
        env.put(ENV_COLLECTOR_URL, collectorUrl.toString());
        env.put(ENV_TIMEOUT_MS, String.valueOf(timeoutMs));
        env.put(ENV_LISTEN_HOST, listenHost);
        env.put(ENV_LISTEN_PORT, String.valueOf(listenPort));
        env.put(ENV_HEALTH_PORT, String.valueOf(healthPort));
        env.put(ENV_LOG_DIR, logDir.toString());
        env.put(ENV_INTERCEPT_TLS, String.valueOf(interceptTls));
        env.put(ENV_CA_DIR, caDir.toString());
        return env;
    }

    /**
     * @return builder seeded with this configuration
     */
    public Builder toBuilder() {
        return new Builder()
                .enabled(enabled)
                .targetHost(target.getHost())
                .targetPath(target.getPath())
                .collectorUrl(collectorUrl)
                .timeoutMs(timeoutMs)
                .listenHost(listenHost)
                .listenPort(listenPort)
                .healthPort(healthPort)
                .logDir(logDir)
                .interceptTls(interceptTls)
                .caDir(caDir);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public boolean isEnabled() {
        return enabled;
    }

    public MirrorTarget getTarget() {
        return target;
    }

    public URI getCollectorUrl() {
        return collectorUrl;
    }

    public Duration getMirrorTimeout() {
        return Duration.ofMillis(timeoutMs);
    }

    public String getListenHost() {
        return listenHost;
    }

    public int getListenPort() {
        return listenPort;
    }

    /**
     * @return port of the local health endpoint; {@code 0} disables it
     */
    public int getHealthPort() {
        return healthPort;
    }

    public Path getLogDir() {
        return logDir;
    }

    /**
     * @return whether {@code CONNECT} tunnels to the target host are
     *         decrypted so HTTPS batches can be mirrored
     */
    public boolean isInterceptTls() {
        return interceptTls;
    }

    /**
     * @return directory holding the proxy CA key store and its PEM export
     */
    public Path getCaDir() {
        return caDir;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link MirrorConfig}.
     *
     * <p>
     * The {@link #build()} method validates the target, requires an absolute
     * {@code http}/{@code https} collector URL, a positive mirror timeout and
     * ports in range. A listen port of {@code 0} lets an in-process proxy pick
     * a free port.
     * </p>
     */
    public static class Builder {
        private boolean enabled = true;
        private String targetHost = "localhost";
        private String targetPath = "/batch";
        private URI collectorUrl = URI.create("http://127.0.0.1:8000/event");
        private long timeoutMs = 2_000;
        private String listenHost = "127.0.0.1";
        private int listenPort = 9090;
        private int healthPort = 8079;
        private Path logDir = Path.of("artifacts", "proxy");
        private boolean interceptTls = true;
        private Path caDir = Path.of("artifacts", "proxy", "ca");

        public Builder enabled(boolean v) {
            this.enabled = v;
            return this;
        }

        public Builder target(MirrorTarget v) {
            Objects.requireNonNull(v, "target must not be null");
            this.targetHost = v.getHost();
            this.targetPath = v.getPath();
            return this;
        }

        public Builder targetHost(String v) {
            this.targetHost = v;
            return this;
        }

        public Builder targetPath(String v) {
            this.targetPath = v;
            return this;
        }

        public Builder collectorUrl(URI v) {
            this.collectorUrl = v;
            return this;
        }

        public Builder timeoutMs(long v) {
            this.timeoutMs = v;
            return this;
        }

        public Builder listenHost(String v) {
            this.listenHost = v;
            return this;
        }

        public Builder listenPort(int v) {
            this.listenPort = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder logDir(Path v) {
            this.logDir = v;
            return this;
        }

        public Builder interceptTls(boolean v) {
            this.interceptTls = v;
            return this;
        }

        public Builder caDir(Path v) {
            this.caDir = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link MirrorConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public MirrorConfig build() {
            Objects.requireNonNull(collectorUrl, "collectorUrl required");
            Objects.requireNonNull(logDir, "logDir required");
            Objects.requireNonNull(caDir, "caDir required");
            requireNonBlank(listenHost, "listenHost");

            String scheme = collectorUrl.getScheme();
            if (!collectorUrl.isAbsolute() || collectorUrl.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new IllegalArgumentException(
                        "collectorUrl must be an absolute http(s) URL, got: " + collectorUrl);
            }
            if (timeoutMs < 1) {
                throw new IllegalArgumentException("timeoutMs must be >= 1, got: " + timeoutMs);
            }
            if (listenPort < 0 || listenPort > 65_535) {
                throw new IllegalArgumentException(
                        "listenPort must be in [0, 65535], got: " + listenPort);
            }
            if (healthPort < 0 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [0, 65535], got: " + healthPort);
            }

            return new MirrorConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static boolean parseBoolean(Map<String, String> env, String name, boolean defaultValue) {
        String value = env(env, name, String.valueOf(defaultValue));
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new IllegalStateException(
                    "Failed to parse boolean environment variable " + name + ": " + value);
        };
    }

    @Override
    public String toString() {
        return "MirrorConfig{" +
                "enabled=" + enabled +
                ", target=" + target +
                ", collectorUrl=" + collectorUrl +
                ", timeoutMs=" + timeoutMs +
                ", listenHost='" + listenHost + '\'' +
                ", listenPort=" + listenPort +
                ", healthPort=" + healthPort +
                ", logDir=" + logDir +
                ", interceptTls=" + interceptTls +
                ", caDir=" + caDir +
                '}';
    }
}
