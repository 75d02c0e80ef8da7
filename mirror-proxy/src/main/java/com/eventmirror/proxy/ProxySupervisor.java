package com.eventmirror.proxy;

import com.eventmirror.core.net.PortCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Launches and stops the mirror proxy as a separate OS process.
 *
 * <h3>Start</h3>
 * <ol>
 * <li>refuse if the listen port already accepts connections</li>
 * <li>launch the command with the mirror settings in its environment; the
 * inherited environment is stripped of variables that look like
 * credentials</li>
 * <li>send stdout and stderr to a timestamped log file in the log directory
 * and write the PID to {@value #PID_FILE_NAME}</li>
 * <li>wait, bounded, for the listen port; if the process exits or the wait
 * times out, destroy it and throw {@link ProxyStartupException}</li>
 * </ol>
 *
 * <p>
 * Start failures are fatal and never retried. The default command runs
 * {@link MirrorProxyMain} on the current JVM and classpath.
 * </p>
 *
 * @since 1.0.0
 */
public class ProxySupervisor {

    private static final Logger LOG = LoggerFactory.getLogger(ProxySupervisor.class);

    public static final Duration DEFAULT_STARTUP_TIMEOUT = Duration.ofSeconds(10);
    public static final String PID_FILE_NAME = "proxy.pid";

    /** Substrings of variable names never passed to the child process. */
    static final List<String> BLOCKED_ENV_MARKERS = List.of(
            "KEY", "TOKEN", "SECRET", "PASSWORD", "AWS", "AZURE", "GCP", "GOOGLE_APPLICATION_CREDENTIALS");

    private static final Duration GRACEFUL_STOP = Duration.ofSeconds(1);
    private static final long LISTEN_POLL_MS = 150;
    private static final DateTimeFormatter LOG_STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

    private final MirrorConfig baseConfig;
    private final List<String> command;
    private final Duration startupTimeout;

    /**
     * Supervisor running {@link MirrorProxyMain} with the default timeout.
     *
     * @param baseConfig listen address, health port, log directory and mirror
     *                   timeout for every proxy started
     */
    public ProxySupervisor(MirrorConfig baseConfig) {
        this(baseConfig, defaultCommand(), DEFAULT_STARTUP_TIMEOUT);
    }

    /**
     * @param baseConfig     settings shared by every proxy started
     * @param command        program and arguments to launch
     * @param startupTimeout bound on the wait for the listen port
     */
    public ProxySupervisor(MirrorConfig baseConfig, List<String> command, Duration startupTimeout) {
        this.baseConfig = Objects.requireNonNull(baseConfig, "baseConfig must not be null");
        Objects.requireNonNull(command, "command must not be null");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        this.command = List.copyOf(command);
        this.startupTimeout = Objects.requireNonNull(startupTimeout, "startupTimeout must not be null");
        if (baseConfig.getListenPort() == 0) {
            throw new IllegalArgumentException("A supervised proxy needs a fixed listen port");
        }
    }

    /**
     * @return {@code java -cp <current classpath> MirrorProxyMain}
     */
    public static List<String> defaultCommand() {
        String java = Paths.get(System.getProperty("java.home"), "bin", "java").toString();
        return List.of(java, "-cp", System.getProperty("java.class.path"), MirrorProxyMain.class.getName());
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start a proxy mirroring {@code target} to {@code collectorUrl}.
     *
     * @param target       requests to mirror; must not be {@code null}
     * @param collectorUrl collector ingestion URL; must not be {@code null}
     * @return handle of the running, listening proxy
     * @throws ProxyStartupException if the proxy cannot be brought up
     */
    public ProxyHandle start(MirrorTarget target, URI collectorUrl) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(collectorUrl, "collectorUrl must not be null");
        MirrorConfig config = baseConfig.toBuilder()
                .target(target)
                .collectorUrl(collectorUrl)
                .build();
        String host = config.getListenHost();
        int port = config.getListenPort();

        if (PortCheck.isListening(host, port)) {
            throw new ProxyStartupException("Port " + host + ":" + port + " is already in use");
        }

        Path logDir = config.getLogDir();
        Path logFile = logDir.resolve("proxy_" + LocalDateTime.now().format(LOG_STAMP) + ".log");
        Path pidFile = logDir.resolve(PID_FILE_NAME);

        Process process;
        try {
            Files.createDirectories(logDir);
            ProcessBuilder builder = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
            Map<String, String> env = builder.environment();
            Map<String, String> sanitized = sanitizeEnvironment(env);
            env.clear();
            env.putAll(sanitized);
            env.putAll(config.toEnvironment());
            process = builder.start();
        } catch (IOException e) {
            throw new ProxyStartupException("Failed to launch proxy " + command + ": " + e.getMessage(), e);
        }

        try {
            Files.writeString(pidFile, String.valueOf(process.pid()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.warn("Could not write PID file {}: {}", pidFile, e.getMessage());
        }
        LOG.info("Proxy launched (PID {}): {}", process.pid(), String.join(" ", command));

        ProxyHandle handle = new ProxyHandle(process, config, logFile, pidFile);
        awaitListening(handle);
        LOG.info("Proxy listening on {}:{} (PID {}), mirroring {} to {}",
                host, port, process.pid(), target, collectorUrl);
        return handle;
    }

    /**
     * Stop the proxy: graceful termination, then forcible after a grace
     * period. Removes the PID file. Calling it again is a no-op.
     *
     * @param handle proxy to stop; {@code null} is ignored
     */
    public void stop(ProxyHandle handle) {
        if (handle == null || !handle.markStopped()) {
            return;
        }
        Process process = handle.process();
        LOG.info("Stopping proxy (PID {})", process.pid());
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(GRACEFUL_STOP.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Proxy still running after {} ms; killing (PID {})", GRACEFUL_STOP.toMillis(), process.pid());
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly().waitFor(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        deletePidFile(handle.getPidFile());
    }

    /**
     * @param handle proxy to check
     * @return {@code true} if the process is alive and its port accepts
     *         connections
     */
    public boolean isHealthy(ProxyHandle handle) {
        return handle != null
                && !handle.isStopped()
                && handle.process().isAlive()
                && PortCheck.isListening(handle.getListenHost(), handle.getListenPort());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * @return copy of {@code env} without variables whose name contains a
     *         credential marker, compared case-insensitively
     */
    static Map<String, String> sanitizeEnvironment(Map<String, String> env) {
        Map<String, String> sanitized = new HashMap<>();
        env.forEach((name, value) -> {
            String upper = name.toUpperCase(Locale.ROOT);
            if (BLOCKED_ENV_MARKERS.stream().noneMatch(upper::contains)) {
                sanitized.put(name, value);
            }
        });
        return sanitized;
    }

    private void awaitListening(ProxyHandle handle) {
        Process process = handle.process();
        long deadline = System.nanoTime() + startupTimeout.toNanos();
        while (true) {
            if (PortCheck.isListening(handle.getListenHost(), handle.getListenPort())) {
                return;
            }
            if (!process.isAlive()) {
                abandon(handle);
                throw new ProxyStartupException("Proxy exited with code " + process.exitValue()
                        + " before listening on " + handle.getListenHost() + ":" + handle.getListenPort()
                        + ". See log: " + handle.getLogFile());
            }
            if (System.nanoTime() >= deadline) {
                abandon(handle);
                throw new ProxyStartupException("Proxy did not start listening on " + handle.getListenHost()
                        + ":" + handle.getListenPort() + " within " + startupTimeout.toMillis()
                        + " ms. See log: " + handle.getLogFile());
            }
            try {
                Thread.sleep(LISTEN_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandon(handle);
                throw new ProxyStartupException("Interrupted while waiting for the proxy to listen", e);
            }
        }
    }

    private void abandon(ProxyHandle handle) {
        handle.markStopped();
        Process process = handle.process();
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        deletePidFile(handle.getPidFile());
    }

    private static void deletePidFile(Path pidFile) {
        try {
            Files.deleteIfExists(pidFile);
        } catch (IOException e) {
            LOG.warn("Could not delete PID file {}: {}", pidFile, e.getMessage());
        }
    }
}
