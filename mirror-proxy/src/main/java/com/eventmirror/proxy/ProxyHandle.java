package com.eventmirror.proxy;

import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A proxy process started by {@link ProxySupervisor}.
 *
 * <p>
 * Pass it back to {@link ProxySupervisor#stop(ProxyHandle)} and
 * {@link ProxySupervisor#isHealthy(ProxyHandle)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ProxyHandle {

    private final Process process;
    private final MirrorConfig config;
    private final Path logFile;
    private final Path pidFile;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    ProxyHandle(Process process, MirrorConfig config, Path logFile, Path pidFile) {
        this.process = process;
        this.config = config;
        this.logFile = logFile;
        this.pidFile = pidFile;
    }

    public long getPid() {
        return process.pid();
    }

    public MirrorConfig getConfig() {
        return config;
    }

    public String getListenHost() {
        return config.getListenHost();
    }

    public int getListenPort() {
        return config.getListenPort();
    }

    /**
     * @return {@code http://host:port} of the proxy, for device or client
     *         proxy settings
     */
    public URI getProxyUri() {
        return URI.create("http://" + getListenHost() + ":" + getListenPort());
    }

    /**
     * @return a selector routing every request through this proxy
     */
    public ProxySelector proxySelector() {
        return ProxySelector.of(new InetSocketAddress(getListenHost(), getListenPort()));
    }

    /**
     * @return the proxy CA certificate to install on the device, if the
     *         proxy intercepts HTTPS
     */
    public Optional<Path> getCaCertificate() {
        return config.isInterceptTls()
                ? Optional.of(config.getCaDir().resolve(CertificateAuthority.PEM_FILE))
                : Optional.empty();
    }

    /**
     * @return file receiving the process's stdout and stderr
     */
    public Path getLogFile() {
        return logFile;
    }

    public Path getPidFile() {
        return pidFile;
    }

    public boolean isStopped() {
        return stopped.get();
    }

    Process process() {
        return process;
    }

    /**
     * @return {@code true} for the first caller only
     */
    boolean markStopped() {
        return stopped.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "ProxyHandle{pid=" + process.pid() + ", listen=" + getListenHost() + ":" + getListenPort()
                + ", target=" + config.getTarget() + '}';
    }
}
