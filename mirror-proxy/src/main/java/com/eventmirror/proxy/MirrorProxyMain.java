package com.eventmirror.proxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Entry point of the mirror proxy process.
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link MirrorConfig}. This is how {@link ProxySupervisor} configures the
 * process it launches.
 * </p>
 *
 * <h3>HTTPS</h3>
 * <p>
 * Unless {@code MIRROR_INTERCEPT_TLS} is off, the proxy loads or creates its
 * CA under {@code PROXY_CA_DIR} and decrypts tunnels to the target host
 * only. The path of the PEM file to install on the device is logged at
 * startup.
 * </p>
 *
 * @since 1.0.0
 */
public final class MirrorProxyMain {

    private static final Logger LOG = LoggerFactory.getLogger(MirrorProxyMain.class);

    private MirrorProxyMain() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        MirrorConfig config = MirrorConfig.fromEnvironment();
        LOG.info("Starting mirror proxy with config: {}", config);

        // 2. HTTPS interception of the target host
        TlsInterception tls = config.isInterceptTls() ? tlsInterception(config) : null;

        // 3. Mirror addon and proxy
        MirrorAddon addon = new MirrorAddon(config);
        InterceptingProxyServer proxy = new InterceptingProxyServer(config, addon, tls);
        try {
            proxy.start();
        } catch (ProxyStartupException e) {
            addon.close();
            throw e;
        }

        // 4. Local health endpoint, unless disabled
        ProxyHealthServer health = new ProxyHealthServer(config.getListenHost(), proxy.getPort());
        if (config.getHealthPort() > 0) {
            health.start(config.getHealthPort());
        }

        // 5. Serve until terminated
        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            health.stop();
            proxy.stop();
            addon.close();
            shutdown.countDown();
        }, "proxy-shutdown"));

        shutdown.await();
    }

    private static TlsInterception tlsInterception(MirrorConfig config) {
        CertificateAuthority ca;
        try {
            ca = CertificateAuthority.loadOrCreate(config.getCaDir());
        } catch (IOException e) {
            throw new ProxyStartupException("Failed to prepare the proxy CA in " + config.getCaDir(), e);
        }
        String host = config.getTarget().getHost();
        ca.getPemFile().ifPresent(pem ->
                LOG.info("Intercepting HTTPS to {}; install {} as a trusted CA on the device", host, pem));
        return TlsInterception.of(ca, List.of(host));
    }
}
