package com.eventmirror.server;

import com.eventmirror.core.config.CollectorSettings;
import com.eventmirror.core.config.SettingsLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Runs the event collector as a standalone process.
 *
 * <p>
 * Settings are resolved by {@link SettingsLoader}. The process serves until
 * it receives a termination signal, then stops the server from a shutdown
 * hook.
 * </p>
 *
 * @since 1.0.0
 */
public final class CollectorMain {

    private static final Logger LOG = LoggerFactory.getLogger(CollectorMain.class);

    private CollectorMain() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load settings
        CollectorSettings settings = SettingsLoader.load();
        LOG.info("Starting event collector with {}", settings);

        // 2. Start serving
        EventCollectorServer server = new EventCollectorServer(settings);
        server.start();

        // 3. Block until terminated
        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            shutdown.countDown();
        }, "collector-shutdown"));

        shutdown.await();
    }
}
