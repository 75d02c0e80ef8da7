package com.eventmirror.proxy;

import com.eventmirror.core.net.PortCheck;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server that reports whether the proxy is listening.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /healthz} – {@code 200} with
 * {@code {"status":"ok"|"down","host":..,"port":..,"pid":..,"ts":..}};
 * {@code status} is {@code ok} while the proxy port accepts connections</li>
 * <li>anything else – {@code 404}</li>
 * </ul>
 *
 * <p>
 * Binds the loopback interface only. A busy health port is logged and the
 * proxy keeps running without it.
 * </p>
 *
 * @since 1.0.0
 */
public class ProxyHealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(ProxyHealthServer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Duration CHECK_TIMEOUT = Duration.ofMillis(300);

    public static final String HEALTH_PATH = "/healthz";

    private final String proxyHost;
    private final int proxyPort;
    private final Clock clock;

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param proxyHost host the proxy listens on
     * @param proxyPort port the proxy listens on
     */
    public ProxyHealthServer(String proxyHost, int proxyPort) {
        this(proxyHost, proxyPort, Clock.systemUTC());
    }

    ProxyHealthServer(String proxyHost, int proxyPort, Clock clock) {
        this.proxyHost = proxyHost;
        this.proxyPort = proxyPort;
        this.clock = clock;
    }

    /**
     * Start the health server on the given loopback port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free one
     * @return {@code true} if the server started
     * @throws IllegalArgumentException if port is out of range
     */
    public boolean start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), 0);
            server.createContext("/", this::handle);

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "proxy-health");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Proxy health endpoint on port {}", server.getAddress().getPort());
            return true;
        } catch (IOException e) {
            LOG.warn("Proxy health endpoint not started on port {}: {}", port, e.getMessage());
            return false;
        }
    }

    /**
     * Stop the health server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Proxy health endpoint stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port
     * @throws IllegalStateException if the server is not running
     */
    public int getPort() {
        if (!running.get()) {
            throw new IllegalStateException("Proxy health endpoint is not running");
        }
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handler
    // ---------------------------------------------------------------

    private void handle(HttpExchange exchange) throws IOException {
        if (!HEALTH_PATH.equals(exchange.getRequestURI().getPath())) {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
            return;
        }

        ObjectNode status = MAPPER.createObjectNode();
        status.put("status", PortCheck.isListening(proxyHost, proxyPort, CHECK_TIMEOUT) ? "ok" : "down");
        status.put("host", proxyHost);
        status.put("port", proxyPort);
        status.put("pid", ProcessHandle.current().pid());
        status.put("ts", clock.instant().toString());

        byte[] body = MAPPER.writeValueAsBytes(status);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
