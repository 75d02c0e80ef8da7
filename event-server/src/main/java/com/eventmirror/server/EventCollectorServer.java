package com.eventmirror.server;

import com.eventmirror.core.config.CollectorSettings;
import com.eventmirror.core.model.EventRecord;
import com.eventmirror.core.store.EventSource;
import com.eventmirror.core.store.EventStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Batch ingestion server: accepts mirrored analytics batches over HTTP and
 * keeps them in an in-memory {@link EventStore}.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code POST /event} – ingest a batch; {@code 200 {"stored":n}}, or
 * {@code 400} when the body is not JSON</li>
 * <li>{@code GET /health} – {@code 200 {"status":"UP"}} once accepting
 * connections</li>
 * <li>{@code GET /events[?since=seq]} – stored records, insertion order</li>
 * <li>{@code DELETE /events}, {@code GET|POST|DELETE /reset} – clear the
 * store; {@code 200 {"cleared":n}}</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}. Requests are handled on a fixed
 * pool of daemon threads, so the server never blocks the test thread and
 * concurrent batches are appended safely.
 * </p>
 *
 * <p>
 * The server owns its store. In-process callers read it through the
 * {@link EventSource} methods; out-of-process callers use
 * {@link CollectorClient}.
 * </p>
 *
 * @since 1.0.0
 */
public class EventCollectorServer implements EventSource {

    private static final Logger LOG = LoggerFactory.getLogger(EventCollectorServer.class);

    public static final String EVENT_PATH = "/event";
    public static final String HEALTH_PATH = "/health";
    public static final String EVENTS_PATH = "/events";
    public static final String RESET_PATH = "/reset";

    private static final Map<String, String> HEALTH_RESPONSE = Map.of("status", "UP");

    private final CollectorSettings settings;
    private final EventStore store = new EventStore();
    private final BatchIngestor ingestor;
    private final Clock clock;

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public EventCollectorServer(CollectorSettings settings) {
        this(settings, Clock.systemUTC());
    }

    /**
     * @param settings validated collector settings; must not be {@code null}
     * @param clock    source of {@code receivedAt} timestamps
     */
    public EventCollectorServer(CollectorSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "CollectorSettings must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        settings.validate();
        this.ingestor = new BatchIngestor(settings);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Bind the configured address and start serving in the background.
     * Calling {@code start()} on a running server is a no-op.
     *
     * @throws CollectorStartupException if the port cannot be bound
     */
    public synchronized void start() {
        if (running.get()) {
            return;
        }
        try {
            server = HttpServer.create(new InetSocketAddress(settings.getHost(), settings.getPort()), 0);
        } catch (IOException e) {
            throw new CollectorStartupException(
                    "Failed to bind event collector on " + settings.getHost() + ":" + settings.getPort(), e);
        }
        server.createContext(EVENT_PATH, guarded(this::handleEvent));
        server.createContext(HEALTH_PATH, guarded(this::handleHealth));
        server.createContext(EVENTS_PATH, guarded(this::handleEvents));
        server.createContext(RESET_PATH, guarded(this::handleReset));
        server.createContext("/", exchange -> sendJson(exchange, 404, Map.of("error", "Not Found")));

        AtomicInteger threadIds = new AtomicInteger();
        executor = Executors.newFixedThreadPool(settings.getHandlerThreads(), r -> {
            Thread t = new Thread(r, "event-collector-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.start();
        running.set(true);
        LOG.info("Event collector started on {}", baseUri());
    }

    /**
     * Stop serving and clear the store. Safe to call more than once.
     */
    public synchronized void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            store.clear();
            LOG.info("Event collector stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port; differs from the configured one when that was
     *         {@code 0}
     * @throws IllegalStateException if the server is not running
     */
    public int getPort() {
        if (!running.get()) {
            throw new IllegalStateException("Event collector is not running");
        }
        return server.getAddress().getPort();
    }

    /**
     * @return {@code http://host:port}
     */
    public URI baseUri() {
        return URI.create("http://" + settings.getHost() + ":" + getPort());
    }

    /**
     * @return the URL mirrors should POST batches to
     */
    public URI ingestUri() {
        return baseUri().resolve(EVENT_PATH);
    }

    // ---------------------------------------------------------------
    // EventSource
    // ---------------------------------------------------------------

    @Override
    public List<EventRecord> snapshot() {
        return store.snapshot();
    }

    @Override
    public int reset() {
        return store.clear();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleEvent(HttpExchange exchange) throws IOException {
        if (!exactPath(exchange, EVENT_PATH) || !allowMethods(exchange, Set.of("POST"))) {
            return;
        }
        byte[] body;
        try (InputStream in = exchange.getRequestBody()) {
            body = in.readAllBytes();
        }

        long batchId = store.nextBatchId();
        List<EventRecord> parsed;
        try {
            parsed = ingestor.parse(body, batchId, clock.instant());
        } catch (MalformedBatchException e) {
            LOG.warn("Rejected batch {} from {}: {}", batchId, exchange.getRemoteAddress(), e.getMessage());
            sendJson(exchange, 400, Map.of("error", e.getMessage()));
            return;
        }

        List<EventRecord> stored = store.append(parsed);
        LOG.info("Batch {} stored {} event(s)", batchId, stored.size());
        sendJson(exchange, 200, Map.of("stored", stored.size()));
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (exactPath(exchange, HEALTH_PATH) && allowMethods(exchange, Set.of("GET", "HEAD"))) {
            sendJson(exchange, 200, HEALTH_RESPONSE);
        }
    }

    private void handleEvents(HttpExchange exchange) throws IOException {
        if (!exactPath(exchange, EVENTS_PATH) || !allowMethods(exchange, Set.of("GET", "DELETE"))) {
            return;
        }
        if ("DELETE".equals(exchange.getRequestMethod())) {
            sendJson(exchange, 200, Map.of("cleared", store.clear()));
            return;
        }

        long since;
        try {
            since = sinceParameter(exchange.getRequestURI().getRawQuery());
        } catch (NumberFormatException e) {
            sendJson(exchange, 400, Map.of("error", "Invalid 'since' parameter: " + e.getMessage()));
            return;
        }
        sendJson(exchange, 200, EventJson.toJson(since > 0 ? store.since(since) : store.snapshot()));
    }

    private void handleReset(HttpExchange exchange) throws IOException {
        if (exactPath(exchange, RESET_PATH) && allowMethods(exchange, Set.of("GET", "POST", "DELETE"))) {
            sendJson(exchange, 200, Map.of("cleared", store.clear()));
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * A failing handler answers {@code 500} instead of dropping the
     * connection.
     */
    private static HttpHandler guarded(HttpHandler handler) {
        return exchange -> {
            try {
                handler.handle(exchange);
            } catch (RuntimeException e) {
                LOG.error("Unhandled error serving {} {}", exchange.getRequestMethod(),
                        exchange.getRequestURI(), e);
                sendJson(exchange, 500, Map.of("error", "Internal Server Error"));
            }
        };
    }

    private static boolean exactPath(HttpExchange exchange, String path) throws IOException {
        String requested = exchange.getRequestURI().getPath();
        if (path.equals(requested) || (path + "/").equals(requested)) {
            return true;
        }
        sendJson(exchange, 404, Map.of("error", "Not Found"));
        return false;
    }

    private static boolean allowMethods(HttpExchange exchange, Set<String> methods) throws IOException {
        if (methods.contains(exchange.getRequestMethod())) {
            return true;
        }
        exchange.getResponseHeaders().set("Allow", String.join(", ", methods));
        sendJson(exchange, 405, Map.of("error", "Method Not Allowed"));
        return false;
    }

    static long sinceParameter(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return 0;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.startsWith("since=")) {
                return Long.parseLong(pair.substring("since=".length()));
            }
        }
        return 0;
    }

    private static void sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = EventJson.mapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        if ("HEAD".equals(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
            return;
        }
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
