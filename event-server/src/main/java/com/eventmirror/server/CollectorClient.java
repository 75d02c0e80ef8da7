package com.eventmirror.server;

import com.eventmirror.core.model.EventRecord;
import com.eventmirror.core.store.EventSource;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * HTTP client for a running {@link EventCollectorServer}.
 *
 * <p>
 * Implements {@link EventSource} over the server's query endpoints, so a
 * verifier can run in a different process from the collector. Also provides
 * the readiness check used by test setup.
 * </p>
 *
 * @since 1.0.0
 */
public class CollectorClient implements EventSource {

    private static final Logger LOG = LoggerFactory.getLogger(CollectorClient.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(5);
    private static final long READY_POLL_MS = 100;

    private final URI baseUri;
    private final HttpClient http;

    /**
     * @param baseUri collector root, e.g. {@code http://127.0.0.1:8000}
     */
    public CollectorClient(URI baseUri) {
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri must not be null");
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    // ---------------------------------------------------------------
    // Readiness
    // ---------------------------------------------------------------

    /**
     * @return {@code true} if {@code GET /health} answers {@code 200}
     */
    public boolean isHealthy() {
        try {
            return send(get(EventCollectorServer.HEALTH_PATH)).statusCode() == 200;
        } catch (UncheckedIOException e) {
            LOG.debug("Health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Block until the collector reports healthy.
     *
     * @param timeout maximum wait
     * @throws IllegalStateException if the collector is not healthy in time
     */
    public void awaitHealthy(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!isHealthy()) {
            if (System.nanoTime() >= deadline) {
                throw new IllegalStateException(
                        "Event collector at " + baseUri + " not healthy within " + timeout.toMillis() + " ms");
            }
            try {
                Thread.sleep(READY_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for event collector", e);
            }
        }
    }

    // ---------------------------------------------------------------
    // EventSource
    // ---------------------------------------------------------------

    @Override
    public List<EventRecord> snapshot() {
        return since(0);
    }

    /**
     * @param sequence exclusive lower bound on the record sequence
     * @return records stored after {@code sequence}
     */
    public List<EventRecord> since(long sequence) {
        String path = EventCollectorServer.EVENTS_PATH + (sequence > 0 ? "?since=" + sequence : "");
        HttpResponse<String> response = expectOk(send(get(path)));
        return EventJson.fromJsonArray(readTree(response.body()));
    }

    @Override
    public int reset() {
        HttpRequest request = HttpRequest.newBuilder(baseUri.resolve(EventCollectorServer.EVENTS_PATH))
                .timeout(REQUEST_TIMEOUT)
                .DELETE()
                .build();
        return readTree(expectOk(send(request)).body()).path("cleared").asInt();
    }

    /**
     * Post a batch, as a mirror would.
     *
     * @param json request body
     * @return number of events the collector stored
     * @throws IllegalStateException if the collector rejects the batch
     */
    public int postBatch(String json) {
        HttpRequest request = HttpRequest.newBuilder(baseUri.resolve(EventCollectorServer.EVENT_PATH))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
        return readTree(expectOk(send(request)).body()).path("stored").asInt();
    }

    public URI getBaseUri() {
        return baseUri;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private HttpRequest get(String path) {
        return HttpRequest.newBuilder(baseUri.resolve(path))
                .timeout(REQUEST_TIMEOUT)
                .GET()
                .build();
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Request to " + request.uri() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during request to " + request.uri(), e);
        }
    }

    private static HttpResponse<String> expectOk(HttpResponse<String> response) {
        if (response.statusCode() != 200) {
            throw new IllegalStateException("Collector answered " + response.statusCode()
                    + " for " + response.request().uri() + ": " + response.body());
        }
        return response;
    }

    private static JsonNode readTree(String body) {
        try {
            return EventJson.mapper().readTree(body);
        } catch (IOException e) {
            throw new UncheckedIOException("Collector returned malformed JSON", e);
        }
    }
}
