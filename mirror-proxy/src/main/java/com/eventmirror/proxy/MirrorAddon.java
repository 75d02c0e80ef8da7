package com.eventmirror.proxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mirrors requests matching a {@link MirrorTarget} to the event collector.
 *
 * <h3>Fire and forget</h3>
 * <p>
 * {@link #onRequest(InterceptedRequest)} only matches and enqueues; the
 * original request is never delayed by the collector. A single daemon worker
 * POSTs the original body verbatim to the collector URL, keeping the
 * request's {@code Content-Type} ({@value #DEFAULT_CONTENT_TYPE} when it has
 * none), bounded by the mirror timeout.
 * </p>
 * <p>
 * At most {@value #DEFAULT_QUEUE_CAPACITY} copies wait behind the one in
 * flight. While the queue is full, further matches are counted as skipped
 * and dropped, so a stalled collector costs bounded memory.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * Connect errors, timeouts and non-2xx answers are logged at WARN, counted
 * and dropped. Nothing is ever rethrown into the proxy.
 * </p>
 *
 * <p>
 * Requests that do not match the target return immediately and leave no
 * trace, not even in the counters.
 * </p>
 *
 * @since 1.0.0
 */
public class MirrorAddon implements RequestHook, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MirrorAddon.class);

    public static final String DEFAULT_CONTENT_TYPE = "application/json";
    public static final int DEFAULT_QUEUE_CAPACITY = 256;

    private final MirrorTarget target;
    private final URI collectorUrl;
    private final Duration timeout;
    private final HttpClient http;
    private final ExecutorService worker;
    private final AtomicBoolean enabled;

    private final AtomicLong mirrored = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicInteger pending = new AtomicInteger();

    public MirrorAddon(MirrorConfig config) {
        this(config.getTarget(), config.getCollectorUrl(), config.getMirrorTimeout(), config.isEnabled());
    }

    /**
     * @param target       requests to mirror; must not be {@code null}
     * @param collectorUrl collector ingestion URL; must not be {@code null}
     * @param timeout      bound on each mirror POST; must be positive
     * @param enabled      initial state of the enable switch
     */
    public MirrorAddon(MirrorTarget target, URI collectorUrl, Duration timeout, boolean enabled) {
        this(target, collectorUrl, timeout, enabled, DEFAULT_QUEUE_CAPACITY);
    }

    MirrorAddon(MirrorTarget target, URI collectorUrl, Duration timeout, boolean enabled, int queueCapacity) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be positive, got: " + queueCapacity);
        }
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.collectorUrl = Objects.requireNonNull(collectorUrl, "collectorUrl must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
        this.enabled = new AtomicBoolean(enabled);
        this.http = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.worker = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new ArrayBlockingQueue<>(queueCapacity), r -> {
            Thread t = new Thread(r, "mirror-worker");
            t.setDaemon(true);
            return t;
        });
    }

    // ---------------------------------------------------------------
    // RequestHook
    // ---------------------------------------------------------------

    @Override
    public void onRequest(InterceptedRequest request) {
        if (!target.matches(request.getHost(), request.getPath())) {
            return;
        }
        if (!enabled.get()) {
            skipped.incrementAndGet();
            LOG.debug("Mirroring disabled; not copying {}", request);
            return;
        }

        String contentType = request.header("Content-Type").orElse(DEFAULT_CONTENT_TYPE);
        byte[] body = request.getBody();
        pending.incrementAndGet();
        try {
            worker.execute(() -> {
                try {
                    forward(body, contentType, request);
                } finally {
                    pending.decrementAndGet();
                }
            });
        } catch (RejectedExecutionException e) {
            pending.decrementAndGet();
            skipped.incrementAndGet();
            if (worker.isShutdown()) {
                LOG.debug("Mirror worker stopped; not copying {}", request);
            } else {
                LOG.warn("Mirror queue full; dropping copy of {}", request);
            }
        }
    }

    // ---------------------------------------------------------------
    // Lifecycle / diagnostics
    // ---------------------------------------------------------------

    public boolean isEnabled() {
        return enabled.get();
    }

    public void setEnabled(boolean value) {
        enabled.set(value);
        LOG.info("Mirroring {}", value ? "enabled" : "disabled");
    }

    /**
     * @return number of copies the collector accepted
     */
    public long getMirroredCount() {
        return mirrored.get();
    }

    /**
     * @return number of copies lost to transport errors or non-2xx answers
     */
    public long getFailedCount() {
        return failed.get();
    }

    /**
     * @return number of matching requests not copied because mirroring was
     *         disabled, the queue was full or the worker had stopped
     */
    public long getSkippedCount() {
        return skipped.get();
    }

    /**
     * @return copies queued or in flight
     */
    public int getPendingCount() {
        return pending.get();
    }

    public MirrorTarget getTarget() {
        return target;
    }

    /**
     * Stop the worker. Queued and in-flight copies are abandoned.
     */
    @Override
    public void close() {
        if (!worker.isShutdown()) {
            worker.shutdownNow();
            LOG.info("Mirror addon closed (mirrored={}, failed={}, skipped={})",
                    mirrored.get(), failed.get(), skipped.get());
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void forward(byte[] body, String contentType, InterceptedRequest original) {
        HttpRequest copy = HttpRequest.newBuilder(collectorUrl)
                .timeout(timeout)
                .header("Content-Type", contentType)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        try {
            HttpResponse<Void> response = http.send(copy, HttpResponse.BodyHandlers.discarding());
            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                mirrored.incrementAndGet();
                LOG.debug("Mirrored {} to {}", original, collectorUrl);
            } else {
                failed.incrementAndGet();
                LOG.warn("Collector {} answered {} for mirrored {}", collectorUrl, status, original);
            }
        } catch (IOException e) {
            failed.incrementAndGet();
            LOG.warn("Mirror of {} to {} failed: {}", original, collectorUrl, e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Mirror of {} abandoned at shutdown", original);
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            LOG.warn("Mirror of {} to {} failed", original, collectorUrl, e);
        }
    }
}
