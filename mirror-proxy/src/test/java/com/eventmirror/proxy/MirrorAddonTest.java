package com.eventmirror.proxy;

import com.eventmirror.core.config.CollectorSettings;
import com.eventmirror.core.model.EventFilter;
import com.eventmirror.core.model.EventRecord;
import com.eventmirror.core.net.PortCheck;
import com.eventmirror.core.verify.EventVerifier;
import com.eventmirror.server.EventCollectorServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MirrorAddonTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    // ------------------------------------------------------------------
    // Addon against a recording collector
    // ------------------------------------------------------------------

    @Nested
    @DisplayName("Copying")
    class Copying {

        private final RecordingServer collector = new RecordingServer();
        private final MirrorAddon addon = new MirrorAddon(
                MirrorTarget.of("a.example.com", "/batch"), collector.uri("/event"), TIMEOUT, true);

        Copying() throws Exception {
        }

        @AfterEach
        void tearDown() {
            addon.close();
            collector.close();
        }

        @Test
        @DisplayName("Matching request should be copied verbatim with its content type")
        void verbatimCopy() throws Exception {
            addon.onRequest(request("http://a.example.com/batch?x=1", "text/plain", "not json at all"));

            RecordingServer.Recorded copy = collector.next(5_000);
            assertThat(copy).isNotNull();
            assertThat(copy.method).isEqualTo("POST");
            assertThat(copy.uri.getPath()).isEqualTo("/event");
            assertThat(copy.contentType).isEqualTo("text/plain");
            assertThat(copy.bodyText()).isEqualTo("not json at all");
            awaitTrue(() -> addon.getMirroredCount() == 1);
            assertThat(addon.getPendingCount()).isZero();
        }

        @Test
        @DisplayName("Request without content type should be copied as JSON")
        void defaultContentType() throws Exception {
            addon.onRequest(request("http://a.example.com/batch", null, "[]"));

            RecordingServer.Recorded copy = collector.next(5_000);
            assertThat(copy).isNotNull();
            assertThat(copy.contentType).isEqualTo(MirrorAddon.DEFAULT_CONTENT_TYPE);
        }

        @Test
        @DisplayName("Non-matching request should leave no trace")
        void nonMatching() throws Exception {
            addon.onRequest(request("http://b.example.com/batch", "application/json", "[]"));
            addon.onRequest(request("http://a.example.com/batch/more", "application/json", "[]"));

            assertThat(collector.next(300)).isNull();
            assertThat(addon.getMirroredCount()).isZero();
            assertThat(addon.getFailedCount()).isZero();
            assertThat(addon.getSkippedCount()).isZero();
        }

        @Test
        @DisplayName("Disabled addon should skip matching requests")
        void disabled() throws Exception {
            addon.setEnabled(false);

            addon.onRequest(request("http://a.example.com/batch", "application/json", "[]"));

            assertThat(addon.isEnabled()).isFalse();
            assertThat(addon.getSkippedCount()).isEqualTo(1);
            assertThat(collector.next(300)).isNull();
        }

        @Test
        @DisplayName("Non-2xx collector answer should count as failed")
        void collectorRejects() throws Exception {
            collector.respondWith(500);

            addon.onRequest(request("http://a.example.com/batch", "application/json", "[]"));

            awaitTrue(() -> addon.getFailedCount() == 1);
            assertThat(addon.getMirroredCount()).isZero();
        }

        @Test
        @DisplayName("Closed addon should skip matching requests")
        void closed() throws Exception {
            addon.close();

            addon.onRequest(request("http://a.example.com/batch", "application/json", "[]"));

            assertThat(addon.getSkippedCount()).isEqualTo(1);
            assertThat(addon.getPendingCount()).isZero();
        }
    }

    @Test
    @DisplayName("Unreachable collector should count as failed without throwing")
    void unreachableCollector() throws Exception {
        URI closed = URI.create("http://127.0.0.1:" + PortCheck.freePort() + "/event");
        try (MirrorAddon addon = new MirrorAddon(MirrorTarget.of("a.example.com", "/batch"), closed, TIMEOUT, true)) {
            addon.onRequest(request("http://a.example.com/batch", "application/json", "[]"));

            awaitTrue(() -> addon.getFailedCount() == 1);
        }
    }

    @Test
    @DisplayName("Full queue should drop further copies as skipped")
    void fullQueueSkips() throws Exception {
        try (ServerSocket blackHole = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            URI stalled = URI.create("http://127.0.0.1:" + blackHole.getLocalPort() + "/event");
            try (MirrorAddon addon = new MirrorAddon(MirrorTarget.of("a.example.com", "/batch"), stalled,
                    Duration.ofMillis(1500), true, 2)) {
                for (int i = 0; i < 10; i++) {
                    addon.onRequest(request("http://a.example.com/batch", "application/json", "[" + i + "]"));
                }

                // one copy in flight, two queued
                assertThat(addon.getSkippedCount()).isEqualTo(7);
                assertThat(addon.getPendingCount()).isEqualTo(3);

                awaitTrue(() -> addon.getFailedCount() == 3 && addon.getPendingCount() == 0);
                assertThat(addon.getMirroredCount()).isZero();
            }
        }
    }

    @Test
    @DisplayName("Non-positive timeout or queue capacity should be rejected")
    void invalidTimeout() {
        assertThatThrownBy(() -> new MirrorAddon(MirrorTarget.of("a", "/b"),
                URI.create("http://127.0.0.1:1/event"), Duration.ZERO, true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MirrorAddon(MirrorTarget.of("a", "/b"),
                URI.create("http://127.0.0.1:1/event"), TIMEOUT, true, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // End to end: app -> proxy -> upstream, copy -> collector
    // ------------------------------------------------------------------

    @Nested
    @DisplayName("Through the proxy")
    class ThroughProxy {

        private final RecordingServer upstream = new RecordingServer();
        private EventCollectorServer collector;
        private InterceptingProxyServer proxy;
        private MirrorAddon addon;

        ThroughProxy() throws Exception {
        }

        @AfterEach
        void tearDown() {
            if (proxy != null) {
                proxy.stop();
            }
            if (addon != null) {
                addon.close();
            }
            if (collector != null) {
                collector.stop();
            }
            upstream.close();
        }

        @Test
        @DisplayName("Matching batch should reach both the upstream and the collector")
        void mirroredIntoCollector() throws Exception {
            startCollector();
            HttpClient app = startProxy(MirrorTarget.of("127.0.0.1", "/batch"), collector.ingestUri(), TIMEOUT);

            HttpResponse<String> response = app.send(post(upstream.uri("/batch?x=1"),
                    "[{\"name\":\"view_item\",\"id\":1},{\"name\":\"add_to_cart\",\"id\":1}]"),
                    HttpResponse.BodyHandlers.ofString());

            assertThat(response.statusCode()).isEqualTo(201);
            assertThat(upstream.next(5_000)).isNotNull();
            try (EventVerifier verifier = new EventVerifier(collector)) {
                List<EventRecord> events = verifier.waitForCount(EventFilter.any(), 2, Duration.ofSeconds(5));
                assertThat(events).extracting(EventRecord::getName).containsExactly("view_item", "add_to_cart");
            }
            awaitTrue(() -> addon.getMirroredCount() == 1);
        }

        @Test
        @DisplayName("HTTPS batch to the target host should be decrypted and mirrored")
        void httpsMirroredIntoCollector() throws Exception {
            CertificateAuthority ca = CertificateAuthority.create();
            try (RecordingServer secureUpstream = RecordingServer.https(ca.serverContext("localhost"))) {
                startCollector();
                TlsInterception tls = TlsInterception.of(ca, List.of("localhost"))
                        .withUpstreamContext(ca.trustingContext());
                startProxy(MirrorTarget.of("localhost", "/batch"), collector.ingestUri(), TIMEOUT, tls);
                HttpClient app = HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .sslContext(ca.trustingContext())
                        .proxy(ProxySelector.of(new InetSocketAddress("127.0.0.1", proxy.getPort())))
                        .build();

                HttpResponse<String> response = app.send(post(secureUpstream.uri("/batch"),
                        "[{\"name\":\"purchase\",\"value\":9.99}]"), HttpResponse.BodyHandlers.ofString());

                assertThat(response.statusCode()).isEqualTo(201);
                assertThat(secureUpstream.next(5_000).bodyText()).isEqualTo("[{\"name\":\"purchase\",\"value\":9.99}]");
                try (EventVerifier verifier = new EventVerifier(collector)) {
                    EventRecord purchase = verifier.waitFor(EventFilter.named("purchase"));
                    assertThat(purchase.getPayload().path("value").asDouble()).isEqualTo(9.99);
                }
            }
        }

        @Test
        @DisplayName("Request to another host should reach the upstream but not the collector")
        void otherHostNotMirrored() throws Exception {
            startCollector();
            HttpClient app = startProxy(MirrorTarget.of("a.example.com", "/batch"), collector.ingestUri(), TIMEOUT);

            HttpResponse<String> response = app.send(post(upstream.uri("/batch"), "[{\"name\":\"x\"}]"),
                    HttpResponse.BodyHandlers.ofString());

            assertThat(response.statusCode()).isEqualTo(201);
            Thread.sleep(300);
            assertThat(collector.snapshot()).isEmpty();
            assertThat(addon.getMirroredCount() + addon.getFailedCount() + addon.getSkippedCount()).isZero();
        }

        @Test
        @DisplayName("Slow collector should not delay the proxied request")
        void slowCollectorDoesNotBlock() throws Exception {
            try (ServerSocket blackHole = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
                URI slow = URI.create("http://127.0.0.1:" + blackHole.getLocalPort() + "/event");
                HttpClient app = startProxy(MirrorTarget.of("127.0.0.1", "/batch"), slow, Duration.ofMillis(1500));

                long started = System.nanoTime();
                HttpResponse<String> response = app.send(post(upstream.uri("/batch"), "[{\"name\":\"x\"}]"),
                        HttpResponse.BodyHandlers.ofString());
                long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

                assertThat(response.statusCode()).isEqualTo(201);
                assertThat(elapsedMs).isLessThan(1000);
                awaitTrue(() -> addon.getFailedCount() == 1);
            }
        }

        private void startCollector() {
            CollectorSettings settings = new CollectorSettings();
            settings.setPort(0);
            collector = new EventCollectorServer(settings);
            collector.start();
        }

        private HttpClient startProxy(MirrorTarget target, URI collectorUrl, Duration timeout) {
            return startProxy(target, collectorUrl, timeout, null);
        }

        private HttpClient startProxy(MirrorTarget target, URI collectorUrl, Duration timeout, TlsInterception tls) {
            addon = new MirrorAddon(target, collectorUrl, timeout, true);
            proxy = new InterceptingProxyServer("127.0.0.1", 0, addon, tls);
            proxy.start();
            return HttpClient.newBuilder()
                    .version(HttpClient.Version.HTTP_1_1)
                    .proxy(ProxySelector.of(new InetSocketAddress("127.0.0.1", proxy.getPort())))
                    .build();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static InterceptedRequest request(String uri, String contentType, String body) {
        Map<String, List<String>> headers = contentType == null
                ? Map.of()
                : Map.of("Content-Type", List.of(contentType));
        return new InterceptedRequest("POST", URI.create(uri), headers, body.getBytes(StandardCharsets.UTF_8));
    }

    private static HttpRequest post(URI uri, String body) {
        return HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(5))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (!condition.getAsBoolean()) {
            assertThat(System.nanoTime()).as("condition not met within 10 s").isLessThan(deadline);
            Thread.sleep(25);
        }
    }
}
