package com.eventmirror.server;

import com.eventmirror.core.model.EventFilter;
import com.eventmirror.core.model.EventRecord;
import com.eventmirror.core.net.PortCheck;
import com.eventmirror.core.verify.EventVerifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CollectorClient} against a running collector.
 */
class CollectorClientTest {

    private EventCollectorServer server;
    private CollectorClient client;

    @BeforeEach
    void setUp() {
        server = new EventCollectorServer(EventCollectorServerTest.ephemeralSettings());
        server.start();
        client = new CollectorClient(server.baseUri());
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("Should report a running collector as healthy")
    void shouldReportHealthy() {
        assertThat(client.isHealthy()).isTrue();
        client.awaitHealthy(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("Should give up waiting for a collector that is not there")
    void shouldTimeOutOnMissingCollector() {
        CollectorClient absent = new CollectorClient(URI.create("http://127.0.0.1:" + PortCheck.freePort()));

        assertThat(absent.isHealthy()).isFalse();
        assertThatThrownBy(() -> absent.awaitHealthy(Duration.ofMillis(300)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not healthy");
    }

    @Test
    @DisplayName("Snapshot over HTTP should equal the server's own snapshot")
    void snapshotShouldMatchServer() {
        assertThat(client.postBatch("[{\"name\":\"view_item\",\"item\":{\"id\":42}},{\"name\":\"scroll\"}]"))
                .isEqualTo(2);

        List<EventRecord> remote = client.snapshot();

        assertThat(remote).isEqualTo(server.snapshot());
        assertThat(remote.get(0).getPayload().path("item").path("id").asInt()).isEqualTo(42);
    }

    @Test
    @DisplayName("since and reset should map to the query endpoints")
    void sinceAndResetShouldWork() {
        client.postBatch("[{\"name\":\"a\"},{\"name\":\"b\"},{\"name\":\"c\"}]");

        assertThat(client.since(2)).extracting(EventRecord::getName).containsExactly("c");
        assertThat(client.reset()).isEqualTo(3);
        assertThat(client.snapshot()).isEmpty();
    }

    @Test
    @DisplayName("Should surface a rejected batch as an error")
    void shouldSurfaceRejectedBatch() {
        assertThatThrownBy(() -> client.postBatch("{oops"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("400");
    }

    @Test
    @DisplayName("A verifier should work against the collector over HTTP")
    void verifierShouldWorkOverHttp() {
        try (EventVerifier verifier = new EventVerifier(client, Duration.ofMillis(50), Clock.systemUTC())) {
            EventRecord match = verifier.correlateWithAction(
                    () -> client.postBatch("{\"name\":\"add_to_cart\",\"sku\":\"A-1\"}"),
                    EventFilter.named("add_to_cart"),
                    Duration.ZERO,
                    Duration.ofSeconds(5));

            assertThat(match.getPayload().path("sku").asText()).isEqualTo("A-1");
        }
    }
}
