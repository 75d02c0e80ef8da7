package com.eventmirror.core.verify;

import com.eventmirror.core.model.EventFilter;
import com.eventmirror.core.model.EventRecord;
import com.eventmirror.core.model.NameMatch;
import com.eventmirror.core.store.EventSource;
import com.eventmirror.core.store.EventStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EventVerifier}.
 */
class EventVerifierTest {

    private static final Duration POLL = Duration.ofMillis(50);

    private StoreSource source;
    private EventVerifier verifier;

    @BeforeEach
    void setUp() {
        source = new StoreSource();
        verifier = new EventVerifier(source, POLL, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        verifier.close();
    }

    // ------------------------------------------------------------------
    // waitFor
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should return an already stored match on the first poll")
    void shouldReturnExistingMatch() {
        source.add("view_item", Instant.now());

        EventRecord match = verifier.waitFor(EventFilter.named("view_item"), Duration.ZERO, POLL);

        assertThat(match.getName()).isEqualTo("view_item");
        assertThat(match.getSequence()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Should return the earliest match by insertion order")
    void shouldReturnEarliestMatch() {
        source.add("scroll", Instant.now());
        source.add("scroll", Instant.now());

        EventRecord match = verifier.waitFor(EventFilter.named("scroll"), Duration.ZERO, POLL);

        assertThat(match.getSequence()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Should find an event that arrives while polling")
    void shouldFindLateEvent() {
        CompletableFuture.runAsync(() -> {
            sleep(200);
            source.add("purchase", Instant.now());
        });

        EventRecord match = verifier.waitFor(EventFilter.named("purchase"), Duration.ofSeconds(5), POLL);

        assertThat(match.getName()).isEqualTo("purchase");
    }

    @Test
    @DisplayName("Timeout should fire no earlier than the timeout and about one poll after it")
    void timeoutShouldRespectBounds() {
        Duration timeout = Duration.ofMillis(300);
        long start = System.nanoTime();

        assertThatThrownBy(() -> verifier.waitFor(EventFilter.named("never"), timeout, POLL))
                .isInstanceOf(EventWaitTimeoutException.class)
                .hasMessageContaining("No event matching name exact 'never' within 300 ms")
                .hasMessageContaining("Observed 0 event(s) in window: none");

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(300L).isLessThan(1_500L);
    }

    @Test
    @DisplayName("Timeout failure should list a capped summary of observed events")
    void timeoutShouldSummarizeObservedEvents() {
        for (int i = 0; i < 25; i++) {
            source.add("other_" + i, Instant.now());
        }

        EventWaitTimeoutException failure = catchTimeout(EventFilter.named("missing"), Duration.ZERO);

        assertThat(failure.getObservedTotal()).isEqualTo(25);
        assertThat(failure.getObserved()).hasSize(EventVerifier.MAX_SUMMARY_EVENTS);
        assertThat(failure.getMessage())
                .contains("Observed 25 event(s) in window")
                .contains("other_0")
                .contains("... and 5 more")
                .doesNotContain("other_24");
    }

    @Test
    @DisplayName("Should retry after a transient query failure")
    void shouldRetryTransientFailures() {
        source.add("tap", Instant.now());
        source.failNextQueries(2);

        EventRecord match = verifier.waitFor(EventFilter.named("tap"), Duration.ofSeconds(5), POLL);

        assertThat(match.getName()).isEqualTo("tap");
        assertThat(source.queries()).isGreaterThanOrEqualTo(3);
    }

    @Test
    @DisplayName("Should keep the last query failure as the timeout cause")
    void shouldKeepLastQueryFailure() {
        source.failNextQueries(1_000);

        EventWaitTimeoutException failure = catchTimeout(EventFilter.named("tap"), Duration.ofMillis(100));

        assertThat(failure.getCause()).isInstanceOf(IllegalStateException.class);
        assertThat(failure.getMessage()).contains("Observed events unavailable");
    }

    // ------------------------------------------------------------------
    // Assertions
    // ------------------------------------------------------------------

    @Test
    @DisplayName("assertContains should fail with an assertion error")
    void assertContainsShouldFailAsAssertion() {
        source.add("screen_view", Instant.now());

        assertThatThrownBy(() -> verifier.assertContains(EventFilter.named("screen_vew"), Duration.ofMillis(100)))
                .isInstanceOf(EventAssertionError.class)
                .hasCauseInstanceOf(EventWaitTimeoutException.class)
                .hasMessageContaining("screen_view");
    }

    @Test
    @DisplayName("assertAbsent should pass on silence and fail on a match")
    void assertAbsentShouldDetectMatches() {
        EventFilter errors = EventFilter.builder().nameMatches("error", NameMatch.CONTAINS).build();

        assertThatCode(() -> verifier.assertAbsent(errors, Duration.ofMillis(100))).doesNotThrowAnyException();

        source.add("app_error", Instant.now());
        assertThatThrownBy(() -> verifier.assertAbsent(errors, Duration.ofMillis(100)))
                .isInstanceOf(EventAssertionError.class)
                .hasMessageContaining("app_error");
    }

    @Test
    @DisplayName("waitForCount should wait for enough matches")
    void waitForCountShouldWaitForEnoughMatches() {
        for (int i = 0; i < 3; i++) {
            source.add("impression", Instant.now());
        }

        assertThat(verifier.waitForCount(EventFilter.named("impression"), 3, Duration.ZERO)).hasSize(3);
        assertThatThrownBy(() -> verifier.waitForCount(EventFilter.named("impression"), 5, Duration.ofMillis(100)))
                .isInstanceOf(EventWaitTimeoutException.class)
                .hasMessageStartingWith("Expected 5 event(s) but saw 3.");
    }

    // ------------------------------------------------------------------
    // Consuming matches
    // ------------------------------------------------------------------

    @Test
    @DisplayName("A consumed event should not satisfy a second consuming wait")
    void consumedEventShouldNotMatchTwice() {
        source.add("add_to_cart", Instant.now());
        EventFilter filter = EventFilter.named("add_to_cart");

        EventRecord first = verifier.assertContains(filter, Duration.ZERO, true);

        assertThat(verifier.isConsumed(first)).isTrue();
        assertThatThrownBy(() -> verifier.assertContains(filter, Duration.ofMillis(100), true))
                .isInstanceOf(EventAssertionError.class)
                .hasCauseInstanceOf(EventWaitTimeoutException.class);
    }

    @Test
    @DisplayName("Consuming waits should walk through repeated events in order")
    void consumingWaitsShouldAdvance() {
        source.add("scroll", Instant.now());
        source.add("scroll", Instant.now());
        EventFilter filter = EventFilter.named("scroll");

        assertThat(verifier.assertContains(filter, Duration.ZERO, true).getSequence()).isEqualTo(1L);
        assertThat(verifier.assertContains(filter, Duration.ZERO, true).getSequence()).isEqualTo(2L);
        assertThat(verifier.getConsumedCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Non-consuming waits should still see consumed events")
    void plainWaitShouldIgnoreClaims() {
        source.add("login", Instant.now());
        EventFilter filter = EventFilter.named("login");
        verifier.assertContains(filter, Duration.ZERO, true);

        assertThat(verifier.assertContains(filter, Duration.ZERO).getSequence()).isEqualTo(1L);
        assertThat(verifier.waitFor(filter, Duration.ZERO, POLL).getSequence()).isEqualTo(1L);
    }

    @Test
    @DisplayName("releaseConsumed should make consumed events eligible again")
    void releaseShouldForgetClaims() {
        source.add("purchase", Instant.now());
        EventFilter filter = EventFilter.named("purchase");
        verifier.assertContains(filter, Duration.ZERO, true);

        verifier.releaseConsumed();

        assertThat(verifier.getConsumedCount()).isZero();
        assertThat(verifier.assertContains(filter, Duration.ZERO, true).getSequence()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Consuming background checks should claim distinct events")
    void consumingChecksShouldClaimDistinctEvents() {
        CompletableFuture<EventRecord> a = verifier.checkAsync(EventFilter.named("impression"), Duration.ofSeconds(5), true);
        CompletableFuture<EventRecord> b = verifier.checkAsync(EventFilter.named("impression"), Duration.ofSeconds(5), true);
        source.add("impression", Instant.now());
        source.add("impression", Instant.now());

        assertThatCode(verifier::awaitAll).doesNotThrowAnyException();
        assertThat(a.join().getSequence()).isNotEqualTo(b.join().getSequence());
    }

    // ------------------------------------------------------------------
    // Correlation
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Correlation should ignore events received before the action")
    void correlationShouldIgnoreEarlierEvents() {
        source.add("scroll", Instant.now().minusSeconds(1));

        EventRecord match = verifier.correlateWithAction(
                () -> source.add("scroll", Instant.now()),
                EventFilter.named("scroll"), Duration.ZERO, Duration.ofSeconds(2));

        assertThat(match.getSequence()).isEqualTo(2L);
    }

    @Test
    @DisplayName("Correlation should time out when only earlier events match")
    void correlationShouldTimeOutOnStaleEvents() {
        source.add("scroll", Instant.now().minusSeconds(1));

        assertThatThrownBy(() -> verifier.correlateWithAction(
                () -> { }, EventFilter.named("scroll"), Duration.ofMillis(20), Duration.ofMillis(200)))
                .isInstanceOf(EventWaitTimeoutException.class)
                .hasMessageContaining("Observed 0 event(s) in window");
    }

    @Test
    @DisplayName("Exceptions from the action should propagate unchanged")
    void actionExceptionShouldPropagate() {
        IllegalStateException boom = new IllegalStateException("element not found");

        assertThatThrownBy(() -> verifier.correlateWithAction(
                () -> { throw boom; }, EventFilter.any(), Duration.ZERO, Duration.ofSeconds(1)))
                .isSameAs(boom);
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    @Test
    @DisplayName("cancel should wake an in-flight wait")
    void cancelShouldWakeWaiters() throws Exception {
        CompletableFuture<EventRecord> wait = CompletableFuture.supplyAsync(
                () -> verifier.waitFor(EventFilter.named("never"), Duration.ofSeconds(30), POLL));
        assertThat(source.awaitFirstQuery()).isTrue();

        verifier.cancel();

        assertThatThrownBy(() -> wait.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(EventWaitCancelledException.class);

        source.add("after_cancel", Instant.now());
        assertThat(verifier.waitFor(EventFilter.named("after_cancel"), Duration.ZERO, POLL)).isNotNull();
    }

    @Test
    @DisplayName("A closed verifier should reject new waits")
    void closedVerifierShouldRejectWaits() {
        verifier.close();

        assertThatThrownBy(() -> verifier.waitFor(EventFilter.any(), Duration.ZERO, POLL))
                .isInstanceOf(EventWaitCancelledException.class);
        assertThatThrownBy(() -> verifier.checkAsync(EventFilter.any(), Duration.ZERO))
                .isInstanceOf(EventWaitCancelledException.class);
    }

    @Test
    @DisplayName("Interrupting a wait should cancel it and keep the interrupt flag")
    void interruptShouldCancelWait() {
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> verifier.waitFor(EventFilter.named("never"), Duration.ofSeconds(1), POLL))
                    .isInstanceOf(EventWaitCancelledException.class)
                    .hasCauseInstanceOf(InterruptedException.class);
        } finally {
            assertThat(Thread.interrupted()).isTrue();
        }
    }

    // ------------------------------------------------------------------
    // Background checks
    // ------------------------------------------------------------------

    @Test
    @DisplayName("awaitAll should pass when every background check matched")
    void awaitAllShouldPassWhenAllMatch() {
        CompletableFuture<EventRecord> check = verifier.checkAsync(EventFilter.named("login"), Duration.ofSeconds(5));
        source.add("login", Instant.now());

        assertThatCode(verifier::awaitAll).doesNotThrowAnyException();
        assertThat(check.join().getName()).isEqualTo("login");
    }

    @Test
    @DisplayName("awaitAll should report every failed background check")
    void awaitAllShouldAggregateFailures() {
        verifier.checkAsync(EventFilter.named("login"), Duration.ofSeconds(5));
        verifier.checkAsync(EventFilter.named("logout"), Duration.ofMillis(100));
        source.add("login", Instant.now());

        assertThatThrownBy(verifier::awaitAll)
                .isInstanceOf(EventAssertionError.class)
                .hasMessageContaining("1 of 2 background event check(s) failed")
                .hasMessageContaining("logout");

        assertThatCode(verifier::awaitAll).doesNotThrowAnyException();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private EventWaitTimeoutException catchTimeout(EventFilter filter, Duration timeout) {
        try {
            verifier.waitFor(filter, timeout, POLL);
        } catch (EventWaitTimeoutException e) {
            return e;
        }
        throw new AssertionError("Expected a timeout for " + filter.describe());
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * In-memory source that can simulate query failures.
     */
    private static final class StoreSource implements EventSource {
        private final EventStore store = new EventStore();
        private final AtomicInteger failuresLeft = new AtomicInteger();
        private final AtomicInteger queries = new AtomicInteger();
        private final CountDownLatch firstQuery = new CountDownLatch(1);

        void add(String name, Instant receivedAt) {
            List<EventRecord> batch = new ArrayList<>();
            batch.add(EventRecord.builder()
                    .name(name)
                    .receivedAt(receivedAt)
                    .sourceBatchId(store.nextBatchId())
                    .build());
            store.append(batch);
        }

        void failNextQueries(int count) {
            failuresLeft.set(count);
        }

        int queries() {
            return queries.get();
        }

        boolean awaitFirstQuery() throws InterruptedException {
            return firstQuery.await(5, TimeUnit.SECONDS);
        }

        @Override
        public List<EventRecord> snapshot() {
            queries.incrementAndGet();
            firstQuery.countDown();
            if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new IllegalStateException("collector unreachable");
            }
            return store.snapshot();
        }

        @Override
        public int reset() {
            return store.clear();
        }
    }
}
