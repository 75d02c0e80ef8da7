package com.eventmirror.core.store;

import com.eventmirror.core.model.EventRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EventStore}.
 */
class EventStoreTest {

    private EventStore store;

    @BeforeEach
    void setUp() {
        store = new EventStore();
    }

    @Test
    @DisplayName("Should stamp contiguous sequence numbers in batch order")
    void shouldStampSequenceNumbers() {
        List<EventRecord> stored = store.append(List.of(record("a", 1), record("b", 1)));
        store.append(List.of(record("c", 2)));

        assertThat(stored).extracting(EventRecord::getSequence).containsExactly(1L, 2L);
        assertThat(store.snapshot())
                .extracting(EventRecord::getName)
                .containsExactly("a", "b", "c");
        assertThat(store.last()).get().extracting(EventRecord::getSequence).isEqualTo(3L);
    }

    @Test
    @DisplayName("Should return an unaffected snapshot after later appends")
    void shouldReturnStableSnapshot() {
        store.append(List.of(record("a", 1)));
        List<EventRecord> snapshot = store.snapshot();

        store.append(List.of(record("b", 2)));

        assertThat(snapshot).hasSize(1);
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should return only records after the given sequence")
    void shouldReturnRecordsSince() {
        store.append(List.of(record("a", 1), record("b", 1), record("c", 2)));

        assertThat(store.since(1)).extracting(EventRecord::getName).containsExactly("b", "c");
        assertThat(store.since(0)).hasSize(3);
        assertThat(store.since(3)).isEmpty();
    }

    @Test
    @DisplayName("Clear should be idempotent and keep sequence numbers increasing")
    void clearShouldBeIdempotent() {
        store.append(List.of(record("a", 1), record("b", 1)));

        assertThat(store.clear()).isEqualTo(2);
        assertThat(store.clear()).isZero();
        assertThat(store.snapshot()).isEmpty();
        assertThat(store.last()).isEmpty();

        List<EventRecord> stored = store.append(List.of(record("c", 2)));
        assertThat(stored.get(0).getSequence()).isEqualTo(3L);
    }

    @Test
    @DisplayName("Should ignore an empty batch")
    void shouldIgnoreEmptyBatch() {
        assertThat(store.append(List.of())).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("Should hand out strictly increasing batch ids")
    void shouldHandOutBatchIds() {
        long first = store.nextBatchId();
        long second = store.nextBatchId();

        assertThat(second).isGreaterThan(first);
    }

    @Test
    @DisplayName("Concurrent batches should not interleave or lose records")
    void concurrentBatchesShouldStayContiguous() throws Exception {
        int writers = 8;
        int batchSize = 50;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<EventRecord>>> results = new ArrayList<>();
        try {
            for (int w = 0; w < writers; w++) {
                long batchId = store.nextBatchId();
                results.add(pool.submit(() -> {
                    start.await();
                    List<EventRecord> batch = new ArrayList<>();
                    for (int i = 0; i < batchSize; i++) {
                        batch.add(record("e" + i, batchId));
                    }
                    return store.append(batch);
                }));
            }
            start.countDown();

            for (Future<List<EventRecord>> result : results) {
                List<EventRecord> stored = result.get(10, TimeUnit.SECONDS);
                long first = stored.get(0).getSequence();
                assertThat(stored).extracting(EventRecord::getSequence)
                        .containsExactlyElementsOf(rangeFrom(first, batchSize));
            }
        } finally {
            pool.shutdownNow();
        }

        List<EventRecord> all = store.snapshot();
        assertThat(all).hasSize(writers * batchSize);
        assertThat(all).extracting(EventRecord::getSequence)
                .containsExactlyElementsOf(rangeFrom(1, writers * batchSize));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static EventRecord record(String name, long batchId) {
        return EventRecord.builder()
                .name(name)
                .receivedAt(Instant.now())
                .sourceBatchId(batchId)
                .build();
    }

    private static List<Long> rangeFrom(long first, int count) {
        List<Long> values = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            values.add(first + i);
        }
        return values;
    }
}
