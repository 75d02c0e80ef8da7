package com.eventmirror.core.store;

import com.eventmirror.core.model.EventRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only, insertion-ordered in-memory store of {@link EventRecord}s.
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Safe for concurrent appends (one per HTTP handler thread) and concurrent
 * reads (verifier polling). A batch is appended atomically: its records get
 * contiguous sequence numbers and become visible together. Readers always
 * receive an unmodifiable snapshot of fully built records.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * Created empty. Records are never evicted; the store only shrinks on
 * {@link #clear()}. Callers serialize {@code clear()} against their own
 * test boundaries.
 * </p>
 *
 * @since 1.0.0
 */
public class EventStore {

    private static final Logger LOG = LoggerFactory.getLogger(EventStore.class);

    private final List<EventRecord> events = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong batchCounter = new AtomicLong();

    /** Last sequence number handed out; survives {@link #clear()}. */
    private long lastSequence;

    /**
     * @return a fresh, strictly increasing batch identifier
     */
    public long nextBatchId() {
        return batchCounter.incrementAndGet();
    }

    /**
     * Append a batch of records, stamping each with its sequence number.
     *
     * @param batch records to append in order; must not be {@code null}
     * @return the stored records, as readers will see them
     */
    public List<EventRecord> append(List<EventRecord> batch) {
        Objects.requireNonNull(batch, "Batch must not be null");
        if (batch.isEmpty()) {
            return List.of();
        }
        List<EventRecord> stored = new ArrayList<>(batch.size());
        lock.writeLock().lock();
        try {
            for (EventRecord record : batch) {
                Objects.requireNonNull(record, "Batch must not contain null records");
                EventRecord stamped = record.toBuilder().sequence(++lastSequence).build();
                events.add(stamped);
                stored.add(stamped);
            }
        } finally {
            lock.writeLock().unlock();
        }
        LOG.debug("Appended {} event(s); store size is now {}", stored.size(), size());
        return Collections.unmodifiableList(stored);
    }

    /**
     * @return unmodifiable copy of every stored record, in insertion order
     */
    public List<EventRecord> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(events);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Records appended after the given sequence number.
     *
     * @param sequence exclusive lower bound; {@code 0} returns everything
     * @return unmodifiable list in insertion order
     */
    public List<EventRecord> since(long sequence) {
        lock.readLock().lock();
        try {
            int from = events.size();
            while (from > 0 && events.get(from - 1).getSequence() > sequence) {
                from--;
            }
            return List.copyOf(events.subList(from, events.size()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the most recently appended record, if any
     */
    public Optional<EventRecord> last() {
        lock.readLock().lock();
        try {
            return events.isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return events.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Remove every record. Calling this on an empty store is a no-op.
     *
     * @return number of records removed
     */
    public int clear() {
        int removed;
        lock.writeLock().lock();
        try {
            removed = events.size();
            events.clear();
        } finally {
            lock.writeLock().unlock();
        }
        LOG.info("Event store cleared ({} record(s) removed)", removed);
        return removed;
    }
}
