package com.eventmirror.core.verify;

import com.eventmirror.core.model.EventFilter;
import com.eventmirror.core.model.EventRecord;
import com.eventmirror.core.store.EventSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Query and assertion layer over an {@link EventSource}.
 *
 * <p>
 * Mirrored events arrive asynchronously relative to the UI actions that
 * cause them, so every check here polls the source until a match shows up
 * or an explicit timeout elapses. A single-shot lookup would be flaky.
 * </p>
 *
 * <h3>Operations</h3>
 * <ul>
 * <li>{@link #queryAll(EventFilter)} – snapshot of all current matches</li>
 * <li>{@link #waitFor(EventFilter, Duration, Duration)} – first match by
 * insertion order, or {@link EventWaitTimeoutException}</li>
 * <li>{@link #assertContains(EventFilter, Duration)} – same, failing with a
 * descriptive {@link EventAssertionError}</li>
 * <li>{@link #correlateWithAction(Runnable, EventFilter, Duration, Duration)}
 * – only events received after the action started count</li>
 * <li>{@link #checkAsync(EventFilter, Duration)} /
 * {@link #awaitAll()} – background checks aggregated at the end of a
 * test</li>
 * </ul>
 *
 * <h3>Consuming matches</h3>
 * <p>
 * The {@code consume} variants claim the event they return: later consuming
 * waits on the same verifier skip it, so two identical checks need two
 * events. Non-consuming waits always see every stored event.
 * {@link #releaseConsumed()} forgets all claims.
 * </p>
 *
 * <h3>Cancellation</h3>
 * <p>
 * {@link #cancel()} wakes every in-flight wait, which then throws
 * {@link EventWaitCancelledException}. {@link #close()} additionally rejects
 * new waits and stops the background worker. Interrupting a waiting thread
 * has the same effect as cancelling it; the interrupt flag is restored.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Thread-safe. The verifier keeps no copy of the events; its only state is
 * the set of sequences claimed by consuming waits.
 * </p>
 *
 * @since 1.0.0
 */
public class EventVerifier implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(EventVerifier.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(250);

    /** Maximum number of observed events listed in a failure message. */
    public static final int MAX_SUMMARY_EVENTS = 20;

    private final EventSource source;
    private final Duration pollInterval;
    private final Clock clock;

    private final AtomicReference<CountDownLatch> cancelSignal =
            new AtomicReference<>(new CountDownLatch(1));
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final Set<Long> consumed = ConcurrentHashMap.newKeySet();

    private final ExecutorService checkWorker;
    private final List<PendingCheck> pendingChecks = new ArrayList<>();

    /**
     * @param source collector query surface; must not be {@code null}
     */
    public EventVerifier(EventSource source) {
        this(source, DEFAULT_POLL_INTERVAL, Clock.systemUTC());
    }

    /**
     * @param source       collector query surface; must not be {@code null}
     * @param pollInterval default interval between polls; must be positive
     * @param clock        clock used to timestamp UI actions
     * @throws IllegalArgumentException if {@code pollInterval} is not positive
     */
    public EventVerifier(EventSource source, Duration pollInterval, Clock clock) {
        this.source = Objects.requireNonNull(source, "EventSource must not be null");
        this.pollInterval = requirePositive(pollInterval, "pollInterval");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");

        AtomicInteger threadIds = new AtomicInteger();
        this.checkWorker = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "event-check-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * Return every stored event matching {@code filter}.
     *
     * @param filter query; must not be {@code null}
     * @return ordered, finite snapshot of matches
     */
    public List<EventRecord> queryAll(EventFilter filter) {
        Objects.requireNonNull(filter, "Filter must not be null");
        return source.queryAll(filter);
    }

    // ---------------------------------------------------------------
    // Waiting
    // ---------------------------------------------------------------

    /**
     * Wait using the default timeout and poll interval.
     *
     * @see #waitFor(EventFilter, Duration, Duration)
     */
    public EventRecord waitFor(EventFilter filter) {
        return waitFor(filter, DEFAULT_TIMEOUT, pollInterval);
    }

    /**
     * Poll the source until an event matches {@code filter}.
     *
     * <p>
     * The source is queried immediately, then every {@code pollInterval}
     * until {@code timeout} elapses. On timeout the failure is raised no
     * earlier than {@code timeout} and no later than one poll interval after
     * it. Transient query failures are logged and retried until the deadline.
     * </p>
     *
     * @param filter       query; must not be {@code null}
     * @param timeout      maximum wait; zero means a single check
     * @param pollInterval delay between queries; must be positive
     * @return the earliest matching event by insertion order
     * @throws EventWaitTimeoutException   if nothing matched in time
     * @throws EventWaitCancelledException if the wait was cancelled or
     *                                     interrupted
     */
    public EventRecord waitFor(EventFilter filter, Duration timeout, Duration pollInterval) {
        return waitFor(filter, timeout, pollInterval, false);
    }

    /**
     * Same as {@link #waitFor(EventFilter, Duration, Duration)}; with
     * {@code consume} set, events claimed by earlier consuming waits are
     * skipped and the returned event is claimed.
     *
     * @param filter       query; must not be {@code null}
     * @param timeout      maximum wait; zero means a single check
     * @param pollInterval delay between queries; must be positive
     * @param consume      whether to skip and claim matched events
     * @return the earliest eligible matching event by insertion order
     * @throws EventWaitTimeoutException   if nothing eligible matched in time
     * @throws EventWaitCancelledException if the wait was cancelled or
     *                                     interrupted
     */
    public EventRecord waitFor(EventFilter filter, Duration timeout, Duration pollInterval, boolean consume) {
        Objects.requireNonNull(filter, "Filter must not be null");
        requireNonNegative(timeout, "timeout");
        requirePositive(pollInterval, "pollInterval");
        CountDownLatch signal = activeSignal(filter);

        LOG.debug("Waiting up to {} for {}", timeout, filter.describe());
        long deadline = System.nanoTime() + timeout.toNanos();
        RuntimeException lastFailure = null;

        while (true) {
            try {
                EventRecord match = firstEligible(source.queryAll(filter), consume);
                if (match != null) {
                    LOG.info("Matched {} for {}", match.summary(), filter.describe());
                    return match;
                }
            } catch (RuntimeException e) {
                LOG.warn("Event query failed, retrying: {}", e.getMessage());
                lastFailure = e;
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw timeout(filter, timeout, lastFailure);
            }
            pause(signal, Math.min(remaining, pollInterval.toNanos()), filter);
        }
    }

    /**
     * Wait until at least {@code count} events match.
     *
     * @param filter  query; must not be {@code null}
     * @param count   minimum number of matches; must be positive
     * @param timeout maximum wait
     * @return all matches present when the count was reached, in order
     * @throws EventWaitTimeoutException   if fewer matched in time
     * @throws EventWaitCancelledException if the wait was cancelled
     */
    public List<EventRecord> waitForCount(EventFilter filter, int count, Duration timeout) {
        Objects.requireNonNull(filter, "Filter must not be null");
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1, got: " + count);
        }
        requireNonNegative(timeout, "timeout");
        CountDownLatch signal = activeSignal(filter);

        long deadline = System.nanoTime() + timeout.toNanos();
        int seen = 0;
        while (true) {
            List<EventRecord> matches = source.queryAll(filter);
            seen = matches.size();
            if (seen >= count) {
                return matches;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                EventWaitTimeoutException e = timeout(filter, timeout, null);
                throw new EventWaitTimeoutException(
                        "Expected " + count + " event(s) but saw " + seen + ". " + e.getMessage(),
                        filter, timeout, e.getObserved(), e.getObservedTotal(), null);
            }
            pause(signal, Math.min(remaining, pollInterval.toNanos()), filter);
        }
    }

    // ---------------------------------------------------------------
    // Assertions
    // ---------------------------------------------------------------

    /**
     * Assert that a matching event appears within {@code timeout}.
     *
     * @param filter  query; must not be {@code null}
     * @param timeout maximum wait
     * @return the matching event
     * @throws EventAssertionError if nothing matched; the message lists the
     *                             events observed in the filter's window
     */
    public EventRecord assertContains(EventFilter filter, Duration timeout) {
        return assertContains(filter, timeout, false);
    }

    /**
     * @param consume whether to skip and claim matched events
     * @see #assertContains(EventFilter, Duration)
     * @see #waitFor(EventFilter, Duration, Duration, boolean)
     */
    public EventRecord assertContains(EventFilter filter, Duration timeout, boolean consume) {
        try {
            return waitFor(filter, timeout, pollInterval, consume);
        } catch (EventWaitTimeoutException e) {
            throw new EventAssertionError(e.getMessage(), e);
        }
    }

    /**
     * Assert that no matching event appears during {@code duration}.
     *
     * @param filter   query; must not be {@code null}
     * @param duration how long to keep watching
     * @throws EventAssertionError if a matching event is seen
     */
    public void assertAbsent(EventFilter filter, Duration duration) {
        Objects.requireNonNull(filter, "Filter must not be null");
        requireNonNegative(duration, "duration");
        CountDownLatch signal = activeSignal(filter);

        long deadline = System.nanoTime() + duration.toNanos();
        while (true) {
            List<EventRecord> matches = source.queryAll(filter);
            if (!matches.isEmpty()) {
                throw new EventAssertionError("Unexpected event(s) matching " + filter.describe() + ":"
                        + summarize(matches, matches.size()));
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return;
            }
            pause(signal, Math.min(remaining, pollInterval.toNanos()), filter);
        }
    }

    /**
     * Run a UI action and wait for an event it caused.
     *
     * <p>
     * Sleeps {@code preDelay} first so traffic from earlier actions can land,
     * records the start instant, runs {@code action}, then waits for a match
     * received at or after that instant. Events received before the action
     * started are never returned. Exceptions thrown by the action propagate
     * unchanged.
     * </p>
     *
     * @param action      the UI action, e.g. a scroll; must not be {@code null}
     * @param filter      query; must not be {@code null}
     * @param preDelay    settle time before the action; may be zero
     * @param postTimeout maximum wait after the action returns
     * @return the first event matching {@code filter} since the action start
     * @throws EventWaitTimeoutException   if nothing matched in time
     * @throws EventWaitCancelledException if the wait was cancelled
     */
    public EventRecord correlateWithAction(Runnable action, EventFilter filter,
                                           Duration preDelay, Duration postTimeout) {
        Objects.requireNonNull(action, "Action must not be null");
        Objects.requireNonNull(filter, "Filter must not be null");
        requireNonNegative(preDelay, "preDelay");
        requireNonNegative(postTimeout, "postTimeout");

        if (!preDelay.isZero()) {
            pause(activeSignal(filter), preDelay.toNanos(), filter);
        }
        Instant actionStart = clock.instant();
        LOG.debug("Running UI action at {}", actionStart);
        action.run();

        return waitFor(filter.withWindowFrom(actionStart), postTimeout, pollInterval);
    }

    // ---------------------------------------------------------------
    // Background checks
    // ---------------------------------------------------------------

    /**
     * Start a {@link #waitFor} on the verifier's worker and return at once.
     *
     * <p>
     * The result is also tracked so {@link #awaitAll()} can report every
     * failure together at the end of the test.
     * </p>
     *
     * @param filter  query; must not be {@code null}
     * @param timeout maximum wait
     * @return future completing with the match, or exceptionally
     */
    public CompletableFuture<EventRecord> checkAsync(EventFilter filter, Duration timeout) {
        return checkAsync(filter, timeout, false);
    }

    /**
     * @param consume whether to skip and claim matched events
     * @see #checkAsync(EventFilter, Duration)
     */
    public CompletableFuture<EventRecord> checkAsync(EventFilter filter, Duration timeout, boolean consume) {
        Objects.requireNonNull(filter, "Filter must not be null");
        requireNonNegative(timeout, "timeout");
        ensureOpen(filter);

        CompletableFuture<EventRecord> future = CompletableFuture.supplyAsync(
                () -> waitFor(filter, timeout, pollInterval, consume), checkWorker);
        synchronized (pendingChecks) {
            pendingChecks.add(new PendingCheck(filter, future));
        }
        return future;
    }

    /**
     * Wait for every check started with {@link #checkAsync} and clear the list.
     *
     * @throws EventAssertionError listing every failed check, if any failed
     */
    public void awaitAll() {
        List<PendingCheck> checks;
        synchronized (pendingChecks) {
            checks = new ArrayList<>(pendingChecks);
            pendingChecks.clear();
        }

        List<String> failures = new ArrayList<>();
        for (int i = 0; i < checks.size(); i++) {
            PendingCheck check = checks.get(i);
            try {
                check.future.join();
            } catch (CompletionException | CancellationException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                failures.add("[" + i + "] " + check.filter.describe() + ": " + cause.getMessage());
            }
        }

        if (!failures.isEmpty()) {
            throw new EventAssertionError(failures.size() + " of " + checks.size()
                    + " background event check(s) failed:\n  - " + String.join("\n  - ", failures));
        }
    }

    /**
     * @param event a stored event
     * @return {@code true} if a consuming wait has claimed it
     */
    public boolean isConsumed(EventRecord event) {
        return consumed.contains(event.getSequence());
    }

    public int getConsumedCount() {
        return consumed.size();
    }

    /**
     * Forget every claim made by consuming waits.
     */
    public void releaseConsumed() {
        consumed.clear();
    }

    // ---------------------------------------------------------------
    // Cancellation
    // ---------------------------------------------------------------

    /**
     * Abort every wait currently in progress. Later waits are unaffected.
     */
    public void cancel() {
        cancelSignal.getAndSet(new CountDownLatch(1)).countDown();
    }

    /**
     * Cancel in-flight waits, reject new ones and stop the background worker.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            cancel();
            checkWorker.shutdownNow();
            LOG.debug("Event verifier closed");
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private EventRecord firstEligible(List<EventRecord> matches, boolean consume) {
        for (EventRecord candidate : matches) {
            // add() fails when a concurrent consuming wait claimed it first
            if (!consume || consumed.add(candidate.getSequence())) {
                return candidate;
            }
        }
        return null;
    }

    private CountDownLatch activeSignal(EventFilter filter) {
        ensureOpen(filter);
        return cancelSignal.get();
    }

    private void ensureOpen(EventFilter filter) {
        if (closed.get()) {
            throw new EventWaitCancelledException("Verifier is closed; not waiting for " + filter.describe());
        }
    }

    private void pause(CountDownLatch signal, long nanos, EventFilter filter) {
        try {
            if (signal.await(nanos, TimeUnit.NANOSECONDS)) {
                throw new EventWaitCancelledException("Wait cancelled for " + filter.describe());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventWaitCancelledException("Wait interrupted for " + filter.describe(), e);
        }
    }

    private EventWaitTimeoutException timeout(EventFilter filter, Duration timeout, RuntimeException lastFailure) {
        StringBuilder message = new StringBuilder()
                .append("No event matching ").append(filter.describe())
                .append(" within ").append(timeout.toMillis()).append(" ms; window ")
                .append(filter.describeWindow()).append(". ");

        List<EventRecord> inWindow = List.of();
        try {
            inWindow = source.snapshot().stream()
                    .filter(e -> filter.inWindow(e.getReceivedAt()))
                    .collect(Collectors.toList());
            message.append("Observed ").append(inWindow.size()).append(" event(s) in window:")
                    .append(summarize(inWindow, inWindow.size()));
        } catch (RuntimeException e) {
            message.append("Observed events unavailable: ").append(e.getMessage());
            if (lastFailure == null) {
                lastFailure = e;
            }
        }

        LOG.warn("Event wait timed out: {}", filter.describe());
        List<EventRecord> capped = inWindow.subList(0, Math.min(inWindow.size(), MAX_SUMMARY_EVENTS));
        return new EventWaitTimeoutException(message.toString(), filter, timeout, capped, inWindow.size(), lastFailure);
    }

    private static String summarize(List<EventRecord> events, int total) {
        if (events.isEmpty()) {
            return " none";
        }
        String listed = events.stream()
                .limit(MAX_SUMMARY_EVENTS)
                .map(EventRecord::summary)
                .collect(Collectors.joining("\n  ", "\n  ", ""));
        return total > MAX_SUMMARY_EVENTS
                ? listed + "\n  ... and " + (total - MAX_SUMMARY_EVENTS) + " more"
                : listed;
    }

    private static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
        return value;
    }

    private static void requireNonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative, got: " + value);
        }
    }

    private static final class PendingCheck {
        private final EventFilter filter;
        private final CompletableFuture<EventRecord> future;

        private PendingCheck(EventFilter filter, CompletableFuture<EventRecord> future) {
            this.filter = filter;
            this.future = future;
        }
    }
}
