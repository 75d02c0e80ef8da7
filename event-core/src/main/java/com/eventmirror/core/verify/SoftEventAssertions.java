package com.eventmirror.core.verify;

import com.eventmirror.core.match.JsonMatchers;
import com.eventmirror.core.model.EventFilter;
import com.eventmirror.core.model.EventRecord;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Collects event assertion failures instead of throwing on the first one.
 *
 * <p>
 * Every check records its failure message and lets the test carry on.
 * {@link #assertAll()}, or {@link #close()} at the end of a
 * try-with-resources block, raises one {@link EventAssertionError} listing
 * them all.
 * </p>
 *
 * <pre>{@code
 * try (SoftEventAssertions soft = new SoftEventAssertions(verifier)) {
 *     soft.contains(EventFilter.named("view_item"), Duration.ofSeconds(5));
 *     soft.contains(EventFilter.named("add_to_cart"), Duration.ofSeconds(5));
 * }
 * }</pre>
 *
 * <p>
 * Cancellation is never collected; {@link EventWaitCancelledException}
 * propagates immediately.
 * </p>
 *
 * @since 1.0.0
 */
public class SoftEventAssertions implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SoftEventAssertions.class);

    private final EventVerifier verifier;
    private final List<String> failures = new CopyOnWriteArrayList<>();

    /**
     * @param verifier verifier used by the event checks; must not be
     *                 {@code null}
     */
    public SoftEventAssertions(EventVerifier verifier) {
        this.verifier = Objects.requireNonNull(verifier, "EventVerifier must not be null");
    }

    // ---------------------------------------------------------------
    // Event checks
    // ---------------------------------------------------------------

    /**
     * @return the match, or empty when the failure was recorded
     * @see EventVerifier#assertContains(EventFilter, Duration)
     */
    public Optional<EventRecord> contains(EventFilter filter, Duration timeout) {
        return contains(filter, timeout, false);
    }

    /**
     * @return the match, or empty when the failure was recorded
     * @see EventVerifier#assertContains(EventFilter, Duration, boolean)
     */
    public Optional<EventRecord> contains(EventFilter filter, Duration timeout, boolean consume) {
        try {
            return Optional.of(verifier.assertContains(filter, timeout, consume));
        } catch (EventAssertionError e) {
            record(e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @see EventVerifier#assertAbsent(EventFilter, Duration)
     */
    public void absent(EventFilter filter, Duration duration) {
        try {
            verifier.assertAbsent(filter, duration);
        } catch (EventAssertionError e) {
            record(e.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // Payload checks
    // ---------------------------------------------------------------

    public void check(boolean condition, String message) {
        if (!condition) {
            record(message);
        }
    }

    /**
     * @param payload event payload
     * @param keyPath dot-separated path, e.g. {@code meta.app}
     */
    public void hasKey(JsonNode payload, String keyPath) {
        if (JsonMatchers.at(payload, keyPath).isEmpty()) {
            record("Missing key path: " + keyPath);
        }
    }

    /**
     * @see JsonMatchers#matches(JsonNode, JsonNode)
     */
    public void payloadContains(JsonNode payload, JsonNode expectedSubset) {
        if (!JsonMatchers.matches(payload, expectedSubset)) {
            record("Payload " + payload + " does not contain " + expectedSubset);
        }
    }

    /**
     * Equality that also fails when both values are present but of different
     * types, so {@code 42} never equals {@code "42"}.
     */
    public void isEqualTo(Object actual, Object expected) {
        if (actual != null && expected != null && actual.getClass() != expected.getClass()) {
            record("Type mismatch: actual=" + actual.getClass().getSimpleName()
                    + ", expected=" + expected.getClass().getSimpleName());
            return;
        }
        if (!Objects.equals(actual, expected)) {
            record("Values differ: actual=" + actual + ", expected=" + expected);
        }
    }

    // ---------------------------------------------------------------
    // Reporting
    // ---------------------------------------------------------------

    public List<String> getFailures() {
        return List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * @throws EventAssertionError listing every recorded failure, if any
     */
    public void assertAll() {
        List<String> snapshot = getFailures();
        if (snapshot.isEmpty()) {
            return;
        }
        throw new EventAssertionError("Soft assertion failures (total " + snapshot.size() + "):\n- "
                + String.join("\n- ", snapshot));
    }

    /**
     * Same as {@link #assertAll()}.
     */
    @Override
    public void close() {
        assertAll();
    }

    private void record(String message) {
        LOG.warn("Soft assertion failed: {}", message);
        failures.add(message);
    }
}
