package com.eventmirror.core.store;

import com.eventmirror.core.model.EventFilter;
import com.eventmirror.core.model.EventRecord;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Query surface of an event collector.
 *
 * <p>
 * The verifier reads events only through this interface, whether the
 * collector runs in the same JVM or behind HTTP.
 * </p>
 *
 * @since 1.0.0
 */
public interface EventSource {

    /**
     * Return a consistent snapshot of every stored record in insertion order.
     *
     * @return unmodifiable list; never {@code null}
     */
    List<EventRecord> snapshot();

    /**
     * Return every stored record matching {@code filter}, in insertion order.
     *
     * @param filter query to apply
     * @return finite, snapshot-based list of matches
     */
    default List<EventRecord> queryAll(EventFilter filter) {
        return snapshot().stream().filter(filter).collect(Collectors.toUnmodifiableList());
    }

    /**
     * Clear the underlying store.
     *
     * @return number of records removed
     */
    int reset();
}
