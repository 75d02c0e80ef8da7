package com.eventmirror.core.verify;

import com.eventmirror.core.model.EventFilter;
import com.eventmirror.core.model.EventRecord;

import java.time.Duration;
import java.util.List;

/**
 * Thrown when no event matching a filter appears before the wait timeout.
 *
 * <p>
 * Carries what the caller needs to tell a missing event from a slow or
 * misnamed one: the filter, the timeout and a capped list of the events
 * that were actually observed inside the filter's time window.
 * </p>
 *
 * @since 1.0.0
 */
public class EventWaitTimeoutException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient EventFilter filter;
    private final Duration timeout;
    private final transient List<EventRecord> observed;
    private final int observedTotal;

    public EventWaitTimeoutException(String message, EventFilter filter, Duration timeout,
                                     List<EventRecord> observed, int observedTotal, Throwable lastQueryFailure) {
        super(message, lastQueryFailure);
        this.filter = filter;
        this.timeout = timeout;
        this.observed = List.copyOf(observed);
        this.observedTotal = observedTotal;
    }

    public EventFilter getFilter() {
        return filter;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * @return the first observed events in the window (capped)
     */
    public List<EventRecord> getObserved() {
        return observed;
    }

    /**
     * @return total number of events observed in the window, before capping
     */
    public int getObservedTotal() {
        return observedTotal;
    }
}
