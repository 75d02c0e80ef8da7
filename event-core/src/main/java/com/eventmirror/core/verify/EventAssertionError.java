package com.eventmirror.core.verify;

/**
 * Assertion failure raised by {@link EventVerifier} assertions, so test
 * frameworks report it as a failed test rather than an error.
 *
 * @since 1.0.0
 */
public class EventAssertionError extends AssertionError {

    private static final long serialVersionUID = 1L;

    public EventAssertionError(String message) {
        super(message);
    }

    public EventAssertionError(String message, Throwable cause) {
        super(message, cause);
    }
}
