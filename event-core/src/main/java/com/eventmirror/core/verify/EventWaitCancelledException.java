package com.eventmirror.core.verify;

/**
 * Thrown when a wait is abandoned because the verifier was cancelled or
 * closed, or the waiting thread was interrupted.
 *
 * @since 1.0.0
 */
public class EventWaitCancelledException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EventWaitCancelledException(String message) {
        super(message);
    }

    public EventWaitCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
