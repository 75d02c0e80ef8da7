package com.eventmirror.server;

/**
 * The ingestion server could not bind its port. Fatal for the test session:
 * continuing would only produce misleading "event not found" failures.
 *
 * @since 1.0.0
 */
public class CollectorStartupException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CollectorStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
