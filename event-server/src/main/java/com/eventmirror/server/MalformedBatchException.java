package com.eventmirror.server;

/**
 * Thrown when a request body cannot be read as a batch at all. The request
 * is rejected with {@code 400} and the store is left untouched.
 *
 * @since 1.0.0
 */
public class MalformedBatchException extends Exception {

    private static final long serialVersionUID = 1L;

    public MalformedBatchException(String message) {
        super(message);
    }

    public MalformedBatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
