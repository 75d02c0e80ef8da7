package com.eventmirror.proxy;

/**
 * The proxy could not be brought up: its port is taken, the process could
 * not be launched, it exited early, or it never started listening. Fatal for
 * the test session and never retried.
 *
 * @since 1.0.0
 */
public class ProxyStartupException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ProxyStartupException(String message) {
        super(message);
    }

    public ProxyStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
