package com.eventmirror.core.net;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;

/**
 * TCP reachability helpers used for readiness checks.
 *
 * @since 1.0.0
 */
public final class PortCheck {

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofMillis(600);

    private PortCheck() {
        // utility class, not instantiable
    }

    /**
     * @see #isListening(String, int, Duration)
     */
    public static boolean isListening(String host, int port) {
        return isListening(host, port, DEFAULT_CONNECT_TIMEOUT);
    }

    /**
     * Check that {@code host:port} accepts TCP connections.
     *
     * @param host    address to connect to
     * @param port    port to connect to
     * @param timeout connect timeout
     * @return {@code true} if a connection could be established
     */
    public static boolean isListening(String host, int port, Duration timeout) {
        Objects.requireNonNull(host, "host must not be null");
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * Find a free TCP port on the loopback interface.
     *
     * <p>
     * The port may be taken by someone else between this call and its use.
     * Prefer binding port {@code 0} directly where the API allows it.
     * </p>
     *
     * @return a port number that was free at the time of the call
     */
    public static int freePort() {
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to allocate a free port", e);
        }
    }
}
