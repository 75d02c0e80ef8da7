package com.eventmirror.proxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLSocket;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Forward proxy that shows every request it can read to a
 * {@link RequestHook} and then forwards it unmodified.
 *
 * <h3>Plain HTTP</h3>
 * <ul>
 * <li>absolute-form requests ({@code GET http://host/path}) are sent upstream
 * with {@link HttpClient}; status, body and end-to-end headers are copied
 * back</li>
 * <li>hop-by-hop headers, and headers the {@code Connection} header names,
 * are dropped in both directions</li>
 * <li>origin-form requests, which carry no upstream host, answer
 * {@code 400}; upstream failures answer {@code 502}</li>
 * </ul>
 *
 * <h3>HTTPS</h3>
 * <ul>
 * <li>{@code CONNECT} to a host the {@link TlsInterception} names is
 * answered {@code 200}, then TLS is terminated with a certificate from the
 * proxy CA and the decrypted requests are handled like plain ones, with an
 * {@code https} URI</li>
 * <li>any other {@code CONNECT} becomes a blind byte relay to
 * {@code host:port}; the hook never sees it</li>
 * <li>a {@code CONNECT} whose host cannot be reached answers {@code 502}</li>
 * </ul>
 *
 * <p>
 * Client connections are kept alive until the client closes them, asks for
 * {@code Connection: close}, or stays idle for {@value #IDLE_TIMEOUT_MS} ms.
 * </p>
 *
 * @since 1.0.0
 */
public class InterceptingProxyServer {

    private static final Logger LOG = LoggerFactory.getLogger(InterceptingProxyServer.class);

    static final Duration UPSTREAM_TIMEOUT = Duration.ofSeconds(30);
    static final int CONNECT_TIMEOUT_MS = 10_000;
    static final int IDLE_TIMEOUT_MS = 60_000;
    static final long TUNNEL_DRAIN_MS = 5_000;
    static final int HTTPS_PORT = 443;

    /** RFC 7230 hop-by-hop headers, plus the legacy Proxy-Connection. */
    static final Set<String> HOP_BY_HOP = Set.of(
            "connection", "keep-alive", "proxy-authenticate", "proxy-authorization",
            "proxy-connection", "te", "trailer", "trailers", "transfer-encoding", "upgrade");

    /** Set by the HTTP client or by this proxy itself; never copied. */
    private static final Set<String> MANAGED = Set.of("host", "content-length", "expect", "date");

    private final String host;
    private final int port;
    private final RequestHook hook;
    private final TlsInterception tls;
    private final HttpClient upstream;

    private ServerSocket serverSocket;
    private ExecutorService executor;
    private final Set<Socket> connections = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public InterceptingProxyServer(MirrorConfig config, RequestHook hook) {
        this(config, hook, null);
    }

    /**
     * @param tls HTTPS interception, or {@code null} to relay every
     *            {@code CONNECT} blind
     */
    public InterceptingProxyServer(MirrorConfig config, RequestHook hook, TlsInterception tls) {
        this(config.getListenHost(), config.getListenPort(), hook, tls);
    }

    /**
     * @param host address to bind
     * @param port port to bind; {@code 0} picks a free one
     * @param hook observer called for every forwardable request
     */
    public InterceptingProxyServer(String host, int port, RequestHook hook) {
        this(host, port, hook, null);
    }

    /**
     * @param host address to bind
     * @param port port to bind; {@code 0} picks a free one
     * @param hook observer called for every forwardable request
     * @param tls  HTTPS interception, or {@code null} to relay every
     *             {@code CONNECT} blind
     */
    public InterceptingProxyServer(String host, int port, RequestHook hook, TlsInterception tls) {
        this.host = Objects.requireNonNull(host, "host must not be null");
        this.port = port;
        this.hook = Objects.requireNonNull(hook, "hook must not be null");
        this.tls = tls;
        HttpClient.Builder client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(Duration.ofMillis(CONNECT_TIMEOUT_MS));
        if (tls != null) {
            client.sslContext(tls.upstreamContext());
        }
        this.upstream = client.build();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * @throws ProxyStartupException if the port cannot be bound
     */
    public synchronized void start() {
        if (running.get()) {
            return;
        }
        ServerSocket socket = null;
        try {
            socket = new ServerSocket();
            socket.bind(new InetSocketAddress(host, port), 50);
        } catch (IOException e) {
            closeQuietly(socket);
            throw new ProxyStartupException("Failed to bind proxy on " + host + ":" + port, e);
        }
        serverSocket = socket;

        AtomicInteger threadIds = new AtomicInteger();
        executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "mirror-proxy-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        running.set(true);
        Thread acceptor = new Thread(this::acceptLoop, "mirror-proxy-accept");
        acceptor.setDaemon(true);
        acceptor.start();
        LOG.info("Proxy listening on {}:{}{}", host, getPort(),
                tls != null ? ", intercepting TLS for " + tls.getHosts() : "");
    }

    /**
     * Close the listener and every open connection, tunnels included.
     */
    public synchronized void stop() {
        if (serverSocket != null && running.compareAndSet(true, false)) {
            closeQuietly(serverSocket);
            connections.forEach(InterceptingProxyServer::closeQuietly);
            connections.clear();
            executor.shutdownNow();
            LOG.info("Proxy stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port
     * @throws IllegalStateException if the proxy is not running
     */
    public int getPort() {
        if (!running.get()) {
            throw new IllegalStateException("Proxy is not running");
        }
        return serverSocket.getLocalPort();
    }

    // ---------------------------------------------------------------
    // Connections
    // ---------------------------------------------------------------

    private void acceptLoop() {
        while (running.get()) {
            Socket client;
            try {
                client = serverSocket.accept();
            } catch (IOException e) {
                if (running.get()) {
                    LOG.warn("Accept failed: {}", e.toString());
                }
                if (serverSocket.isClosed()) {
                    return;
                }
                continue;
            }
            try {
                executor.execute(() -> serve(client));
            } catch (RejectedExecutionException e) {
                LOG.debug("Proxy stopping; dropping connection from {}", client.getRemoteSocketAddress());
                closeQuietly(client);
            }
        }
    }

    private void serve(Socket client) {
        connections.add(client);
        try (client) {
            client.setSoTimeout(IDLE_TIMEOUT_MS);
            InputStream in = new BufferedInputStream(client.getInputStream());
            OutputStream out = new BufferedOutputStream(client.getOutputStream());
            serveRequests(client, in, out, null);
        } catch (SocketTimeoutException e) {
            LOG.debug("Closing idle connection from {}", client.getRemoteSocketAddress());
        } catch (IOException e) {
            LOG.debug("Connection from {} ended: {}", client.getRemoteSocketAddress(), e.toString());
        } finally {
            connections.remove(client);
        }
    }

    /**
     * Handle requests on one connection until it closes.
     *
     * @param tunnelled target of the intercepted {@code CONNECT} this
     *                  connection is the decrypted inside of, or {@code null}
     *                  for a plain client connection
     */
    private void serveRequests(Socket socket, InputStream in, OutputStream out, ConnectTarget tunnelled)
            throws IOException {
        while (running.get()) {
            HttpMessages.RequestHead head;
            byte[] body;
            try {
                head = HttpMessages.readHead(in);
                if (head == null) {
                    return;
                }
                if (head.isConnect() && tunnelled == null) {
                    handleConnect(socket, in, out, head);
                    return;
                }
                if (head.expectsContinue()) {
                    HttpMessages.writeContinue(out);
                }
                body = HttpMessages.readBody(in, head);
            } catch (HttpMessages.MalformedMessageException e) {
                LOG.debug("Malformed request from {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
                HttpMessages.writeText(out, 400, "Malformed request: " + e.getMessage(), true);
                return;
            }

            boolean keepAlive = head.isKeepAlive();
            exchange(head, body, tunnelled, out, keepAlive);
            if (!keepAlive) {
                return;
            }
        }
    }

    // ---------------------------------------------------------------
    // Request / response
    // ---------------------------------------------------------------

    private void exchange(HttpMessages.RequestHead head, byte[] body, ConnectTarget tunnelled,
                          OutputStream out, boolean keepAlive) throws IOException {
        String method = head.getMethod();
        URI uri = requestUri(head.getTarget(), tunnelled);
        int rejection = rejectionStatus(method, uri);
        if (rejection != 0) {
            LOG.debug("Rejecting {} with {}", head, rejection);
            HttpMessages.writeText(out, rejection, "Proxy requests must use an absolute http(s) URI", !keepAlive);
            return;
        }

        InterceptedRequest request = new InterceptedRequest(method, uri, head.getHeaders(), body);
        try {
            hook.onRequest(request);
        } catch (RuntimeException e) {
            LOG.warn("Request hook failed for {}; forwarding anyway", request, e);
        }

        HttpResponse<byte[]> response;
        try {
            response = upstream.send(upstreamRequest(request), HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            LOG.warn("Upstream request {} failed: {}", request, e.toString());
            HttpMessages.writeText(out, 502, "Upstream request failed: " + e.getMessage(), !keepAlive);
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            HttpMessages.writeText(out, 502, "Proxy interrupted", true);
            return;
        } catch (IllegalArgumentException e) {
            LOG.warn("Cannot forward {}: {}", request, e.getMessage());
            HttpMessages.writeText(out, 400, "Cannot forward request: " + e.getMessage(), !keepAlive);
            return;
        }

        LOG.debug("{} -> {}", request, response.statusCode());
        copyResponse(out, method, response, keepAlive);
    }

    private HttpRequest upstreamRequest(InterceptedRequest request) {
        byte[] body = request.getBody();
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.getUri())
                .timeout(UPSTREAM_TIMEOUT)
                .method(request.getMethod(), body.length == 0
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofByteArray(body));

        Set<String> dropped = connectionTokens(request.getHeaders().get("Connection"));
        for (Map.Entry<String, List<String>> header : request.getHeaders().entrySet()) {
            if (!isEndToEnd(header.getKey(), dropped)) {
                continue;
            }
            for (String value : header.getValue()) {
                try {
                    builder.header(header.getKey(), value);
                } catch (IllegalArgumentException e) {
                    LOG.debug("Not forwarding restricted header {}", header.getKey());
                }
            }
        }
        return builder.build();
    }

    private static void copyResponse(OutputStream out, String method, HttpResponse<byte[]> response,
                                     boolean keepAlive) throws IOException {
        HttpHeaders upstreamHeaders = response.headers();
        Set<String> dropped = connectionTokens(upstreamHeaders.allValues("Connection"));
        Map<String, List<String>> headers = new LinkedHashMap<>();
        upstreamHeaders.map().forEach((name, values) -> {
            if (isEndToEnd(name, dropped)) {
                headers.put(name, values);
            }
        });

        int status = response.statusCode();
        byte[] body = response.body() != null ? response.body() : new byte[0];
        if (mayHaveBody(method, status)) {
            headers.put("Content-Length", List.of(String.valueOf(body.length)));
        } else {
            body = new byte[0];
            if ("HEAD".equalsIgnoreCase(method)) {
                upstreamHeaders.firstValue("Content-Length")
                        .ifPresent(length -> headers.put("Content-Length", List.of(length)));
            }
        }
        if (!keepAlive) {
            headers.put("Connection", List.of("close"));
        }

        HttpMessages.writeHead(out, status, headers);
        out.write(body);
        out.flush();
    }

    // ---------------------------------------------------------------
    // CONNECT
    // ---------------------------------------------------------------

    private void handleConnect(Socket client, InputStream in, OutputStream out, HttpMessages.RequestHead head)
            throws IOException {
        ConnectTarget target;
        try {
            target = ConnectTarget.parse(head.getTarget());
        } catch (IllegalArgumentException e) {
            HttpMessages.writeText(out, 400, e.getMessage(), true);
            return;
        }
        if (tls != null && tls.intercepts(target.getHost())) {
            intercept(client, in, out, target);
        } else {
            tunnel(client, in, out, target);
        }
    }

    private void intercept(Socket client, InputStream in, OutputStream out, ConnectTarget target)
            throws IOException {
        HttpMessages.writeConnectionEstablished(out);
        SSLSocket secure = tls.accept(client, drainBuffered(in), target.getHost());
        connections.add(secure);
        try (secure) {
            try {
                secure.startHandshake();
            } catch (IOException e) {
                LOG.warn("TLS handshake for {} failed; does the client trust the proxy CA? {}", target, e.toString());
                return;
            }
            LOG.debug("Intercepting TLS for {}", target);
            serveRequests(secure, new BufferedInputStream(secure.getInputStream()),
                    new BufferedOutputStream(secure.getOutputStream()), target);
        } finally {
            connections.remove(secure);
        }
    }

    private void tunnel(Socket client, InputStream in, OutputStream out, ConnectTarget target)
            throws IOException {
        Socket remote = new Socket();
        try {
            remote.connect(new InetSocketAddress(target.getHost(), target.getPort()), CONNECT_TIMEOUT_MS);
        } catch (IOException e) {
            closeQuietly(remote);
            LOG.warn("Cannot open tunnel to {}: {}", target, e.toString());
            HttpMessages.writeText(out, 502, "Cannot reach " + target + ": " + e.getMessage(), true);
            return;
        }

        connections.add(remote);
        try (remote) {
            HttpMessages.writeConnectionEstablished(out);
            client.setSoTimeout(0);
            LOG.debug("Tunnelling {} to {}", client.getRemoteSocketAddress(), target);

            Future<?> uplink;
            try {
                uplink = executor.submit(() -> relay(in, remote, "client -> " + target));
            } catch (RejectedExecutionException e) {
                LOG.debug("Proxy stopping; not tunnelling to {}", target);
                return;
            }
            relay(remote.getInputStream(), client, target + " -> client");
            awaitUplink(uplink, target);
        } finally {
            connections.remove(remote);
        }
    }

    /**
     * Copy {@code from} into {@code to} until end of stream, then half-close
     * {@code to}.
     */
    private static void relay(InputStream from, Socket to, String direction) {
        try {
            from.transferTo(to.getOutputStream());
            to.shutdownOutput();
        } catch (IOException e) {
            LOG.debug("Tunnel {} closed: {}", direction, e.toString());
        }
    }

    private static void awaitUplink(Future<?> uplink, ConnectTarget target) {
        try {
            uplink.get(TUNNEL_DRAIN_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.debug("Client kept the tunnel to {} open after the server closed it", target);
        } catch (ExecutionException e) {
            LOG.debug("Tunnel to {} failed: {}", target, e.getCause().toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * @return bytes the client sent after the {@code CONNECT} head that are
     *         already buffered, or {@code null} if there are none
     */
    private static InputStream drainBuffered(InputStream in) throws IOException {
        int buffered = in.available();
        return buffered > 0 ? new ByteArrayInputStream(in.readNBytes(buffered)) : null;
    }

    // ---------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------

    /**
     * @param target    request target as sent
     * @param tunnelled intercepted tunnel the request arrived through, or
     *                  {@code null}
     * @return the absolute URI to forward to, or {@code null} if the target
     *         is not a valid URI
     */
    static URI requestUri(String target, ConnectTarget tunnelled) {
        try {
            if (tunnelled != null && target.startsWith("/")) {
                return URI.create("https://" + tunnelled.authority(HTTPS_PORT) + target);
            }
            return URI.create(target);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * @return {@code 0} if the request can be forwarded, otherwise the status
     *         to answer with
     */
    static int rejectionStatus(String method, URI uri) {
        if ("CONNECT".equalsIgnoreCase(method)) {
            return 400;
        }
        if (uri == null || uri.getHost() == null || uri.getScheme() == null) {
            return 400;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        return scheme.equals("http") || scheme.equals("https") ? 0 : 400;
    }

    static boolean mayHaveBody(String method, int status) {
        return !"HEAD".equalsIgnoreCase(method) && status >= 200 && status != 204 && status != 304;
    }

    /**
     * @param name    header name, any case
     * @param dropped extra names listed in the {@code Connection} header
     * @return {@code true} if the header travels end to end
     */
    static boolean isEndToEnd(String name, Set<String> dropped) {
        String lower = name.toLowerCase(Locale.ROOT);
        return !HOP_BY_HOP.contains(lower) && !MANAGED.contains(lower) && !dropped.contains(lower);
    }

    static Set<String> connectionTokens(List<String> connectionValues) {
        return HttpMessages.tokens(connectionValues);
    }

    private static void closeQuietly(Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            LOG.debug("Close failed: {}", e.toString());
        }
    }

    // ---------------------------------------------------------------
    // Types
    // ---------------------------------------------------------------

    /**
     * {@code host:port} from a {@code CONNECT} request line. IPv6 hosts are
     * bracketed on the wire and kept without brackets here.
     */
    static final class ConnectTarget {
        private final String host;
        private final int port;

        private ConnectTarget(String host, int port) {
            this.host = host;
            this.port = port;
        }

        /**
         * @throws IllegalArgumentException if the authority has no host or no
         *                                  valid port
         */
        static ConnectTarget parse(String authority) {
            String hostPart;
            String portPart;
            if (authority.startsWith("[")) {
                int end = authority.indexOf("]:");
                if (end < 0) {
                    throw new IllegalArgumentException("CONNECT target must be host:port, got: " + authority);
                }
                hostPart = authority.substring(1, end);
                portPart = authority.substring(end + 2);
            } else {
                int colon = authority.lastIndexOf(':');
                if (colon <= 0 || authority.indexOf(':') != colon) {
                    throw new IllegalArgumentException("CONNECT target must be host:port, got: " + authority);
                }
                hostPart = authority.substring(0, colon);
                portPart = authority.substring(colon + 1);
            }
            int port;
            try {
                port = Integer.parseInt(portPart);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Bad CONNECT port in: " + authority);
            }
            if (hostPart.isBlank() || port < 1 || port > 65_535) {
                throw new IllegalArgumentException("Bad CONNECT target: " + authority);
            }
            return new ConnectTarget(hostPart, port);
        }

        String getHost() {
            return host;
        }

        int getPort() {
            return port;
        }

        /**
         * @param defaultPort port left out of the result
         * @return {@code host[:port]}, bracketing IPv6 hosts
         */
        String authority(int defaultPort) {
            String name = host.indexOf(':') >= 0 ? "[" + host + "]" : host;
            return port == defaultPort ? name : name + ":" + port;
        }

        @Override
        public String toString() {
            return authority(-1);
        }
    }
}
