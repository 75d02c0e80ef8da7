package com.eventmirror.proxy;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocket;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Which {@code CONNECT} tunnels the proxy opens up instead of relaying them
 * blind, and how it talks TLS on both sides of them.
 *
 * <p>
 * Only the listed hosts are intercepted. Toward the client the proxy
 * presents a certificate from the {@link CertificateAuthority}; toward the
 * real server it uses the upstream context, the JVM default unless replaced
 * with {@link #withUpstreamContext(SSLContext)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class TlsInterception {

    private final CertificateAuthority authority;
    private final Set<String> hosts;
    private final SSLContext upstreamContext;

    private TlsInterception(CertificateAuthority authority, Set<String> hosts, SSLContext upstreamContext) {
        this.authority = authority;
        this.hosts = hosts;
        this.upstreamContext = upstreamContext;
    }

    /**
     * @param authority root that signs the per-host certificates
     * @param hosts     hosts to intercept, matched case-insensitively
     * @return interception of {@code hosts} with the default upstream context
     */
    public static TlsInterception of(CertificateAuthority authority, Collection<String> hosts) {
        Objects.requireNonNull(authority, "authority must not be null");
        Objects.requireNonNull(hosts, "hosts must not be null");
        Set<String> normalized = hosts.stream()
                .map(host -> host.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        return new TlsInterception(authority, normalized, null);
    }

    /**
     * @param context context used to verify upstream servers
     * @return copy using {@code context} toward the real servers
     */
    public TlsInterception withUpstreamContext(SSLContext context) {
        return new TlsInterception(authority, hosts, Objects.requireNonNull(context, "context must not be null"));
    }

    /**
     * @param host host from a {@code CONNECT} request, without port
     * @return {@code true} if the tunnel should be decrypted
     */
    public boolean intercepts(String host) {
        return host != null && hosts.contains(host.trim().toLowerCase(Locale.ROOT));
    }

    public CertificateAuthority getAuthority() {
        return authority;
    }

    public Set<String> getHosts() {
        return hosts;
    }

    /**
     * @return the upstream context; the JVM default unless replaced
     */
    SSLContext upstreamContext() {
        if (upstreamContext != null) {
            return upstreamContext;
        }
        try {
            return SSLContext.getDefault();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("No default TLS context available", e);
        }
    }

    /**
     * Layer server-side TLS over an accepted client socket. The handshake is
     * left to the caller.
     *
     * @param client   plain socket that carried the {@code CONNECT}
     * @param consumed bytes already read from {@code client}, or {@code null}
     * @param host     host the client asked for
     * @return socket that closes {@code client} when closed
     */
    SSLSocket accept(Socket client, InputStream consumed, String host) throws IOException {
        SSLSocket secure = (SSLSocket) authority.serverContext(host).getSocketFactory()
                .createSocket(client, consumed, true);
        secure.setUseClientMode(false);
        return secure;
    }

    @Override
    public String toString() {
        return "TlsInterception{hosts=" + hosts + '}';
    }
}
