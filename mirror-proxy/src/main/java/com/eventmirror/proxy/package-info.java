/**
 * Mirror proxy: copies matching analytics requests to the event collector
 * while passing the original traffic through untouched.
 *
 * <p>
 * {@link com.eventmirror.proxy.InterceptingProxyServer} forwards requests and
 * shows each one to a {@link com.eventmirror.proxy.RequestHook};
 * {@link com.eventmirror.proxy.MirrorAddon} is the hook that does the
 * copying. {@link com.eventmirror.proxy.ProxySupervisor} runs the whole thing
 * as a separate process for a test session.
 * </p>
 *
 * <p>
 * HTTPS to the mirror target is decrypted with certificates from
 * {@link com.eventmirror.proxy.CertificateAuthority}, which the device must
 * trust; every other {@code CONNECT} is relayed as opaque bytes.
 * </p>
 *
 * @since 1.0.0
 */
package com.eventmirror.proxy;
