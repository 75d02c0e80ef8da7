package com.eventmirror.proxy;

/**
 * Observes every request passing through the {@link InterceptingProxyServer}
 * before it is forwarded upstream.
 *
 * <p>
 * Hooks run on the proxy's request thread, so implementations must return
 * quickly and hand any slow work to their own worker. A hook cannot alter or
 * block the request; an exception it throws is logged and the request is
 * forwarded regardless.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface RequestHook {

    /**
     * @param request the intercepted request; immutable
     */
    void onRequest(InterceptedRequest request);
}
