/**
 * Poll-with-timeout verification of mirrored events.
 *
 * <p>
 * {@link com.eventmirror.core.verify.EventVerifier} reads events only through
 * {@link com.eventmirror.core.store.EventSource}, so the same checks work
 * against an in-process collector and one reached over HTTP.
 * </p>
 *
 * <h3>Failure modes</h3>
 * <ul>
 * <li>{@link com.eventmirror.core.verify.EventWaitTimeoutException}: nothing
 * matched in time</li>
 * <li>{@link com.eventmirror.core.verify.EventAssertionError}: assertion
 * helpers, reported as test failures</li>
 * <li>{@link com.eventmirror.core.verify.EventWaitCancelledException}: the
 * wait was abandoned at teardown</li>
 * </ul>
 *
 * <p>
 * {@link com.eventmirror.core.verify.SoftEventAssertions} collects assertion
 * failures and reports them together at the end of a test.
 * </p>
 *
 * @since 1.0.0
 */
package com.eventmirror.core.verify;
