/**
 * Domain model shared by the collector and the verifier.
 *
 * <ul>
 * <li>{@link com.eventmirror.core.model.EventRecord}: one captured analytics
 * event</li>
 * <li>{@link com.eventmirror.core.model.EventFilter}: name, time window and
 * payload criteria used to query stored events</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.eventmirror.core.model;
