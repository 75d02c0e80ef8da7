/**
 * Batch ingestion server for mirrored analytics traffic.
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.eventmirror.server.EventCollectorServer}: HTTP endpoints and
 * the owned event store</li>
 * <li>{@link com.eventmirror.server.BatchIngestor}: request body to event
 * records</li>
 * <li>{@link com.eventmirror.server.CollectorClient}: HTTP query surface and
 * readiness check</li>
 * <li>{@link com.eventmirror.server.CollectorMain}: standalone entry
 * point</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.eventmirror.server;
