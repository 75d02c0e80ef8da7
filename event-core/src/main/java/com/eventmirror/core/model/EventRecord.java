package com.eventmirror.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Instant;
import java.util.Objects;

/**
 * One captured analytics event.
 *
 * <p>
 * Events arrive as free-form JSON mirrored from the app-under-test. The
 * payload is kept as a Jackson {@link JsonNode} tree so filters can query
 * arbitrary fields without requiring a rigid schema.
 * </p>
 *
 * <h3>Immutability</h3>
 * <p>
 * Instances are immutable once built. The payload tree is deep-copied on
 * construction and on every call to {@link #getPayload()}, so neither the
 * producer nor a consumer can alter a stored record.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code name} and {@code receivedAt} are required;
 * omitting either throws a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class EventRecord {

    /** Event identifier extracted from the payload. */
    private final String name;

    /** Full decoded event body. */
    private final JsonNode payload;

    /** Wall-clock instant at which the collector stored the event. */
    private final Instant receivedAt;

    /** Arrival index assigned by the store (1-based, strictly increasing). */
    private final long sequence;

    /** Shared by every record ingested from the same HTTP request. */
    private final long sourceBatchId;

    private EventRecord(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.receivedAt = Objects.requireNonNull(builder.receivedAt, "receivedAt must not be null");
        this.payload = builder.payload != null ? builder.payload.deepCopy() : NullNode.getInstance();
        this.sequence = builder.sequence;
        this.sourceBatchId = builder.sourceBatchId;
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Return a builder pre-populated with this record's values.
     *
     * <p>
     * Used by the store to stamp the sequence number on an otherwise
     * complete record.
     * </p>
     *
     * @return builder holding a copy of this record
     */
    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .payload(payload)
                .receivedAt(receivedAt)
                .sequence(sequence)
                .sourceBatchId(sourceBatchId);
    }

    /**
     * Fluent builder for {@link EventRecord} instances.
     */
    public static class Builder {
        private String name;
        private JsonNode payload;
        private Instant receivedAt;
        private long sequence;
        private long sourceBatchId;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder payload(JsonNode payload) {
            this.payload = payload;
            return this;
        }

        public Builder receivedAt(Instant receivedAt) {
            this.receivedAt = receivedAt;
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder sourceBatchId(long sourceBatchId) {
            this.sourceBatchId = sourceBatchId;
            return this;
        }

        /**
         * Build the record.
         *
         * @return a new {@link EventRecord}
         * @throws NullPointerException if {@code name} or {@code receivedAt} is
         *                              {@code null}
         */
        public EventRecord build() {
            return new EventRecord(this);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    /**
     * Return a copy of the payload tree.
     *
     * @return deep copy of the decoded event body
     */
    public JsonNode getPayload() {
        return payload.deepCopy();
    }

    /**
     * Read-only access for matchers that only inspect the tree.
     * Callers must not mutate the returned node.
     */
    JsonNode payloadView() {
        return payload;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    public long getSequence() {
        return sequence;
    }

    public long getSourceBatchId() {
        return sourceBatchId;
    }

    /**
     * Compact one-line rendering used in verification failure summaries.
     *
     * @return {@code #seq name @receivedAt (batch N)}
     */
    public String summary() {
        return "#" + sequence + " " + name + " @" + receivedAt + " (batch " + sourceBatchId + ")";
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EventRecord that))
            return false;
        return sequence == that.sequence
                && sourceBatchId == that.sourceBatchId
                && name.equals(that.name)
                && receivedAt.equals(that.receivedAt)
                && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, receivedAt, sequence, sourceBatchId);
    }

    @Override
    public String toString() {
        return "EventRecord{" +
                "sequence=" + sequence +
                ", name='" + name + '\'' +
                ", receivedAt=" + receivedAt +
                ", sourceBatchId=" + sourceBatchId +
                ", payload=" + payload +
                '}';
    }
}
