package com.eventmirror.core.model;

import com.eventmirror.core.match.JsonMatchers;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Query over {@link EventRecord}s: a name predicate, a time window on
 * {@code receivedAt} and any number of payload predicates. Every configured
 * criterion must hold for a record to match; an empty filter matches every
 * record.
 *
 * <h3>Time window</h3>
 * <p>
 * The window is half-open: {@code receivedFrom} is inclusive,
 * {@code receivedUntil} is exclusive. Either bound may be absent.
 * </p>
 *
 * <p>
 * Filters are immutable and thread-safe as long as the supplied
 * {@link Predicate}s are.
 * </p>
 *
 * @since 1.0.0
 */
public final class EventFilter implements Predicate<EventRecord> {

    private static final EventFilter ANY = builder().build();

    private final String name;
    private final NameMatch nameMatch;
    private final Pattern namePattern;
    private final Instant receivedFrom;
    private final Instant receivedUntil;
    private final List<PayloadCondition> payloadConditions;

    private EventFilter(Builder b) {
        this.name = b.name;
        this.nameMatch = b.nameMatch;
        this.namePattern = b.namePattern;
        this.receivedFrom = b.receivedFrom;
        this.receivedUntil = b.receivedUntil;
        this.payloadConditions = Collections.unmodifiableList(new ArrayList<>(b.payloadConditions));
    }

    /**
     * @return a filter matching every record
     */
    public static EventFilter any() {
        return ANY;
    }

    /**
     * Shortcut for {@code builder().nameEquals(name).build()}.
     *
     * @param name exact event name
     * @return filter on the event name
     */
    public static EventFilter named(String name) {
        return builder().nameEquals(name).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return builder seeded with this filter's criteria
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.name = name;
        b.nameMatch = nameMatch;
        b.namePattern = namePattern;
        b.receivedFrom = receivedFrom;
        b.receivedUntil = receivedUntil;
        b.payloadConditions.addAll(payloadConditions);
        return b;
    }

    /**
     * Return a copy whose lower window bound is at least {@code from}.
     *
     * <p>
     * An existing, later lower bound is kept; the window is only ever
     * narrowed.
     * </p>
     *
     * @param from inclusive lower bound; must not be {@code null}
     * @return narrowed filter
     */
    public EventFilter withWindowFrom(Instant from) {
        Objects.requireNonNull(from, "Window start must not be null");
        Instant effective = receivedFrom != null && receivedFrom.isAfter(from) ? receivedFrom : from;
        return toBuilder().receivedFrom(effective).build();
    }

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------

    @Override
    public boolean test(EventRecord event) {
        Objects.requireNonNull(event, "Event must not be null");
        return nameMatches(event.getName())
                && inWindow(event.getReceivedAt())
                && payloadMatches(event.payloadView());
    }

    /**
     * @param receivedAt instant to check
     * @return {@code true} if the instant lies inside {@code [from, until)}
     */
    public boolean inWindow(Instant receivedAt) {
        if (receivedFrom != null && receivedAt.isBefore(receivedFrom)) {
            return false;
        }
        return receivedUntil == null || receivedAt.isBefore(receivedUntil);
    }

    private boolean nameMatches(String actual) {
        if (name == null) {
            return true;
        }
        return switch (nameMatch) {
            case EXACT -> actual.equals(name);
            case CONTAINS -> actual.contains(name);
            case STARTS_WITH -> actual.startsWith(name);
            case REGEX -> namePattern.matcher(actual).find();
        };
    }

    private boolean payloadMatches(JsonNode payload) {
        for (PayloadCondition condition : payloadConditions) {
            if (!condition.predicate.test(payload)) {
                return false;
            }
        }
        return true;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public Instant getReceivedFrom() {
        return receivedFrom;
    }

    public Instant getReceivedUntil() {
        return receivedUntil;
    }

    /**
     * @return {@code [from, until)} with {@code -inf} / {@code +inf} for open
     *         bounds
     */
    public String describeWindow() {
        return "[" + (receivedFrom != null ? receivedFrom : "-inf")
                + ", " + (receivedUntil != null ? receivedUntil : "+inf") + ")";
    }

    /**
     * Human-readable rendering of every criterion, used in failure messages.
     *
     * @return description such as {@code name EXACT 'scroll' AND window [..)}
     */
    public String describe() {
        List<String> parts = new ArrayList<>();
        if (name != null) {
            parts.add("name " + nameMatch.name().toLowerCase(Locale.ROOT) + " '" + name + "'");
        }
        if (receivedFrom != null || receivedUntil != null) {
            parts.add("receivedAt in " + describeWindow());
        }
        for (PayloadCondition condition : payloadConditions) {
            parts.add(condition.description);
        }
        return parts.isEmpty() ? "any event" : String.join(" AND ", parts);
    }

    @Override
    public String toString() {
        return "EventFilter{" + describe() + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link EventFilter}.
     *
     * <p>
     * {@link #build()} rejects an empty or inverted time window and an
     * invalid name regular expression.
     * </p>
     */
    public static class Builder {
        private String name;
        private NameMatch nameMatch = NameMatch.EXACT;
        private Pattern namePattern;
        private Instant receivedFrom;
        private Instant receivedUntil;
        private final List<PayloadCondition> payloadConditions = new ArrayList<>();

        public Builder nameEquals(String name) {
            return nameMatches(name, NameMatch.EXACT);
        }

        public Builder nameMatches(String name, NameMatch mode) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.nameMatch = Objects.requireNonNull(mode, "mode must not be null");
            return this;
        }

        public Builder receivedFrom(Instant from) {
            this.receivedFrom = from;
            return this;
        }

        public Builder receivedUntil(Instant until) {
            this.receivedUntil = until;
            return this;
        }

        /**
         * Require the payload to contain {@code subset} (see
         * {@link JsonMatchers#matches(JsonNode, JsonNode)}).
         */
        public Builder payloadContains(JsonNode subset) {
            JsonNode pattern = Objects.requireNonNull(subset, "subset must not be null").deepCopy();
            payloadConditions.add(new PayloadCondition(
                    "payload contains " + pattern, payload -> JsonMatchers.matches(payload, pattern)));
            return this;
        }

        /**
         * Require the payload to equal {@code expected} exactly.
         */
        public Builder payloadEquals(JsonNode expected) {
            JsonNode copy = Objects.requireNonNull(expected, "expected must not be null").deepCopy();
            payloadConditions.add(new PayloadCondition("payload equals " + copy, copy::equals));
            return this;
        }

        /**
         * Require every key/value pair of {@code keyValues} somewhere in the
         * payload tree (see {@link JsonMatchers#containsAll(JsonNode, JsonNode)}).
         */
        public Builder payloadHasAll(JsonNode keyValues) {
            Objects.requireNonNull(keyValues, "keyValues must not be null");
            if (!keyValues.isObject()) {
                throw new IllegalArgumentException("keyValues must be a JSON object, got: " + keyValues);
            }
            JsonNode copy = keyValues.deepCopy();
            payloadConditions.add(new PayloadCondition(
                    "payload has all " + copy, payload -> JsonMatchers.containsAll(payload, copy)));
            return this;
        }

        /**
         * Arbitrary payload predicate.
         *
         * @param description text shown in failure messages
         * @param predicate   test over the payload; must not mutate it
         */
        public Builder where(String description, Predicate<JsonNode> predicate) {
            payloadConditions.add(new PayloadCondition(
                    Objects.requireNonNull(description, "description must not be null"),
                    Objects.requireNonNull(predicate, "predicate must not be null")));
            return this;
        }

        /**
         * Build and validate the filter.
         *
         * @return a validated {@link EventFilter}
         * @throws IllegalArgumentException if the window is empty or the name
         *                                  regex does not compile
         */
        public EventFilter build() {
            if (receivedFrom != null && receivedUntil != null && !receivedFrom.isBefore(receivedUntil)) {
                throw new IllegalArgumentException(
                        "receivedFrom must be before receivedUntil, got: [" + receivedFrom + ", " + receivedUntil + ")");
            }
            namePattern = null;
            if (name != null && nameMatch == NameMatch.REGEX) {
                try {
                    namePattern = Pattern.compile(name);
                } catch (PatternSyntaxException e) {
                    throw new IllegalArgumentException("Invalid name pattern: " + name, e);
                }
            }
            return new EventFilter(this);
        }
    }

    private static final class PayloadCondition {
        private final String description;
        private final Predicate<JsonNode> predicate;

        private PayloadCondition(String description, Predicate<JsonNode> predicate) {
            this.description = description;
            this.predicate = predicate;
        }
    }
}
