package io.eventbus;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable event published to a topic.
 *
 * <p>An event is identified by its {@code (topic, id)} pair. The id is normally supplied
 * by the producer; when omitted the builder assigns a ULID. Besides the payload an event
 * carries optional correlation metadata ({@code transactionId}, {@code source}) and
 * timing information ({@code initializedAt}, {@code occurredAt}, {@code ttl}).
 *
 * <pre>{@code
 * Event event = Event.builder("orders")
 *     .id("1")
 *     .data(order)
 *     .source("checkout")
 *     .build();
 * }</pre>
 *
 * @see EventBus#notify(Event)
 */
public final class Event {
    private final String id;
    private final String topic;
    private final Object data;
    private final String transactionId;
    private final String source;
    private final Instant initializedAt;
    private final Instant occurredAt;
    private final Duration ttl;

    private Event(Builder builder) {
        this.topic = Objects.requireNonNull(builder.topic, "topic");
        if (this.topic.isEmpty()) {
            throw new IllegalArgumentException("topic cannot be empty");
        }
        this.id = builder.id == null ? newEventId() : builder.id;
        if (this.id.isEmpty()) {
            throw new IllegalArgumentException("id cannot be empty");
        }
        this.data = Objects.requireNonNull(builder.data, "data");
        this.transactionId = builder.transactionId;
        this.source = builder.source;
        this.initializedAt = builder.initializedAt;
        this.occurredAt = builder.occurredAt == null ? Instant.now() : builder.occurredAt;
        if (this.initializedAt != null && this.occurredAt.isBefore(this.initializedAt)) {
            throw new IllegalArgumentException("occurredAt must not be before initializedAt");
        }
        if (builder.ttl != null && (builder.ttl.isZero() || builder.ttl.isNegative())) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.ttl = builder.ttl;
    }

    /**
     * Creates a builder for an event on the given topic.
     *
     * @param topic the topic name
     * @return a new builder
     */
    public static Builder builder(String topic) {
        return new Builder(topic);
    }

    /**
     * Creates an event with the given topic, id and payload.
     *
     * @param topic the topic name
     * @param id    the event id, unique within the topic
     * @param data  the payload
     * @return a new event
     */
    public static Event of(String topic, String id, Object data) {
        return builder(topic).id(id).data(data).build();
    }

    public String id() {
        return id;
    }

    public String topic() {
        return topic;
    }

    public Object data() {
        return data;
    }

    /**
     * Returns the payload cast to the requested type.
     *
     * @throws ClassCastException if the payload is not an instance of {@code type}
     */
    public <T> T data(Class<T> type) {
        return type.cast(data);
    }

    public String transactionId() {
        return transactionId;
    }

    public String source() {
        return source;
    }

    public Instant initializedAt() {
        return initializedAt;
    }

    public Instant occurredAt() {
        return occurredAt;
    }

    public Duration ttl() {
        return ttl;
    }

    /**
     * Time the producer spent between starting to build the event and publishing it.
     *
     * @return the elapsed time, or empty when {@code initializedAt} was not set
     */
    public Optional<Duration> duration() {
        if (initializedAt == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(initializedAt, occurredAt));
    }

    private static String newEventId() {
        return UlidCreator.getMonotonicUlid().toString();
    }

    @Override
    public String toString() {
        return "Event{topic=" + topic + ", id=" + id
                + (transactionId == null ? "" : ", transactionId=" + transactionId)
                + (source == null ? "" : ", source=" + source)
                + ", occurredAt=" + occurredAt + '}';
    }

    /** Builder for {@link Event}. */
    public static final class Builder {
        private final String topic;
        private String id;
        private Object data;
        private String transactionId;
        private String source;
        private Instant initializedAt;
        private Instant occurredAt;
        private Duration ttl;

        private Builder(String topic) {
            this.topic = topic;
        }

        /**
         * Sets the event id. Optional; a ULID is generated when not set.
         */
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        /**
         * Sets the payload. <b>Required.</b>
         */
        public Builder data(Object data) {
            this.data = data;
            return this;
        }

        /**
         * Sets the correlation id shared by events of one logical operation.
         */
        public Builder transactionId(String transactionId) {
            this.transactionId = transactionId;
            return this;
        }

        /**
         * Sets a label naming the producer of the event.
         */
        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder initializedAt(Instant initializedAt) {
            this.initializedAt = initializedAt;
            return this;
        }

        /**
         * Sets the publication time. Defaults to {@link Instant#now()} at build time.
         */
        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        /**
         * Sets an advisory time-to-live. Must be positive.
         */
        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        /**
         * Builds the event.
         *
         * @throws NullPointerException     if topic or data is null
         * @throws IllegalArgumentException if topic or id is empty, ttl is not positive,
         *                                  or occurredAt precedes initializedAt
         */
        public Event build() {
            return new Event(this);
        }
    }
}
