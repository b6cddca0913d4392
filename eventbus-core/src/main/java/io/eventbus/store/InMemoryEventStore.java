package io.eventbus.store;

import io.eventbus.Event;
import io.eventbus.EventNotFoundException;
import io.eventbus.TopicNotRegisteredException;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-backed event store with one map per topic, so writes and
 * deletes on one topic never contend with another topic's.
 *
 * <p>This class is thread-safe. Reads never block.
 */
public final class InMemoryEventStore implements EventStore {
    private final Map<String, Map<String, Event>> partitions = new ConcurrentHashMap<>();

    @Override
    public void createPartition(String topic) {
        Objects.requireNonNull(topic, "topic");
        partitions.computeIfAbsent(topic, ignored -> new ConcurrentHashMap<>());
    }

    @Override
    public void dropPartition(String topic) {
        Objects.requireNonNull(topic, "topic");
        partitions.remove(topic);
    }

    @Override
    public boolean hasPartition(String topic) {
        return partitions.containsKey(topic);
    }

    @Override
    public void put(Event event) {
        Objects.requireNonNull(event, "event");
        Map<String, Event> partition = partitions.get(event.topic());
        if (partition == null) {
            throw new TopicNotRegisteredException(event.topic());
        }
        partition.put(event.id(), event);
    }

    @Override
    public Event get(String topic, String id) {
        return find(topic, id).orElseThrow(() -> new EventNotFoundException(topic, id));
    }

    @Override
    public Optional<Event> find(String topic, String id) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(id, "id");
        Map<String, Event> partition = partitions.get(topic);
        if (partition == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(partition.get(id));
    }

    @Override
    public void delete(String topic, String id) {
        Map<String, Event> partition = partitions.get(topic);
        if (partition != null) {
            partition.remove(id);
        }
    }

    @Override
    public int size(String topic) {
        Map<String, Event> partition = partitions.get(topic);
        return partition == null ? 0 : partition.size();
    }
}
