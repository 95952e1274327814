package org.vivarium.datapipeline.resources.queues;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

import org.vivarium.runtime.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Bounded, thread-safe hand-off of events from producers (generator, control plane) to the
 * tick thread, based on {@link ArrayBlockingQueue}.
 * <p>
 * {@link #offer(Event)} never blocks: when the queue is full the event is dropped and counted.
 */
public class EventQueue {

    private static final Logger LOG = LoggerFactory.getLogger(EventQueue.class);

    private final String name;
    private final int capacity;
    private final ArrayBlockingQueue<Event> queue;
    private final AtomicLong offered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    /**
     * @param name    Resource name used in log messages.
     * @param options {@code capacity} (default 100).
     * @throws IllegalArgumentException if the configuration is invalid.
     */
    public EventQueue(String name, Config options) {
        this.name = name;
        Config finalConfig = options.withFallback(ConfigFactory.parseMap(Map.of("capacity", 100)));
        try {
            this.capacity = finalConfig.getInt("capacity");
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for EventQueue '" + name + "'", e);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive for resource '" + name + "'.");
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Enqueues an event without blocking.
     *
     * @param event The event.
     * @return {@code false} if the queue was full and the event was dropped.
     */
    public boolean offer(Event event) {
        if (event == null) {
            throw new NullPointerException("event cannot be null");
        }
        offered.incrementAndGet();
        if (queue.offer(event)) {
            return true;
        }
        long total = dropped.incrementAndGet();
        LOG.warn("Queue '{}' is full (capacity {}), dropped '{}' event ({} dropped so far)",
            name, capacity, event.type(), total);
        return false;
    }

    /**
     * @return every queued event in FIFO order; the queue is empty afterwards.
     */
    public List<Event> drainAll() {
        List<Event> events = new ArrayList<>(queue.size());
        queue.drainTo(events);
        return events;
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int getCapacity() {
        return capacity;
    }

    public long getOfferedCount() {
        return offered.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public String getName() {
        return name;
    }
}
