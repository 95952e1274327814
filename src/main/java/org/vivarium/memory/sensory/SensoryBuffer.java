package org.vivarium.memory.sensory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.vivarium.memory.IMemoryStore;
import org.vivarium.memory.MemoryLevel;
import org.vivarium.memory.MemoryQueryParams;
import org.vivarium.runtime.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded ring of raw events awaiting promotion into episodic memory.
 * <p>
 * <b>Eviction:</b> pushing into a full buffer silently evicts the oldest entry. Entries older
 * than the configured TTL are purged lazily before every scan.
 * <p>
 * <b>Promotion:</b> {@link #drainPromotable(double, int)} selects high-salience events
 * individually and habituated event types as a group, and hands them out as a
 * {@link PromotionBatch}. Entries leave the buffer only when the batch is committed, so every
 * occurrence is promoted at most once.
 * <p>
 * <b>Threading:</b> all operations are guarded by a read-write lock.
 */
public class SensoryBuffer implements IMemoryStore {

    private static final Logger LOG = LoggerFactory.getLogger(SensoryBuffer.class);

    private record Entry(long sequence, Event event, long addedAtMillis) {
    }

    /**
     * Per-type summary of the buffer content.
     *
     * @param count         Number of buffered occurrences.
     * @param meanMagnitude Mean absolute intensity of those occurrences.
     */
    public record TypeStatistics(int count, double meanMagnitude) {
    }

    private final SensoryBufferSettings settings;
    private final Clock clock;
    private final Deque<Entry> ring = new ArrayDeque<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private long nextSequence;
    private long totalAdded;
    private long totalEvicted;
    private long totalExpired;
    private long totalPromoted;
    private long totalConsumed;

    public SensoryBuffer(SensoryBufferSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SensoryBuffer(SensoryBufferSettings settings) {
        this(settings, Clock.systemUTC());
    }

    /**
     * Appends an event, evicting the oldest entry if the ring is full.
     * @param event The raw event.
     */
    public void push(Event event) {
        Objects.requireNonNull(event, "event");
        lock.writeLock().lock();
        try {
            ring.addLast(new Entry(nextSequence++, event, clock.millis()));
            totalAdded++;
            while (ring.size() > settings.capacity()) {
                ring.removeFirst();
                totalEvicted++;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Selects promotable events with the configured thresholds.
     * @return The batch; commit it after a successful hand-off.
     */
    public PromotionBatch drainPromotable() {
        return drainPromotable(settings.highIntensityThreshold(), settings.repetitionThreshold());
    }

    /**
     * Scans the buffer without modifying its content and selects:
     * <ul>
     *   <li>every event with {@code |intensity| >= thresholdIntensity}, one promotion each;</li>
     *   <li>for every event type whose remaining occurrences number at least
     *       {@code repetitionThreshold}, one representative (the most intense, latest on ties)
     *       that consumes the whole group.</li>
     * </ul>
     * Promoted events are returned in buffer order.
     *
     * @param thresholdIntensity  Magnitude for individual promotion.
     * @param repetitionThreshold Occurrences for grouped promotion.
     * @return The batch; entries are removed from the buffer only on {@link PromotionBatch#commit()}.
     */
    public PromotionBatch drainPromotable(double thresholdIntensity, int repetitionThreshold) {
        if (repetitionThreshold < 1) {
            throw new IllegalArgumentException("repetitionThreshold must be >= 1");
        }
        lock.writeLock().lock();
        try {
            purgeExpired();

            List<Entry> selected = new ArrayList<>();
            Set<Long> consumed = new HashSet<>();
            Map<String, List<Entry>> groups = new LinkedHashMap<>();

            for (Entry entry : ring) {
                if (entry.event().magnitude() >= thresholdIntensity) {
                    selected.add(entry);
                    consumed.add(entry.sequence());
                } else {
                    groups.computeIfAbsent(entry.event().type(), k -> new ArrayList<>()).add(entry);
                }
            }
            for (List<Entry> group : groups.values()) {
                if (group.size() < repetitionThreshold) {
                    continue;
                }
                Entry representative = group.get(0);
                for (Entry candidate : group) {
                    if (candidate.event().magnitude() >= representative.event().magnitude()) {
                        representative = candidate;
                    }
                }
                selected.add(representative);
                for (Entry member : group) {
                    consumed.add(member.sequence());
                }
            }
            selected.sort(Comparator.comparingLong(Entry::sequence));

            List<Event> events = new ArrayList<>(selected.size());
            for (Entry entry : selected) {
                events.add(entry.event());
            }
            return new PromotionBatch(this, events, consumed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    void remove(Set<Long> sequences, int promotedCount) {
        lock.writeLock().lock();
        try {
            int before = ring.size();
            ring.removeIf(e -> sequences.contains(e.sequence()));
            totalConsumed += before - ring.size();
            totalPromoted += promotedCount;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @param maxEvents Maximum number of events, or {@code null} for all.
     * @return the most recent events, oldest first, without removing them.
     */
    public List<Event> peek(Integer maxEvents) {
        lock.writeLock().lock();
        try {
            purgeExpired();
            int skip = maxEvents == null ? 0 : Math.max(0, ring.size() - maxEvents);
            List<Event> events = new ArrayList<>();
            for (Entry entry : ring) {
                if (skip-- > 0) {
                    continue;
                }
                events.add(entry.event());
            }
            return events;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return occurrence counts and mean magnitudes per event type, in first-seen order.
     */
    public Map<String, TypeStatistics> typeStatistics() {
        lock.readLock().lock();
        try {
            Map<String, int[]> counts = new LinkedHashMap<>();
            Map<String, Double> sums = new LinkedHashMap<>();
            for (Entry entry : ring) {
                String type = entry.event().type();
                counts.computeIfAbsent(type, k -> new int[1])[0]++;
                sums.merge(type, entry.event().magnitude(), Double::sum);
            }
            Map<String, TypeStatistics> stats = new LinkedHashMap<>();
            for (Map.Entry<String, int[]> e : counts.entrySet()) {
                int count = e.getValue()[0];
                stats.put(e.getKey(), new TypeStatistics(count, sums.get(e.getKey()) / count));
            }
            return stats;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return ring.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public MemoryLevel getLevel() {
        return MemoryLevel.SENSORY;
    }

    @Override
    public boolean isAvailable() {
        return settings.enabled();
    }

    @Override
    public List<?> query(MemoryQueryParams params) {
        return peek(params.maxEvents());
    }

    @Override
    public Map<String, Object> getStatistics() {
        lock.readLock().lock();
        try {
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("buffer_size", ring.size());
            stats.put("buffer_capacity", settings.capacity());
            stats.put("utilization_percent", ring.size() * 100.0 / settings.capacity());
            stats.put("total_entries_added", totalAdded);
            stats.put("total_entries_evicted", totalEvicted);
            stats.put("total_entries_expired", totalExpired);
            stats.put("total_entries_consumed", totalConsumed);
            stats.put("total_events_promoted", totalPromoted);
            return stats;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            int cleared = ring.size();
            ring.clear();
            LOG.debug("Sensory buffer cleared ({} entries)", cleared);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public SensoryBufferSettings getSettings() {
        return settings;
    }

    // Caller holds the write lock
    private void purgeExpired() {
        if (settings.ttlSeconds() <= 0.0) {
            return;
        }
        long cutoff = clock.millis() - (long) (settings.ttlSeconds() * 1000.0);
        Iterator<Entry> it = ring.iterator();
        while (it.hasNext()) {
            if (it.next().addedAtMillis() < cutoff) {
                it.remove();
                totalExpired++;
            } else {
                break;
            }
        }
    }
}
