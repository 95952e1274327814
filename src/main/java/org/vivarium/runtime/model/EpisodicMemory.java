package org.vivarium.runtime.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Append-only, time-ordered sequence of {@link MemoryEntry} records owned by a {@link SelfState}.
 * <p>
 * The tick thread appends; the query surface and consolidation may read concurrently.
 * Entries are only removed by an explicit {@link #reset()}.
 */
public class EpisodicMemory {

    private final List<MemoryEntry> entries = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public void append(MemoryEntry entry) {
        Objects.requireNonNull(entry, "entry");
        lock.writeLock().lock();
        try {
            entries.add(entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return a copy of all entries, oldest first.
     */
    public List<MemoryEntry> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the most recent entries, oldest first.
     *
     * @param count Maximum number of entries to return.
     * @return A copy of at most {@code count} trailing entries.
     */
    public List<MemoryEntry> recent(int count) {
        lock.readLock().lock();
        try {
            int from = Math.max(0, entries.size() - Math.max(0, count));
            return new ArrayList<>(entries.subList(from, entries.size()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @param filter Selection predicate.
     * @return a copy of the matching entries, oldest first.
     */
    public List<MemoryEntry> select(Predicate<MemoryEntry> filter) {
        lock.readLock().lock();
        try {
            List<MemoryEntry> result = new ArrayList<>();
            for (MemoryEntry entry : entries) {
                if (filter.test(entry)) {
                    result.add(entry);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the contents, used when restoring from a snapshot.
     * @param restored Entries in chronological order.
     */
    public void replaceAll(List<MemoryEntry> restored) {
        lock.writeLock().lock();
        try {
            entries.clear();
            entries.addAll(restored);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void reset() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
