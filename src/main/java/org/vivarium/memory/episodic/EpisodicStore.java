package org.vivarium.memory.episodic;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.vivarium.memory.IMemoryStore;
import org.vivarium.memory.MemoryLevel;
import org.vivarium.memory.MemoryQueryParams;
import org.vivarium.runtime.model.EpisodicMemory;
import org.vivarium.runtime.model.MemoryEntry;

/**
 * Exposes an organism's {@link EpisodicMemory} as a level of the hierarchy. The memory itself
 * stays owned by its {@code SelfState}; this view only reads it, except for {@link #clear()}.
 */
public class EpisodicStore implements IMemoryStore {

    private final EpisodicMemory memory;
    private final boolean enabled;

    public EpisodicStore(EpisodicMemory memory, boolean enabled) {
        this.memory = Objects.requireNonNull(memory, "memory");
        this.enabled = enabled;
    }

    public EpisodicMemory getMemory() {
        return memory;
    }

    @Override
    public MemoryLevel getLevel() {
        return MemoryLevel.EPISODIC;
    }

    @Override
    public boolean isAvailable() {
        return enabled;
    }

    /**
     * Filters by the inclusive time range and by event type. Paging is left to the caller.
     */
    @Override
    public List<?> query(MemoryQueryParams params) {
        Double start = params.timeRangeStart();
        Double end = params.timeRangeEnd();
        Set<String> types = Set.copyOf(params.eventTypes());
        return memory.select(entry -> (start == null || entry.timestamp() >= start)
            && (end == null || entry.timestamp() <= end)
            && (types.isEmpty() || types.contains(entry.eventType())));
    }

    @Override
    public Map<String, Object> getStatistics() {
        List<MemoryEntry> entries = memory.snapshot();
        long feedback = entries.stream().filter(MemoryEntry::isFeedback).count();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("entries_count", entries.size());
        stats.put("feedback_entries", feedback);
        stats.put("oldest_timestamp", entries.isEmpty() ? 0.0 : entries.get(0).timestamp());
        stats.put("newest_timestamp", entries.isEmpty() ? 0.0 : entries.get(entries.size() - 1).timestamp());
        return stats;
    }

    @Override
    public void clear() {
        memory.reset();
    }
}
