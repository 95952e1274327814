package org.vivarium.memory;

import java.util.List;
import java.util.Map;

/**
 * A level of the memory hierarchy as seen by the {@link MemoryHierarchyManager}.
 */
public interface IMemoryStore {

    MemoryLevel getLevel();

    /**
     * @return {@code false} if the store is disabled or not usable; the manager then skips it.
     */
    boolean isAvailable();

    /**
     * Runs a level-specific query. Parameters have already been validated.
     *
     * @param params The query parameters.
     * @return All matches, before paging by the manager.
     */
    List<?> query(MemoryQueryParams params);

    /**
     * @return counters and sizes describing the store.
     */
    Map<String, Object> getStatistics();

    /**
     * Removes all content.
     */
    void clear();
}
