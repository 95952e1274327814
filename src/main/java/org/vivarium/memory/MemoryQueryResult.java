package org.vivarium.memory;

import java.util.List;

/**
 * Outcome of {@link MemoryHierarchyManager#queryMemory(String, MemoryQueryParams)}.
 *
 * @param level         The queried level.
 * @param results       The matching items; empty on failure.
 * @param totalCount    Number of matches before paging.
 * @param params        The parameters used.
 * @param executionTime Wall time spent, in seconds.
 * @param success       {@code false} if the level was unavailable or its store failed.
 * @param errorMessage  Failure description, {@code null} on success.
 */
public record MemoryQueryResult(
    MemoryLevel level,
    List<?> results,
    int totalCount,
    MemoryQueryParams params,
    double executionTime,
    boolean success,
    String errorMessage
) {

    public MemoryQueryResult {
        results = results == null ? List.of() : List.copyOf(results);
    }

    static MemoryQueryResult success(MemoryLevel level, List<?> results, int totalCount,
                                     MemoryQueryParams params, double executionTime) {
        return new MemoryQueryResult(level, results, totalCount, params, executionTime, true, null);
    }

    static MemoryQueryResult failure(MemoryLevel level, MemoryQueryParams params,
                                     double executionTime, String errorMessage) {
        return new MemoryQueryResult(level, List.of(), 0, params, executionTime, false, errorMessage);
    }
}
