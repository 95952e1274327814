package org.vivarium.memory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameters of a memory query. Which fields apply depends on the level:
 * <ul>
 *   <li>sensory: {@code maxEvents}</li>
 *   <li>episodic: {@code timeRangeStart}, {@code timeRangeEnd}, {@code eventTypes}, {@code offset}, {@code limit}</li>
 *   <li>semantic: {@code query}, {@code confidenceThreshold}, {@code limit}</li>
 *   <li>procedural: {@code context}, {@code limit}</li>
 * </ul>
 * Unset optional fields are {@code null}.
 *
 * @param limit               Maximum number of results.
 * @param offset              Number of results to skip.
 * @param query               Free text for semantic search.
 * @param confidenceThreshold Minimum concept confidence.
 * @param maxEvents           Maximum number of sensory events.
 * @param context             Behaviour context for procedural lookups.
 * @param timeRangeStart      Inclusive lower bound on episodic timestamps.
 * @param timeRangeEnd        Inclusive upper bound on episodic timestamps.
 * @param eventTypes          Episodic event types to include; empty means all.
 */
public record MemoryQueryParams(
    Integer limit,
    int offset,
    String query,
    Double confidenceThreshold,
    Integer maxEvents,
    Map<String, Object> context,
    Double timeRangeStart,
    Double timeRangeEnd,
    List<String> eventTypes
) {

    public MemoryQueryParams {
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        eventTypes = eventTypes == null ? List.of() : List.copyOf(eventTypes);
    }

    public static MemoryQueryParams empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws InvalidMemoryQueryException if any parameter is out of range.
     */
    public void validate() {
        if (limit != null && limit < 0) {
            throw new InvalidMemoryQueryException("limit must be >= 0, got " + limit);
        }
        if (offset < 0) {
            throw new InvalidMemoryQueryException("offset must be >= 0, got " + offset);
        }
        if (maxEvents != null && maxEvents < 0) {
            throw new InvalidMemoryQueryException("maxEvents must be >= 0, got " + maxEvents);
        }
        if (confidenceThreshold != null
            && (Double.isNaN(confidenceThreshold) || confidenceThreshold < 0.0 || confidenceThreshold > 1.0)) {
            throw new InvalidMemoryQueryException("confidenceThreshold must be within [0, 1], got " + confidenceThreshold);
        }
        if (timeRangeStart != null && timeRangeEnd != null && timeRangeStart > timeRangeEnd) {
            throw new InvalidMemoryQueryException("timeRangeStart must not be after timeRangeEnd");
        }
    }

    /**
     * Fluent builder for {@link MemoryQueryParams}.
     */
    public static final class Builder {
        private Integer limit;
        private int offset;
        private String query;
        private Double confidenceThreshold;
        private Integer maxEvents;
        private Map<String, Object> context;
        private Double timeRangeStart;
        private Double timeRangeEnd;
        private List<String> eventTypes;

        private Builder() {
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder confidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
            return this;
        }

        public Builder maxEvents(int maxEvents) {
            this.maxEvents = maxEvents;
            return this;
        }

        public Builder context(Map<String, Object> context) {
            this.context = context;
            return this;
        }

        public Builder timeRange(double start, double end) {
            this.timeRangeStart = start;
            this.timeRangeEnd = end;
            return this;
        }

        public Builder eventTypes(List<String> eventTypes) {
            this.eventTypes = eventTypes;
            return this;
        }

        public MemoryQueryParams build() {
            return new MemoryQueryParams(limit, offset, query, confidenceThreshold, maxEvents,
                context, timeRangeStart, timeRangeEnd, eventTypes);
        }
    }
}
