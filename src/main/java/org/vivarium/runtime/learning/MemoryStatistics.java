package org.vivarium.runtime.learning;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.vivarium.runtime.model.MemoryEntry;

/**
 * Aggregates over an episodic memory that drive a learning step.
 *
 * @param eventEntries          Number of non-feedback entries.
 * @param eventTypeCounts       Entries per event type.
 * @param significanceTotals    Summed significance per event type.
 * @param feedbackEntries       Number of feedback entries.
 * @param feedbackPatternCounts Feedback entries per response pattern id.
 */
public record MemoryStatistics(
    int eventEntries,
    Map<String, Integer> eventTypeCounts,
    Map<String, Double> significanceTotals,
    int feedbackEntries,
    Map<String, Integer> feedbackPatternCounts
) {

    public static final String ACTION_PATTERN_KEY = "action_pattern";

    public MemoryStatistics {
        eventTypeCounts = Collections.unmodifiableMap(new TreeMap<>(eventTypeCounts));
        significanceTotals = Collections.unmodifiableMap(new TreeMap<>(significanceTotals));
        feedbackPatternCounts = Collections.unmodifiableMap(new TreeMap<>(feedbackPatternCounts));
    }

    public static MemoryStatistics of(List<MemoryEntry> entries) {
        Map<String, Integer> counts = new TreeMap<>();
        Map<String, Double> totals = new TreeMap<>();
        Map<String, Integer> patterns = new TreeMap<>();
        int events = 0;
        int feedback = 0;
        for (MemoryEntry entry : entries) {
            if (entry.isFeedback()) {
                feedback++;
                Object pattern = entry.feedbackData().get(ACTION_PATTERN_KEY);
                if (pattern != null) {
                    patterns.merge(String.valueOf(pattern), 1, Integer::sum);
                }
            } else {
                events++;
                counts.merge(entry.eventType(), 1, Integer::sum);
                totals.merge(entry.eventType(), entry.meaningSignificance(), Double::sum);
            }
        }
        return new MemoryStatistics(events, counts, totals, feedback, patterns);
    }

    /**
     * @return the share of event entries with this type, 0 when there are none.
     */
    public double frequency(String eventType) {
        return eventEntries == 0 ? 0.0 : eventTypeCounts.getOrDefault(eventType, 0) / (double) eventEntries;
    }

    /**
     * @return the mean significance of this type, or 0 if it never occurred.
     */
    public double averageSignificance(String eventType) {
        int count = eventTypeCounts.getOrDefault(eventType, 0);
        return count == 0 ? 0.0 : significanceTotals.getOrDefault(eventType, 0.0) / count;
    }

    /**
     * @return the share of attributed feedback naming this pattern, 0 when there is none.
     */
    public double feedbackFrequency(String patternId) {
        int attributed = 0;
        for (int count : feedbackPatternCounts.values()) {
            attributed += count;
        }
        return attributed == 0 ? 0.0 : feedbackPatternCounts.getOrDefault(patternId, 0) / (double) attributed;
    }
}
