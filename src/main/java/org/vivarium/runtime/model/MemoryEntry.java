package org.vivarium.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single episodic record. Entries are never mutated after creation.
 *
 * @param eventType           The event type this entry remembers, or {@code feedback}.
 * @param meaningSignificance Significance in {@code [0, 1]} assigned at creation.
 * @param timestamp           Wall-clock time in epoch seconds.
 * @param weight              Retention weight, 1.0 when fresh.
 * @param subjectiveTimestamp The organism's subjective time at creation.
 * @param feedbackData        Feedback payload for {@code feedback} entries, empty otherwise.
 */
public record MemoryEntry(
    String eventType,
    double meaningSignificance,
    double timestamp,
    double weight,
    double subjectiveTimestamp,
    Map<String, Object> feedbackData
) {

    public static final String FEEDBACK_TYPE = "feedback";

    public MemoryEntry {
        Objects.requireNonNull(eventType, "eventType");
        if (meaningSignificance < 0.0 || meaningSignificance > 1.0) {
            throw new IllegalArgumentException("Significance must be within [0, 1], got " + meaningSignificance);
        }
        feedbackData = feedbackData == null || feedbackData.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(feedbackData));
    }

    public MemoryEntry(String eventType, double meaningSignificance, double timestamp, double subjectiveTimestamp) {
        this(eventType, meaningSignificance, timestamp, 1.0, subjectiveTimestamp, Map.of());
    }

    public boolean isFeedback() {
        return FEEDBACK_TYPE.equals(eventType);
    }
}
