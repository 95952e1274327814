package org.vivarium.runtime;

import java.util.List;

import org.vivarium.memory.ConsolidationResult;
import org.vivarium.runtime.model.FeedbackRecord;

/**
 * Summary of one tick.
 *
 * @param tick             Tick counter after the tick.
 * @param eventsProcessed  Events taken from the queue.
 * @param feedback         Feedback records resolved this tick.
 * @param automatedActions Responses chosen by a learned pattern.
 * @param consolidation    Consolidation result, {@code null} if none ran.
 * @param error            Failure description, {@code null} if the tick completed.
 */
public record TickReport(
    long tick,
    int eventsProcessed,
    List<FeedbackRecord> feedback,
    int automatedActions,
    ConsolidationResult consolidation,
    String error
) {

    public TickReport {
        feedback = feedback == null ? List.of() : List.copyOf(feedback);
    }

    public boolean failed() {
        return error != null;
    }
}
