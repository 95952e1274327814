package org.vivarium.memory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one consolidation pass.
 *
 * @param sensoryToEpisodicTransfers  Events promoted into episodic memory.
 * @param episodicToSemanticTransfers Concepts created or reinforced.
 * @param semanticConsolidations      Associations weakened or removed.
 * @param proceduralOptimizations     Patterns merged, removed or decayed.
 * @param timestamp                   Start time in epoch seconds.
 * @param duration                    Wall time spent, in seconds.
 * @param success                     {@code false} only if every executed stage failed.
 * @param errorMessage                Summary of stage failures, {@code null} if none failed.
 * @param details                     Per-stage outcome, keyed by stage name.
 */
public record ConsolidationResult(
    int sensoryToEpisodicTransfers,
    int episodicToSemanticTransfers,
    int semanticConsolidations,
    int proceduralOptimizations,
    double timestamp,
    double duration,
    boolean success,
    String errorMessage,
    Map<String, String> details
) {

    public ConsolidationResult {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public int totalTransfers() {
        return sensoryToEpisodicTransfers + episodicToSemanticTransfers;
    }
}
