package org.vivarium.memory.procedural;

import java.util.List;

/**
 * Result of an automatic pattern execution.
 *
 * @param patternId     The executed pattern.
 * @param success       Whether the sequence ran.
 * @param executionTime Wall time spent, in seconds.
 * @param actions       The executed steps, in order.
 * @param relevance     Relevance of the pattern in the execution context.
 */
public record PatternExecution(String patternId, boolean success, double executionTime,
                               List<ActionStep> actions, double relevance) {

    public PatternExecution {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    /**
     * @return the action type of the first step, or {@code null} for an empty sequence.
     */
    public String firstActionType() {
        return actions.isEmpty() ? null : actions.get(0).actionType();
    }
}
