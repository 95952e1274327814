package org.vivarium.memory.procedural;

/**
 * A pattern ranked for a context.
 *
 * @param pattern   Copy of the pattern.
 * @param relevance {@code 0.4 * conditionMatch + 0.4 * effectiveness + 0.2 * recency}.
 */
public record ScoredPattern(ProceduralPattern pattern, double relevance) {
}
