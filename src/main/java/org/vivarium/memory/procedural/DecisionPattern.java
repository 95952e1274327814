package org.vivarium.memory.procedural;

import java.util.Map;
import java.util.Objects;

/**
 * Association between a situation and the decision taken in it.
 */
public final class DecisionPattern {

    private final String patternId;
    private final Map<String, Object> conditions;
    private final String decision;
    private final String outcome;
    private final double confidence;
    private long usageCount;

    public DecisionPattern(String patternId, Map<String, ?> conditions, String decision,
                           String outcome, double confidence, long usageCount) {
        this.patternId = Objects.requireNonNull(patternId, "patternId");
        this.conditions = ConditionValues.normalize(conditions);
        this.decision = Objects.requireNonNull(decision, "decision");
        this.outcome = outcome == null ? "" : outcome;
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
        this.usageCount = usageCount;
    }

    public String getPatternId() {
        return patternId;
    }

    public Map<String, Object> getConditions() {
        return conditions;
    }

    public String getDecision() {
        return decision;
    }

    public String getOutcome() {
        return outcome;
    }

    public double getConfidence() {
        return confidence;
    }

    public long getUsageCount() {
        return usageCount;
    }

    /**
     * @param current The current conditions.
     * @return {@code matching keys / condition keys}; 0 if this pattern has no conditions.
     */
    public double matches(Map<String, ?> current) {
        return ConditionValues.matchFraction(conditions, current);
    }

    /**
     * @return the normalized conditions; patterns with equal conditions share this key.
     */
    Map<String, Object> conditionKey() {
        return conditions;
    }

    void markUsed() {
        usageCount++;
    }

    public DecisionPattern copy() {
        return new DecisionPattern(patternId, conditions, decision, outcome, confidence, usageCount);
    }
}
