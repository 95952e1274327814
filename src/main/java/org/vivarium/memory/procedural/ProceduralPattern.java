package org.vivarium.memory.procedural;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A learned action sequence together with the conditions that trigger it and its track record.
 * <p>
 * <b>Automation:</b> after each recorded outcome the automation level rises by 0.1 when the
 * success rate over the recent outcome window exceeds 0.9 with at least five outcomes, and
 * falls by 0.1 when that rate is below 0.5. The pattern may run automatically only when the
 * level reaches {@link #getMinAutomationThreshold()} and every trigger condition matches the
 * context exactly.
 * <p>
 * Instances handed out by {@link ProceduralStore} are copies; mutators are package-private.
 */
public final class ProceduralPattern {

    static final double AUTOMATION_STEP = 0.1;
    static final int MIN_RECENT_OUTCOMES = 5;
    static final double RISE_ABOVE_SUCCESS_RATE = 0.9;
    static final double FALL_BELOW_SUCCESS_RATE = 0.5;
    static final double EXECUTION_TIME_SMOOTHING = 0.1;

    private final String patternId;
    private final String name;
    private final String description;
    private final List<ActionStep> actionSequence;
    private final Map<String, Object> triggerConditions;
    private long successCount;
    private long failureCount;
    private long totalExecutions;
    private double averageExecutionTime;
    private double automationLevel;
    private final double minAutomationThreshold;
    private final double createdAt;
    private double lastExecution;
    private double lastSuccess;
    private final int recentWindow;
    private final Deque<Boolean> recentOutcomes = new ArrayDeque<>();

    private ProceduralPattern(Builder b) {
        this.patternId = Objects.requireNonNull(b.patternId, "patternId");
        this.name = b.name == null ? patternId : b.name;
        this.description = b.description == null ? "" : b.description;
        this.actionSequence = List.copyOf(b.actionSequence);
        this.triggerConditions = ConditionValues.normalize(b.triggerConditions);
        if (b.successCount < 0 || b.failureCount < 0 || b.totalExecutions < 0) {
            throw new IllegalArgumentException("Execution counters must be >= 0");
        }
        this.successCount = b.successCount;
        this.failureCount = b.failureCount;
        this.totalExecutions = b.totalExecutions;
        this.averageExecutionTime = b.averageExecutionTime;
        this.automationLevel = clampUnit(b.automationLevel);
        this.minAutomationThreshold = b.minAutomationThreshold;
        this.createdAt = b.createdAt;
        this.lastExecution = b.lastExecution;
        this.lastSuccess = b.lastSuccess;
        if (b.recentWindow < MIN_RECENT_OUTCOMES) {
            throw new IllegalArgumentException("recentWindow must be >= " + MIN_RECENT_OUTCOMES);
        }
        this.recentWindow = b.recentWindow;
        for (Boolean outcome : b.recentOutcomes) {
            pushOutcome(outcome);
        }
    }

    public static Builder builder(String patternId) {
        return new Builder(patternId);
    }

    public String getPatternId() {
        return patternId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<ActionStep> getActionSequence() {
        return actionSequence;
    }

    public Map<String, Object> getTriggerConditions() {
        return triggerConditions;
    }

    public long getSuccessCount() {
        return successCount;
    }

    public long getFailureCount() {
        return failureCount;
    }

    public long getTotalExecutions() {
        return totalExecutions;
    }

    public double getAverageExecutionTime() {
        return averageExecutionTime;
    }

    public double getAutomationLevel() {
        return automationLevel;
    }

    public double getMinAutomationThreshold() {
        return minAutomationThreshold;
    }

    public double getCreatedAt() {
        return createdAt;
    }

    public double getLastExecution() {
        return lastExecution;
    }

    public double getLastSuccess() {
        return lastSuccess;
    }

    public int getRecentWindow() {
        return recentWindow;
    }

    public List<Boolean> getRecentOutcomes() {
        return List.copyOf(recentOutcomes);
    }

    /**
     * @return {@code success / (success + failure)}, 0 without outcomes.
     */
    public double successRate() {
        long attempts = successCount + failureCount;
        return attempts == 0 ? 0.0 : (double) successCount / attempts;
    }

    /**
     * @return {@code 0.5 * successRate + 0.3 * automationLevel + 0.2 * min(1, executions / 10)},
     *         or 0 if the pattern never ran.
     */
    public double effectiveness() {
        if (totalExecutions == 0) {
            return 0.0;
        }
        double experience = Math.min(1.0, totalExecutions / 10.0);
        return successRate() * 0.5 + automationLevel * 0.3 + experience * 0.2;
    }

    /**
     * @param context Behaviour context.
     * @return share of trigger conditions matched by the context; 0 without conditions.
     */
    public double conditionMatch(Map<String, ?> context) {
        return ConditionValues.matchFraction(triggerConditions, context);
    }

    /**
     * @param context Behaviour context.
     * @return {@code true} only if the automation level reached the threshold and every trigger
     *         condition equals the context value.
     */
    public boolean canAutomate(Map<String, ?> context) {
        if (automationLevel < minAutomationThreshold) {
            return false;
        }
        return triggerConditions.isEmpty() || conditionMatch(context) == 1.0;
    }

    /**
     * Records one execution outcome and re-evaluates the automation level.
     *
     * @param success       Whether the execution succeeded.
     * @param executionTime Wall time spent, in seconds.
     * @param now           Current time in epoch seconds.
     */
    void recordExecution(boolean success, double executionTime, double now) {
        totalExecutions++;
        lastExecution = now;
        if (success) {
            successCount++;
            lastSuccess = now;
        } else {
            failureCount++;
        }
        averageExecutionTime = averageExecutionTime == 0.0
            ? executionTime
            : EXECUTION_TIME_SMOOTHING * executionTime + (1 - EXECUTION_TIME_SMOOTHING) * averageExecutionTime;
        pushOutcome(success);
        reevaluateAutomation();
    }

    /**
     * Folds a duplicate into this pattern: counters add up, the better automation level and the
     * more recent timestamps win, and the duplicate's outcomes join the recent window.
     *
     * @param duplicate A pattern with the same action sequence and trigger conditions.
     */
    void absorb(ProceduralPattern duplicate) {
        successCount += duplicate.successCount;
        failureCount += duplicate.failureCount;
        totalExecutions += duplicate.totalExecutions;
        automationLevel = Math.max(automationLevel, duplicate.automationLevel);
        lastExecution = Math.max(lastExecution, duplicate.lastExecution);
        lastSuccess = Math.max(lastSuccess, duplicate.lastSuccess);
        if (averageExecutionTime == 0.0) {
            averageExecutionTime = duplicate.averageExecutionTime;
        }
        for (Boolean outcome : duplicate.recentOutcomes) {
            pushOutcome(outcome);
        }
        reevaluateAutomation();
    }

    /**
     * Lowers the automation level by one step, not below zero.
     * @return {@code true} if the level changed.
     */
    boolean decayAutomation() {
        double before = automationLevel;
        automationLevel = clampUnit(automationLevel - AUTOMATION_STEP);
        return automationLevel != before;
    }

    boolean isDuplicateOf(ProceduralPattern other) {
        return actionSequence.equals(other.actionSequence) && triggerConditions.equals(other.triggerConditions);
    }

    private void reevaluateAutomation() {
        if (recentOutcomes.isEmpty()) {
            return;
        }
        long recentSuccesses = recentOutcomes.stream().filter(Boolean::booleanValue).count();
        double recentRate = (double) recentSuccesses / recentOutcomes.size();
        if (recentOutcomes.size() >= MIN_RECENT_OUTCOMES && recentRate > RISE_ABOVE_SUCCESS_RATE) {
            automationLevel = clampUnit(automationLevel + AUTOMATION_STEP);
        } else if (recentRate < FALL_BELOW_SUCCESS_RATE) {
            automationLevel = clampUnit(automationLevel - AUTOMATION_STEP);
        }
    }

    private void pushOutcome(boolean success) {
        recentOutcomes.addLast(success);
        while (recentOutcomes.size() > recentWindow) {
            recentOutcomes.removeFirst();
        }
    }

    /**
     * @return a deep copy.
     */
    public ProceduralPattern copy() {
        return toBuilder().build();
    }

    public Builder toBuilder() {
        return new Builder(patternId)
            .name(name)
            .description(description)
            .actionSequence(actionSequence)
            .triggerConditions(triggerConditions)
            .successCount(successCount)
            .failureCount(failureCount)
            .totalExecutions(totalExecutions)
            .averageExecutionTime(averageExecutionTime)
            .automationLevel(automationLevel)
            .minAutomationThreshold(minAutomationThreshold)
            .createdAt(createdAt)
            .lastExecution(lastExecution)
            .lastSuccess(lastSuccess)
            .recentWindow(recentWindow)
            .recentOutcomes(new ArrayList<>(recentOutcomes));
    }

    private static double clampUnit(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    @Override
    public String toString() {
        return "ProceduralPattern{" + patternId + ", automation=" + automationLevel
            + ", executions=" + totalExecutions + "}";
    }

    /**
     * Builder for {@link ProceduralPattern}. Counters default to zero, the automation threshold to
     * 0.8 and the recent outcome window to 10.
     */
    public static final class Builder {
        private final String patternId;
        private String name;
        private String description;
        private List<ActionStep> actionSequence = List.of();
        private Map<String, ?> triggerConditions = Map.of();
        private long successCount;
        private long failureCount;
        private long totalExecutions;
        private double averageExecutionTime;
        private double automationLevel;
        private double minAutomationThreshold = ProceduralStoreSettings.DEFAULT_MIN_AUTOMATION_THRESHOLD;
        private double createdAt;
        private double lastExecution;
        private double lastSuccess;
        private int recentWindow = ProceduralStoreSettings.DEFAULT_RECENT_OUTCOME_WINDOW;
        private List<Boolean> recentOutcomes = List.of();

        private Builder(String patternId) {
            this.patternId = patternId;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder actionSequence(List<ActionStep> actionSequence) {
            this.actionSequence = actionSequence;
            return this;
        }

        public Builder triggerConditions(Map<String, ?> triggerConditions) {
            this.triggerConditions = triggerConditions;
            return this;
        }

        public Builder successCount(long successCount) {
            this.successCount = successCount;
            return this;
        }

        public Builder failureCount(long failureCount) {
            this.failureCount = failureCount;
            return this;
        }

        public Builder totalExecutions(long totalExecutions) {
            this.totalExecutions = totalExecutions;
            return this;
        }

        public Builder averageExecutionTime(double averageExecutionTime) {
            this.averageExecutionTime = averageExecutionTime;
            return this;
        }

        public Builder automationLevel(double automationLevel) {
            this.automationLevel = automationLevel;
            return this;
        }

        public Builder minAutomationThreshold(double minAutomationThreshold) {
            this.minAutomationThreshold = minAutomationThreshold;
            return this;
        }

        public Builder createdAt(double createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder lastExecution(double lastExecution) {
            this.lastExecution = lastExecution;
            return this;
        }

        public Builder lastSuccess(double lastSuccess) {
            this.lastSuccess = lastSuccess;
            return this;
        }

        public Builder recentWindow(int recentWindow) {
            this.recentWindow = recentWindow;
            return this;
        }

        public Builder recentOutcomes(List<Boolean> recentOutcomes) {
            this.recentOutcomes = recentOutcomes;
            return this;
        }

        public ProceduralPattern build() {
            return new ProceduralPattern(this);
        }
    }
}
