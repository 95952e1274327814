package org.vivarium.runtime.learning;

import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vivarium.runtime.model.BehaviourParameters;
import org.vivarium.runtime.model.SelfState;

/**
 * Slowly shifts the learning parameters of a {@link SelfState} from episodic statistics.
 * <p>
 * Every value moves by {@link #MAX_STEP} at most per call and stays within {@code [0, 1]}:
 * <ul>
 *   <li>an event type seen in more than 20% of entries gains sensitivity, one below 10% loses it;</li>
 *   <li>a type whose mean significance exceeds 0.5 gets a lower ignore threshold, one below 0.2 a
 *       higher one;</li>
 *   <li>a response named in more than 30% of attributed feedback gets a larger coefficient, one
 *       below 10% a smaller one.</li>
 * </ul>
 * Types or patterns absent from the current parameters are not learned.
 */
public class LearningEngine {

    private static final Logger LOG = LoggerFactory.getLogger(LearningEngine.class);

    public static final double MAX_STEP = 0.01;
    public static final double MIN_STEP = 0.001;

    static final double HIGH_FREQUENCY = 0.2;
    static final double LOW_FREQUENCY = 0.1;
    static final double HIGH_SIGNIFICANCE = 0.5;
    static final double LOW_SIGNIFICANCE = 0.2;
    static final double HIGH_PATTERN_FREQUENCY = 0.3;
    static final double LOW_PATTERN_FREQUENCY = 0.1;

    /**
     * Runs one learning step on the state's own memory and stores the result.
     *
     * @param state The organism, on its tick thread.
     * @return The new learning parameters.
     */
    public BehaviourParameters learn(SelfState state) {
        MemoryStatistics statistics = MemoryStatistics.of(state.getMemory().snapshot());
        BehaviourParameters current = state.getLearningParams();
        BehaviourParameters next = adjust(statistics, current);
        if (!next.equals(current)) {
            state.setLearningParams(next);
            LOG.debug("Learning step at tick {} over {} entries: {}", state.getTicks(),
                statistics.eventEntries() + statistics.feedbackEntries(), next);
        }
        return next;
    }

    /**
     * @return the parameters after one step; {@code current} itself is not modified.
     */
    public BehaviourParameters adjust(MemoryStatistics statistics, BehaviourParameters current) {
        Map<String, Double> sensitivity = new TreeMap<>(current.getSensitivity());
        if (statistics.eventEntries() > 0) {
            for (Map.Entry<String, Double> entry : current.getSensitivity().entrySet()) {
                double frequency = statistics.frequency(entry.getKey());
                step(sensitivity, entry.getKey(), entry.getValue(),
                    direction(frequency, HIGH_FREQUENCY, LOW_FREQUENCY));
            }
        }

        Map<String, Double> thresholds = new TreeMap<>(current.getThresholds());
        for (Map.Entry<String, Double> entry : current.getThresholds().entrySet()) {
            if (statistics.eventTypeCounts().getOrDefault(entry.getKey(), 0) == 0) {
                continue;
            }
            // High significance lowers the threshold
            double average = statistics.averageSignificance(entry.getKey());
            step(thresholds, entry.getKey(), entry.getValue(),
                -direction(average, HIGH_SIGNIFICANCE, LOW_SIGNIFICANCE));
        }

        Map<String, Double> coefficients = new TreeMap<>(current.getCoefficients());
        if (!statistics.feedbackPatternCounts().isEmpty()) {
            for (Map.Entry<String, Double> entry : current.getCoefficients().entrySet()) {
                double frequency = statistics.feedbackFrequency(entry.getKey());
                step(coefficients, entry.getKey(), entry.getValue(),
                    direction(frequency, HIGH_PATTERN_FREQUENCY, LOW_PATTERN_FREQUENCY));
            }
        }
        return new BehaviourParameters(sensitivity, thresholds, coefficients);
    }

    private static int direction(double value, double high, double low) {
        if (value > high) {
            return 1;
        }
        return value < low ? -1 : 0;
    }

    private static void step(Map<String, Double> target, String key, double current, int direction) {
        double next = Math.max(0.0, Math.min(1.0, current + direction * MAX_STEP));
        if (Math.abs(next - current) >= MIN_STEP) {
            target.put(key, next);
        }
    }
}
