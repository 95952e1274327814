package org.vivarium.runtime.learning;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vivarium.runtime.model.BehaviourParameters;
import org.vivarium.runtime.model.SelfState;

/**
 * Moves the applied parameters of a {@link SelfState} towards its learning parameters, by
 * {@link #MAX_STEP} at most per value and call. Each effective step is appended to the
 * adaptation history as a {@value #RECORD_TYPE} record.
 */
public class AdaptationManager {

    private static final Logger LOG = LoggerFactory.getLogger(AdaptationManager.class);

    public static final double MAX_STEP = 0.01;
    public static final double MIN_STEP = 0.001;
    public static final String RECORD_TYPE = "parameter_adaptation";

    private final Clock clock;

    public AdaptationManager(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param state The organism, on its tick thread.
     * @return The recorded changes per group and key, empty when nothing moved.
     */
    public Map<String, Object> adapt(SelfState state) {
        BehaviourParameters current = state.getAdaptationParams();
        BehaviourParameters target = state.getLearningParams();

        Map<String, Object> changes = new LinkedHashMap<>();
        Map<String, Double> sensitivity = approach(BehaviourParameters.SENSITIVITY,
            current.getSensitivity(), target.getSensitivity(), changes);
        Map<String, Double> thresholds = approach(BehaviourParameters.THRESHOLDS,
            current.getThresholds(), target.getThresholds(), changes);
        Map<String, Double> coefficients = approach(BehaviourParameters.COEFFICIENTS,
            current.getCoefficients(), target.getCoefficients(), changes);
        if (changes.isEmpty()) {
            return changes;
        }

        BehaviourParameters next = new BehaviourParameters(sensitivity, thresholds, coefficients);
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("type", RECORD_TYPE);
        record.put("timestamp", clock.millis() / 1000.0);
        record.put("tick", state.getTicks());
        record.put("old_params", current.toMap());
        record.put("new_params", next.toMap());
        record.put("changes", changes);
        record.put("learning_params_snapshot", target.toMap());
        state.setAdaptationParams(next);
        state.recordAdaptation(record);
        LOG.debug("Adapted behaviour at tick {}: {}", state.getTicks(), changes);
        return changes;
    }

    private static Map<String, Double> approach(String group, Map<String, Double> current,
                                                Map<String, Double> target, Map<String, Object> changes) {
        Map<String, Double> result = new TreeMap<>(current);
        Map<String, Object> groupChanges = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : target.entrySet()) {
            String key = entry.getKey();
            double goal = entry.getValue();
            // New keys start at their learned value
            double old = current.getOrDefault(key, goal);
            double diff = goal - old;
            if (Math.abs(diff) < MIN_STEP) {
                result.put(key, old);
                continue;
            }
            double value = old + Math.signum(diff) * Math.min(Math.abs(diff), MAX_STEP);
            result.put(key, value);
            Map<String, Object> change = new LinkedHashMap<>();
            change.put("old", old);
            change.put("new", value);
            change.put("delta", value - old);
            groupChanges.put(key, change);
        }
        if (!groupChanges.isEmpty()) {
            changes.put(group, groupChanges);
        }
        return result;
    }
}
