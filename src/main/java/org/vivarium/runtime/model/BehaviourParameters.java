package org.vivarium.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable set of learnable behaviour parameters, every value within {@code [0, 1]}.
 * <ul>
 *   <li><b>sensitivity</b> per event type, nudging the appraisal weight of that type;</li>
 *   <li><b>thresholds</b> per event type, nudging the significance below which it is ignored;</li>
 *   <li><b>coefficients</b> per response pattern id, nudging the impact scale of that response.</li>
 * </ul>
 * Consumers apply the <em>drift</em> of a value from its default, so the default set leaves
 * behaviour unchanged.
 */
public final class BehaviourParameters {

    public static final String SENSITIVITY = "sensitivity";
    public static final String THRESHOLDS = "thresholds";
    public static final String COEFFICIENTS = "coefficients";

    private static final BehaviourParameters DEFAULTS = new BehaviourParameters(
        Map.of("noise", 0.2, "decay", 0.2, "recovery", 0.2, "shock", 0.2, "idle", 0.2),
        Map.of("noise", 0.1, "decay", 0.1, "recovery", 0.1, "shock", 0.1, "idle", 0.1),
        Map.of("dampen", 0.5, "absorb", 1.0, "ignore", 0.0));

    private final Map<String, Double> sensitivity;
    private final Map<String, Double> thresholds;
    private final Map<String, Double> coefficients;

    /**
     * @throws IllegalArgumentException if a value is not a finite number within {@code [0, 1]}.
     */
    public BehaviourParameters(Map<String, Double> sensitivity, Map<String, Double> thresholds,
                               Map<String, Double> coefficients) {
        this.sensitivity = checked(SENSITIVITY, sensitivity);
        this.thresholds = checked(THRESHOLDS, thresholds);
        this.coefficients = checked(COEFFICIENTS, coefficients);
    }

    public static BehaviourParameters defaults() {
        return DEFAULTS;
    }

    public Map<String, Double> getSensitivity() {
        return sensitivity;
    }

    public Map<String, Double> getThresholds() {
        return thresholds;
    }

    public Map<String, Double> getCoefficients() {
        return coefficients;
    }

    public double sensitivityDrift(String eventType) {
        return drift(sensitivity, DEFAULTS.sensitivity, eventType);
    }

    public double thresholdDrift(String eventType) {
        return drift(thresholds, DEFAULTS.thresholds, eventType);
    }

    public double coefficientDrift(String patternId) {
        return drift(coefficients, DEFAULTS.coefficients, patternId);
    }

    private static double drift(Map<String, Double> values, Map<String, Double> defaults, String key) {
        Double value = values.get(key);
        Double base = defaults.get(key);
        if (value == null || base == null) {
            return 0.0;
        }
        return value - base;
    }

    /**
     * @return a plain nested map, as stored in snapshots and adaptation records.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(SENSITIVITY, new LinkedHashMap<>(sensitivity));
        map.put(THRESHOLDS, new LinkedHashMap<>(thresholds));
        map.put(COEFFICIENTS, new LinkedHashMap<>(coefficients));
        return map;
    }

    /**
     * Reads the form produced by {@link #toMap()}. Missing groups fall back to the defaults.
     *
     * @throws IllegalArgumentException if a group or value has the wrong shape.
     */
    public static BehaviourParameters fromMap(Map<String, ?> map) {
        Objects.requireNonNull(map, "map");
        return new BehaviourParameters(
            group(map, SENSITIVITY, DEFAULTS.sensitivity),
            group(map, THRESHOLDS, DEFAULTS.thresholds),
            group(map, COEFFICIENTS, DEFAULTS.coefficients));
    }

    private static Map<String, Double> group(Map<String, ?> map, String name, Map<String, Double> fallback) {
        Object raw = map.get(name);
        if (raw == null) {
            return fallback;
        }
        if (!(raw instanceof Map<?, ?> values)) {
            throw new IllegalArgumentException(name + " must be an object");
        }
        Map<String, Double> result = new TreeMap<>();
        for (Map.Entry<?, ?> entry : values.entrySet()) {
            if (!(entry.getValue() instanceof Number number)) {
                throw new IllegalArgumentException(name + "." + entry.getKey() + " must be a number");
            }
            result.put(String.valueOf(entry.getKey()), number.doubleValue());
        }
        return result;
    }

    private static Map<String, Double> checked(String name, Map<String, Double> values) {
        Objects.requireNonNull(values, name);
        Map<String, Double> copy = new TreeMap<>();
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            Double value = entry.getValue();
            if (value == null || !Double.isFinite(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + "." + entry.getKey() + " must be within [0, 1], got " + value);
            }
            copy.put(entry.getKey(), value);
        }
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BehaviourParameters other)) {
            return false;
        }
        return sensitivity.equals(other.sensitivity)
            && thresholds.equals(other.thresholds)
            && coefficients.equals(other.coefficients);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sensitivity, thresholds, coefficients);
    }

    @Override
    public String toString() {
        return "BehaviourParameters" + toMap();
    }
}
