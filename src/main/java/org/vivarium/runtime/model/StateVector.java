package org.vivarium.runtime.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only copy of the three vital quantities of a {@link SelfState}.
 *
 * @param energy    Energy in {@code [0, 100]}.
 * @param stability Stability in {@code [0, 1]}.
 * @param integrity Integrity in {@code [0, 1]}.
 */
public record StateVector(double energy, double stability, double integrity) {

    public static final String ENERGY = "energy";
    public static final String STABILITY = "stability";
    public static final String INTEGRITY = "integrity";

    /**
     * Computes {@code this - before} component-wise.
     * @param before The earlier vector.
     * @return The change from {@code before} to this vector.
     */
    public StateVector minus(StateVector before) {
        return new StateVector(
            energy - before.energy,
            stability - before.stability,
            integrity - before.integrity);
    }

    public double maxAbsComponent() {
        return Math.max(Math.abs(energy), Math.max(Math.abs(stability), Math.abs(integrity)));
    }

    /**
     * @return the vector as an ordered map keyed by {@link #ENERGY}, {@link #STABILITY}, {@link #INTEGRITY}.
     */
    public Map<String, Double> toMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put(ENERGY, energy);
        map.put(STABILITY, stability);
        map.put(INTEGRITY, integrity);
        return map;
    }

    /**
     * Builds a vector from a map, treating missing keys as zero.
     * @param values The map to read.
     * @return The corresponding vector.
     */
    public static StateVector fromMap(Map<String, ? extends Number> values) {
        return new StateVector(
            read(values, ENERGY),
            read(values, STABILITY),
            read(values, INTEGRITY));
    }

    private static double read(Map<String, ? extends Number> values, String key) {
        Number n = values.get(key);
        return n == null ? 0.0 : n.doubleValue();
    }
}
