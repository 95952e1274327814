package org.vivarium.memory.procedural;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Canonical form of condition and parameter maps: sorted keys, integral numbers as {@link Long},
 * other numbers as {@link Double}. Two maps that describe the same situation are then equal,
 * also after a JSON round trip.
 */
final class ConditionValues {

    private ConditionValues() {
    }

    static Map<String, Object> normalize(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> normalized = new TreeMap<>();
        for (Map.Entry<String, ?> e : values.entrySet()) {
            normalized.put(Objects.requireNonNull(e.getKey(), "condition key"), normalizeValue(e.getValue()));
        }
        return Collections.unmodifiableMap(normalized);
    }

    static Object normalizeValue(Object value) {
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return value;
    }

    /**
     * @return the share of {@code expected} keys whose normalized value equals the one in {@code actual}.
     */
    static double matchFraction(Map<String, Object> expected, Map<String, ?> actual) {
        if (expected.isEmpty()) {
            return 0.0;
        }
        int matches = 0;
        for (Map.Entry<String, Object> e : expected.entrySet()) {
            Object actualValue = actual.containsKey(e.getKey()) ? normalizeValue(actual.get(e.getKey())) : null;
            if (Objects.equals(e.getValue(), actualValue)) {
                matches++;
            }
        }
        return (double) matches / expected.size();
    }
}
