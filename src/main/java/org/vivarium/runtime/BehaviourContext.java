package org.vivarium.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

import org.vivarium.runtime.model.SelfState;
import org.vivarium.runtime.model.StateVector;

/**
 * Coarse description of a situation, used as procedural trigger conditions:
 * {@code {event_type, energy_level, stability_level}} with levels {@code low}, {@code normal}
 * or {@code high}.
 */
public final class BehaviourContext {

    public static final String EVENT_TYPE = "event_type";
    public static final String ENERGY_LEVEL = "energy_level";
    public static final String STABILITY_LEVEL = "stability_level";
    public static final String UNKNOWN_EVENT = "unknown";

    private BehaviourContext() {
    }

    /**
     * @param eventType The event type, or {@code null} if unknown.
     * @param vital     The vital state.
     * @return A fresh, ordered context map.
     */
    public static Map<String, Object> of(String eventType, StateVector vital) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(EVENT_TYPE, eventType == null ? UNKNOWN_EVENT : eventType);
        context.put(ENERGY_LEVEL, level(vital.energy() / SelfState.MAX_ENERGY));
        context.put(STABILITY_LEVEL, level(vital.stability()));
        return context;
    }

    static String level(double unitValue) {
        if (unitValue < 0.3) {
            return "low";
        }
        return unitValue > 0.7 ? "high" : "normal";
    }
}
