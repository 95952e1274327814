package org.vivarium.memory.procedural;

import java.util.Map;
import java.util.Objects;

/**
 * One step of a procedural action sequence.
 *
 * @param actionType The action, e.g. a response pattern id such as {@code "dampen"}.
 * @param parameters Action parameters; values are normalized like trigger conditions.
 */
public record ActionStep(String actionType, Map<String, Object> parameters) {

    public ActionStep {
        Objects.requireNonNull(actionType, "actionType");
        parameters = ConditionValues.normalize(parameters);
    }

    public ActionStep(String actionType) {
        this(actionType, Map.of());
    }
}
