package org.vivarium.runtime.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The attributed consequence of a resolved {@link PendingAction}.
 *
 * @param actionId         Id of the resolved action.
 * @param actionPattern    The response that was taken.
 * @param stateBefore      Vital state when the action was registered.
 * @param stateDelta       Change of the vital state since registration.
 * @param delayTicks       Ticks between registration and resolution.
 * @param associatedEvents Event types that triggered the action.
 * @param timestamp        Resolution time in epoch seconds.
 */
public record FeedbackRecord(
    String actionId,
    ResponsePattern actionPattern,
    StateVector stateBefore,
    StateVector stateDelta,
    int delayTicks,
    List<String> associatedEvents,
    double timestamp
) {

    public FeedbackRecord {
        Objects.requireNonNull(actionId, "actionId");
        Objects.requireNonNull(actionPattern, "actionPattern");
        Objects.requireNonNull(stateBefore, "stateBefore");
        Objects.requireNonNull(stateDelta, "stateDelta");
        associatedEvents = associatedEvents == null ? List.of() : List.copyOf(associatedEvents);
    }

    /**
     * @return the first associated event type, or {@code null} if none was recorded.
     */
    public String triggerEventType() {
        return associatedEvents.isEmpty() ? null : associatedEvents.get(0);
    }

    /**
     * Weighted net change, positive when the action left the organism better off.
     * Energy is normalized to the unit range of the other two quantities.
     *
     * @return {@code Δenergy/100 + Δstability + Δintegrity}.
     */
    public double netOutcome() {
        return stateDelta.energy() / SelfState.MAX_ENERGY + stateDelta.stability() + stateDelta.integrity();
    }

    /**
     * @return the payload stored in a {@code feedback} {@link MemoryEntry}.
     */
    public Map<String, Object> toFeedbackData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("action_id", actionId);
        data.put("action_pattern", actionPattern.id());
        data.put("state_delta", stateDelta.toMap());
        data.put("delay_ticks", delayTicks);
        data.put("associated_events", associatedEvents);
        data.put("timestamp", timestamp);
        return data;
    }
}
