package org.vivarium.runtime.model;

import java.util.List;
import java.util.Map;

import com.google.gson.JsonObject;

/**
 * Point-in-time copy of everything needed to resume an organism.
 *
 * @param tick               Tick counter at capture time.
 * @param capturedAt         Capture time in epoch seconds.
 * @param vital              Energy, stability and integrity.
 * @param age                Age in seconds.
 * @param subjectiveTime     Subjective time in seconds.
 * @param lastEventIntensity Smoothed recent event intensity.
 * @param memory             Episodic memory, oldest first.
 * @param pendingActions     Actions awaiting attribution, in registration order.
 * @param adaptationHistory  Plain records exposed to the control plane.
 * @param hierarchy          Serialized semantic and procedural stores, or {@code null}.
 * @param learningParams     Parameters the learning step steers towards.
 * @param adaptationParams   Parameters currently applied.
 */
public record LifeSnapshot(
    long tick,
    double capturedAt,
    StateVector vital,
    double age,
    double subjectiveTime,
    double lastEventIntensity,
    List<MemoryEntry> memory,
    List<PendingAction> pendingActions,
    List<Map<String, Object>> adaptationHistory,
    JsonObject hierarchy,
    BehaviourParameters learningParams,
    BehaviourParameters adaptationParams
) {

    public LifeSnapshot {
        memory = memory == null ? List.of() : List.copyOf(memory);
        pendingActions = pendingActions == null ? List.of() : List.copyOf(pendingActions);
        adaptationHistory = adaptationHistory == null ? List.of() : List.copyOf(adaptationHistory);
        learningParams = learningParams == null ? BehaviourParameters.defaults() : learningParams;
        adaptationParams = adaptationParams == null ? BehaviourParameters.defaults() : adaptationParams;
    }

    /**
     * Captures a state. Must be called on the tick thread.
     *
     * @param state          The organism state.
     * @param pendingActions The tracker's pending actions.
     * @param hierarchy      The serialized hierarchy, or {@code null}.
     * @param capturedAt     Capture time in epoch seconds.
     * @return The snapshot.
     */
    public static LifeSnapshot capture(SelfState state, List<PendingAction> pendingActions,
                                       JsonObject hierarchy, double capturedAt) {
        return new LifeSnapshot(
            state.getTicks(),
            capturedAt,
            state.vector(),
            state.getAge(),
            state.getSubjectiveTime(),
            state.getLastEventIntensity(),
            state.getMemory().snapshot(),
            pendingActions,
            state.getAdaptationHistory(),
            hierarchy,
            state.getLearningParams(),
            state.getAdaptationParams());
    }

    /**
     * Writes this snapshot's values into a state, replacing its memory and history.
     * @param state The state to overwrite.
     */
    public void restoreInto(SelfState state) {
        state.restoreClocks(tick, age, subjectiveTime);
        state.setEnergy(vital.energy());
        state.setStability(vital.stability());
        state.setIntegrity(vital.integrity());
        state.setLastEventIntensity(lastEventIntensity);
        state.getMemory().replaceAll(memory);
        for (Map<String, Object> record : adaptationHistory) {
            state.recordAdaptation(record);
        }
        state.setLearningParams(learningParams);
        state.setAdaptationParams(adaptationParams);
    }
}
