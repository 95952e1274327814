package org.vivarium.runtime.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The organism's mutable vital state.
 * <p>
 * <b>Ownership:</b> a SelfState is mutated only by the tick thread. Other threads read
 * {@link #vector()} copies or snapshots; the episodic memory is internally synchronized.
 * <p>
 * <b>Bounds:</b> every mutation clamps energy to {@code [0, 100]} and stability and integrity
 * to {@code [0, 1]}.
 */
public class SelfState {

    public static final double MAX_ENERGY = 100.0;
    public static final int RECENT_EVENTS_CAPACITY = 20;
    public static final int ADAPTATION_HISTORY_CAPACITY = 100;

    private double energy = MAX_ENERGY;
    private double stability = 1.0;
    private double integrity = 1.0;
    private long ticks;
    private double age;
    private double subjectiveTime;

    private double lastEventIntensity;
    private ResponsePattern lastPattern;
    private double lastSignificance;

    private final EpisodicMemory memory = new EpisodicMemory();
    private final Deque<Event> recentEvents = new ArrayDeque<>();
    private final List<Map<String, Object>> adaptationHistory = new ArrayList<>();

    private volatile BehaviourParameters learningParams = BehaviourParameters.defaults();
    private volatile BehaviourParameters adaptationParams = BehaviourParameters.defaults();

    public double getEnergy() {
        return energy;
    }

    public void setEnergy(double energy) {
        this.energy = clamp(energy, 0.0, MAX_ENERGY);
    }

    public double getStability() {
        return stability;
    }

    public void setStability(double stability) {
        this.stability = clamp(stability, 0.0, 1.0);
    }

    public double getIntegrity() {
        return integrity;
    }

    public void setIntegrity(double integrity) {
        this.integrity = clamp(integrity, 0.0, 1.0);
    }

    public long getTicks() {
        return ticks;
    }

    public double getAge() {
        return age;
    }

    public double getSubjectiveTime() {
        return subjectiveTime;
    }

    public EpisodicMemory getMemory() {
        return memory;
    }

    /**
     * Advances the clocks by one tick.
     *
     * @param dt Elapsed seconds since the previous tick.
     */
    public void advance(double dt) {
        ticks++;
        age += dt;
        subjectiveTime += dt;
    }

    /**
     * Adds a delta to the vital quantities, clamping each to its range.
     *
     * @param delta The change to apply.
     */
    public void applyDelta(StateVector delta) {
        setEnergy(energy + delta.energy());
        setStability(stability + delta.stability());
        setIntegrity(integrity + delta.integrity());
    }

    public StateVector vector() {
        return new StateVector(energy, stability, integrity);
    }

    /**
     * @return {@code true} while every vital quantity is above zero.
     */
    public boolean isActive() {
        return energy > 0.0 && integrity > 0.0 && stability > 0.0;
    }

    /**
     * @return {@code true} while the organism is comfortably above its critical thresholds.
     */
    public boolean isViable() {
        return energy > 10.0 && integrity > 0.1 && stability > 0.1;
    }

    public double getLastEventIntensity() {
        return lastEventIntensity;
    }

    public void setLastEventIntensity(double lastEventIntensity) {
        this.lastEventIntensity = clamp(lastEventIntensity, 0.0, 1.0);
    }

    public ResponsePattern getLastPattern() {
        return lastPattern;
    }

    public double getLastSignificance() {
        return lastSignificance;
    }

    /**
     * Records the most recent interpretation.
     * @param pattern The response that was applied.
     * @param significance The significance of the event.
     */
    public void recordResponse(ResponsePattern pattern, double significance) {
        this.lastPattern = pattern;
        this.lastSignificance = significance;
    }

    /**
     * Remembers an event in the bounded recent-events window, evicting the oldest.
     * @param event The processed event.
     */
    public void rememberRecent(Event event) {
        recentEvents.addLast(event);
        while (recentEvents.size() > RECENT_EVENTS_CAPACITY) {
            recentEvents.removeFirst();
        }
    }

    public List<Event> getRecentEvents() {
        return List.copyOf(recentEvents);
    }

    /**
     * Appends a plain record to the adaptation history exposed to the control plane.
     * @param record The record to append.
     */
    public void recordAdaptation(Map<String, Object> record) {
        adaptationHistory.add(Collections.unmodifiableMap(new LinkedHashMap<>(record)));
        while (adaptationHistory.size() > ADAPTATION_HISTORY_CAPACITY) {
            adaptationHistory.remove(0);
        }
    }

    public List<Map<String, Object>> getAdaptationHistory() {
        return Collections.unmodifiableList(new ArrayList<>(adaptationHistory));
    }

    /**
     * @return the values the learning step is steering towards.
     */
    public BehaviourParameters getLearningParams() {
        return learningParams;
    }

    public void setLearningParams(BehaviourParameters learningParams) {
        this.learningParams = Objects.requireNonNull(learningParams, "learningParams");
    }

    /**
     * @return the values currently applied by interpretation and response scaling.
     */
    public BehaviourParameters getAdaptationParams() {
        return adaptationParams;
    }

    public void setAdaptationParams(BehaviourParameters adaptationParams) {
        this.adaptationParams = Objects.requireNonNull(adaptationParams, "adaptationParams");
    }

    /**
     * Restores the clocks from a snapshot. Vital quantities go through their clamping setters.
     *
     * @param ticks Tick counter.
     * @param age Age in seconds.
     * @param subjectiveTime Subjective time in seconds.
     */
    public void restoreClocks(long ticks, double age, double subjectiveTime) {
        if (ticks < 0) {
            throw new IllegalArgumentException("ticks must be >= 0");
        }
        this.ticks = ticks;
        this.age = age;
        this.subjectiveTime = subjectiveTime;
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}
