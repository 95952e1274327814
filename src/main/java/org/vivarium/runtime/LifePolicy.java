package org.vivarium.runtime;

import org.vivarium.runtime.model.SelfState;
import org.vivarium.runtime.model.StateVector;

import com.typesafe.config.Config;

/**
 * Penalizes an organism that has fallen below its weakness threshold.
 * <p>
 * An organism is weak when stability, integrity or energy as a share of {@link SelfState#MAX_ENERGY}
 * is below the threshold. The penalty
 * {@code k * (sm * max(0, t - stability) + im * max(0, t - integrity)) * dt}
 * is split 20/40/40 over energy, stability and integrity.
 *
 * @param enabled               Whether the penalty applies at all.
 * @param weaknessThreshold     Threshold {@code t}.
 * @param penaltyK              Coefficient {@code k}.
 * @param stabilityMultiplier   Multiplier {@code sm}.
 * @param integrityMultiplier   Multiplier {@code im}.
 */
public record LifePolicy(
    boolean enabled,
    double weaknessThreshold,
    double penaltyK,
    double stabilityMultiplier,
    double integrityMultiplier
) {

    private static final double ENERGY_SHARE = 0.2;
    private static final double STABILITY_SHARE = 0.4;
    private static final double INTEGRITY_SHARE = 0.4;

    public LifePolicy {
        if (weaknessThreshold < 0.0 || penaltyK < 0.0 || stabilityMultiplier < 0.0 || integrityMultiplier < 0.0) {
            throw new IllegalArgumentException("Weakness parameters must be non-negative");
        }
    }

    public static LifePolicy defaults() {
        return new LifePolicy(true, 0.05, 0.02, 2.0, 2.0);
    }

    public static LifePolicy fromConfig(Config options) {
        LifePolicy d = defaults();
        return new LifePolicy(
            !options.hasPath("enabled") || options.getBoolean("enabled"),
            options.hasPath("threshold") ? options.getDouble("threshold") : d.weaknessThreshold(),
            options.hasPath("penaltyK") ? options.getDouble("penaltyK") : d.penaltyK(),
            options.hasPath("stabilityMultiplier") ? options.getDouble("stabilityMultiplier") : d.stabilityMultiplier(),
            options.hasPath("integrityMultiplier") ? options.getDouble("integrityMultiplier") : d.integrityMultiplier());
    }

    public boolean isWeak(SelfState state) {
        return state.getEnergy() / SelfState.MAX_ENERGY < weaknessThreshold
            || state.getIntegrity() < weaknessThreshold
            || state.getStability() < weaknessThreshold;
    }

    /**
     * @param state The organism.
     * @param dt    Elapsed seconds.
     * @return The (non-positive) delta to apply, zero if disabled or not weak.
     */
    public StateVector penalty(SelfState state, double dt) {
        if (!enabled || !isWeak(state)) {
            return new StateVector(0.0, 0.0, 0.0);
        }
        double total = penaltyK * dt
            * (stabilityMultiplier * Math.max(0.0, weaknessThreshold - state.getStability())
            + integrityMultiplier * Math.max(0.0, weaknessThreshold - state.getIntegrity()));
        return new StateVector(-total * ENERGY_SHARE, -total * STABILITY_SHARE, -total * INTEGRITY_SHARE);
    }
}
