package org.vivarium.runtime.meaning;

import java.util.HashMap;
import java.util.Map;

import org.vivarium.runtime.model.Event;
import org.vivarium.runtime.model.Meaning;
import org.vivarium.runtime.model.ResponsePattern;
import org.vivarium.runtime.model.SelfState;
import org.vivarium.runtime.model.StateVector;
import org.vivarium.runtime.spi.IMeaningEngine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Default {@link IMeaningEngine}: appraisal, impact model and response selection.
 * <p>
 * <b>Appraisal:</b> {@code |intensity| * typeWeight}, raised by 1.5 when integrity is low and by
 * 1.2 when stability is low, clamped to {@code [0, 1]}.
 * <p>
 * <b>Impact:</b> a base impact per event type, scaled by {@code |intensity| * significance}.
 * <p>
 * <b>Response:</b> insignificant events are ignored, a very stable organism dampens, an unstable
 * one amplifies, otherwise the impact is absorbed.
 * <p>
 * Type weights can be overridden with a {@code typeWeights} block in the options. The state's
 * adapted {@link org.vivarium.runtime.model.BehaviourParameters} shift the weight and the ignore
 * threshold of each type by their drift from the defaults.
 */
public class MeaningEngine implements IMeaningEngine {

    private static final Map<String, Double> DEFAULT_TYPE_WEIGHTS = Map.of(
        "shock", 1.5,
        "noise", 0.5,
        "recovery", 1.0,
        "decay", 1.0,
        "idle", 0.2);

    private static final Map<String, StateVector> BASE_IMPACTS = Map.of(
        "shock", new StateVector(-1.5, -0.10, -0.05),
        "noise", new StateVector(-0.3, -0.02, 0.0),
        "recovery", new StateVector(1.0, 0.05, 0.02),
        "decay", new StateVector(-0.5, -0.01, -0.01),
        "idle", new StateVector(-0.1, 0.0, 0.0));

    private static final StateVector NO_IMPACT = new StateVector(0.0, 0.0, 0.0);

    private final Map<String, Double> typeWeights;
    private final double significanceThreshold;
    private final double dampenAboveStability;
    private final double amplifyBelowStability;
    private final double lowIntegrityThreshold;
    private final double lowStabilityThreshold;

    public MeaningEngine() {
        this(ConfigFactory.empty());
    }

    /**
     * @param options The {@code meaning} config block; every key is optional.
     */
    public MeaningEngine(Config options) {
        this.typeWeights = new HashMap<>(DEFAULT_TYPE_WEIGHTS);
        if (options.hasPath("typeWeights")) {
            Config weights = options.getConfig("typeWeights");
            for (String type : weights.root().keySet()) {
                double w = weights.getDouble(type);
                if (w < 0.0) {
                    throw new IllegalArgumentException("typeWeights." + type + " must be >= 0");
                }
                typeWeights.put(type, w);
            }
        }
        this.significanceThreshold = readDouble(options, "significanceThreshold", 0.1);
        this.dampenAboveStability = readDouble(options, "dampenAboveStability", 0.8);
        this.amplifyBelowStability = readDouble(options, "amplifyBelowStability", 0.3);
        this.lowIntegrityThreshold = readDouble(options, "lowIntegrityThreshold", 0.3);
        this.lowStabilityThreshold = readDouble(options, "lowStabilityThreshold", 0.5);
    }

    @Override
    public Meaning interpret(Event event, SelfState state) {
        double significance = appraise(event, state);
        StateVector impact = impactOf(event, significance);
        ResponsePattern pattern = chooseResponse(event, state, significance);
        return new Meaning(pattern, impact, significance);
    }

    double appraise(Event event, SelfState state) {
        double weight = typeWeights.getOrDefault(event.type(), 1.0)
            + state.getAdaptationParams().sensitivityDrift(event.type());
        double significance = event.magnitude() * Math.max(0.0, weight);
        if (state.getIntegrity() < lowIntegrityThreshold) {
            significance *= 1.5;
        }
        if (state.getStability() < lowStabilityThreshold) {
            significance *= 1.2;
        }
        return Math.max(0.0, Math.min(1.0, significance));
    }

    StateVector impactOf(Event event, double significance) {
        StateVector base = BASE_IMPACTS.getOrDefault(event.type(), NO_IMPACT);
        double scale = event.magnitude() * significance;
        return new StateVector(base.energy() * scale, base.stability() * scale, base.integrity() * scale);
    }

    ResponsePattern chooseResponse(Event event, SelfState state, double significance) {
        double threshold = significanceThreshold + state.getAdaptationParams().thresholdDrift(event.type());
        if (significance < threshold) {
            return ResponsePattern.IGNORE;
        }
        if (state.getStability() > dampenAboveStability) {
            return ResponsePattern.DAMPEN;
        }
        if (state.getStability() < amplifyBelowStability) {
            return ResponsePattern.AMPLIFY;
        }
        return ResponsePattern.ABSORB;
    }

    private static double readDouble(Config options, String path, double defaultValue) {
        return options.hasPath(path) ? options.getDouble(path) : defaultValue;
    }
}
