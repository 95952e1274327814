package org.vivarium.runtime;

import java.util.Objects;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Tunables of the {@link TickEngine}, read from the {@code vivarium.runtime} block.
 *
 * @param consolidationInterval    Ticks between memory consolidations.
 * @param fatalIntegrityPenalty    Integrity lost when a tick fails.
 * @param intensityHistoryCapacity Samples kept for intensity smoothing.
 * @param intensitySmoothing       Smoothing factor of the intensity signal.
 * @param proceduralIntegration    Whether learned patterns may override responses and learn from feedback.
 * @param lifePolicy               Weakness penalty.
 * @param learningInterval         Ticks between learning steps, 0 to disable learning.
 * @param adaptationInterval       Ticks between adaptation steps, 0 to disable adaptation.
 */
public record TickEngineSettings(
    int consolidationInterval,
    double fatalIntegrityPenalty,
    int intensityHistoryCapacity,
    double intensitySmoothing,
    boolean proceduralIntegration,
    LifePolicy lifePolicy,
    int learningInterval,
    int adaptationInterval
) {

    public TickEngineSettings {
        if (consolidationInterval < 1) {
            throw new IllegalArgumentException("consolidationInterval must be >= 1");
        }
        if (fatalIntegrityPenalty < 0.0 || fatalIntegrityPenalty > 1.0) {
            throw new IllegalArgumentException("fatalIntegrityPenalty must be within [0, 1]");
        }
        Objects.requireNonNull(lifePolicy, "lifePolicy");
        if (learningInterval < 0 || adaptationInterval < 0) {
            throw new IllegalArgumentException("learningInterval and adaptationInterval must be >= 0");
        }
    }

    public static TickEngineSettings defaults() {
        return new TickEngineSettings(10, 0.05, 16, 0.3, true, LifePolicy.defaults(), 75, 100);
    }

    public static TickEngineSettings fromConfig(Config options) {
        TickEngineSettings d = defaults();
        return new TickEngineSettings(
            options.hasPath("consolidationInterval") ? options.getInt("consolidationInterval") : d.consolidationInterval(),
            options.hasPath("fatalIntegrityPenalty") ? options.getDouble("fatalIntegrityPenalty") : d.fatalIntegrityPenalty(),
            options.hasPath("intensityHistoryCapacity") ? options.getInt("intensityHistoryCapacity") : d.intensityHistoryCapacity(),
            options.hasPath("intensitySmoothing") ? options.getDouble("intensitySmoothing") : d.intensitySmoothing(),
            !options.hasPath("proceduralIntegration") || options.getBoolean("proceduralIntegration"),
            LifePolicy.fromConfig(options.hasPath("weakness") ? options.getConfig("weakness") : ConfigFactory.empty()),
            options.hasPath("learningInterval") ? options.getInt("learningInterval") : d.learningInterval(),
            options.hasPath("adaptationInterval") ? options.getInt("adaptationInterval") : d.adaptationInterval());
    }
}
