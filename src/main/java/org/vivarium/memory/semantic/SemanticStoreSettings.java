package org.vivarium.memory.semantic;

import com.typesafe.config.Config;

/**
 * Tunables of the {@link SemanticStore} and of episodic-to-semantic promotion.
 *
 * @param enabled                      Whether the store participates in the hierarchy.
 * @param occurrenceThreshold          Occurrences of one event type in the window that form a concept.
 * @param recentWindow                 Number of most recent episodic entries examined.
 * @param confidenceSmoothing          Exponential smoothing factor applied to concept confidence.
 * @param consolidationIntervalSeconds Minimum time between knowledge consolidations.
 * @param associationStaleSeconds      Age after which an association starts to weaken.
 * @param associationDecay             Factor applied to stale associations.
 * @param associationMinStrength       Associations weaker than this are removed.
 * @param associationIncrement         Strength added per co-occurrence.
 */
public record SemanticStoreSettings(
    boolean enabled,
    int occurrenceThreshold,
    int recentWindow,
    double confidenceSmoothing,
    double consolidationIntervalSeconds,
    double associationStaleSeconds,
    double associationDecay,
    double associationMinStrength,
    double associationIncrement
) {

    public SemanticStoreSettings {
        if (occurrenceThreshold < 1) {
            throw new IllegalArgumentException("occurrenceThreshold must be >= 1");
        }
        if (recentWindow < occurrenceThreshold) {
            throw new IllegalArgumentException("recentWindow must be >= occurrenceThreshold");
        }
        if (confidenceSmoothing <= 0.0 || confidenceSmoothing > 1.0) {
            throw new IllegalArgumentException("confidenceSmoothing must be within (0, 1]");
        }
        if (associationDecay <= 0.0 || associationDecay > 1.0) {
            throw new IllegalArgumentException("associationDecay must be within (0, 1]");
        }
    }

    public static SemanticStoreSettings defaults() {
        return new SemanticStoreSettings(true, 10, 50, 0.3, 60.0, 7 * 24 * 3600.0, 0.9, 0.05, 0.1);
    }

    public static SemanticStoreSettings fromConfig(Config options) {
        SemanticStoreSettings d = defaults();
        return new SemanticStoreSettings(
            !options.hasPath("enabled") || options.getBoolean("enabled"),
            options.hasPath("occurrenceThreshold") ? options.getInt("occurrenceThreshold") : d.occurrenceThreshold(),
            options.hasPath("recentWindow") ? options.getInt("recentWindow") : d.recentWindow(),
            options.hasPath("confidenceSmoothing") ? options.getDouble("confidenceSmoothing") : d.confidenceSmoothing(),
            options.hasPath("consolidationIntervalSeconds") ? options.getDouble("consolidationIntervalSeconds") : d.consolidationIntervalSeconds(),
            options.hasPath("associationStaleSeconds") ? options.getDouble("associationStaleSeconds") : d.associationStaleSeconds(),
            options.hasPath("associationDecay") ? options.getDouble("associationDecay") : d.associationDecay(),
            options.hasPath("associationMinStrength") ? options.getDouble("associationMinStrength") : d.associationMinStrength(),
            options.hasPath("associationIncrement") ? options.getDouble("associationIncrement") : d.associationIncrement());
    }
}
