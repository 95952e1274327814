package org.vivarium.memory.procedural;

import com.typesafe.config.Config;

/**
 * Tunables of the {@link ProceduralStore}.
 *
 * @param enabled                 Whether the store participates in the hierarchy.
 * @param minAutomationThreshold  Automation level a pattern needs to run automatically.
 * @param recommendationThreshold Match fraction a decision pattern must exceed to be recommended.
 * @param recentOutcomeWindow     Number of recent outcomes the automation rule evaluates.
 */
public record ProceduralStoreSettings(
    boolean enabled,
    double minAutomationThreshold,
    double recommendationThreshold,
    int recentOutcomeWindow
) {

    public static final double DEFAULT_MIN_AUTOMATION_THRESHOLD = 0.8;
    public static final double DEFAULT_RECOMMENDATION_THRESHOLD = 0.7;
    public static final int DEFAULT_RECENT_OUTCOME_WINDOW = 10;

    public ProceduralStoreSettings {
        if (minAutomationThreshold <= 0.0 || minAutomationThreshold > 1.0) {
            throw new IllegalArgumentException("minAutomationThreshold must be within (0, 1]");
        }
        if (recommendationThreshold < 0.0 || recommendationThreshold >= 1.0) {
            throw new IllegalArgumentException("recommendationThreshold must be within [0, 1)");
        }
        if (recentOutcomeWindow < ProceduralPattern.MIN_RECENT_OUTCOMES) {
            throw new IllegalArgumentException("recentOutcomeWindow must be >= " + ProceduralPattern.MIN_RECENT_OUTCOMES);
        }
    }

    public static ProceduralStoreSettings defaults() {
        return new ProceduralStoreSettings(true, DEFAULT_MIN_AUTOMATION_THRESHOLD,
            DEFAULT_RECOMMENDATION_THRESHOLD, DEFAULT_RECENT_OUTCOME_WINDOW);
    }

    public static ProceduralStoreSettings fromConfig(Config options) {
        return new ProceduralStoreSettings(
            !options.hasPath("enabled") || options.getBoolean("enabled"),
            options.hasPath("minAutomationThreshold") ? options.getDouble("minAutomationThreshold") : DEFAULT_MIN_AUTOMATION_THRESHOLD,
            options.hasPath("recommendationThreshold") ? options.getDouble("recommendationThreshold") : DEFAULT_RECOMMENDATION_THRESHOLD,
            options.hasPath("recentOutcomeWindow") ? options.getInt("recentOutcomeWindow") : DEFAULT_RECENT_OUTCOME_WINDOW);
    }
}
