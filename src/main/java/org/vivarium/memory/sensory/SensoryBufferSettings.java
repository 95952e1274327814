package org.vivarium.memory.sensory;

import com.typesafe.config.Config;

/**
 * Tunables of the {@link SensoryBuffer} and of its promotion into episodic memory.
 *
 * @param enabled                 Whether the buffer participates in the hierarchy.
 * @param capacity                Ring capacity; the oldest entry is evicted beyond it.
 * @param ttlSeconds              Entry lifetime; 0 disables expiry.
 * @param highIntensityThreshold  Events at or above this magnitude are promoted individually.
 * @param repetitionThreshold     Occurrences of one event type that trigger a grouped promotion.
 */
public record SensoryBufferSettings(
    boolean enabled,
    int capacity,
    double ttlSeconds,
    double highIntensityThreshold,
    int repetitionThreshold
) {

    public static final int DEFAULT_CAPACITY = 256;
    public static final double DEFAULT_TTL_SECONDS = 30.0;
    public static final double DEFAULT_HIGH_INTENSITY_THRESHOLD = 0.8;
    public static final int DEFAULT_REPETITION_THRESHOLD = 5;

    public SensoryBufferSettings {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        if (ttlSeconds < 0.0) {
            throw new IllegalArgumentException("ttlSeconds must be >= 0");
        }
        if (highIntensityThreshold <= 0.0 || highIntensityThreshold > 1.0) {
            throw new IllegalArgumentException("highIntensityThreshold must be within (0, 1]");
        }
        if (repetitionThreshold < 1) {
            throw new IllegalArgumentException("repetitionThreshold must be >= 1");
        }
    }

    public static SensoryBufferSettings defaults() {
        return new SensoryBufferSettings(true, DEFAULT_CAPACITY, DEFAULT_TTL_SECONDS,
            DEFAULT_HIGH_INTENSITY_THRESHOLD, DEFAULT_REPETITION_THRESHOLD);
    }

    public static SensoryBufferSettings fromConfig(Config options) {
        return new SensoryBufferSettings(
            !options.hasPath("enabled") || options.getBoolean("enabled"),
            options.hasPath("capacity") ? options.getInt("capacity") : DEFAULT_CAPACITY,
            options.hasPath("ttlSeconds") ? options.getDouble("ttlSeconds") : DEFAULT_TTL_SECONDS,
            options.hasPath("highIntensityThreshold") ? options.getDouble("highIntensityThreshold") : DEFAULT_HIGH_INTENSITY_THRESHOLD,
            options.hasPath("repetitionThreshold") ? options.getInt("repetitionThreshold") : DEFAULT_REPETITION_THRESHOLD);
    }
}
