package org.vivarium.runtime.feedback;

import com.typesafe.config.Config;

/**
 * Tunables of the {@link FeedbackTracker}.
 *
 * @param minDelayTicks Lower bound of the sampled attribution delay.
 * @param maxDelayTicks Upper bound of the sampled attribution delay, inclusive.
 * @param timeoutTicks  Pending actions waiting longer than this are dropped.
 * @param noiseFloor    Deltas whose largest component is below this value produce no record.
 */
public record FeedbackSettings(int minDelayTicks, int maxDelayTicks, int timeoutTicks, double noiseFloor) {

    public static final int DEFAULT_MIN_DELAY_TICKS = 3;
    public static final int DEFAULT_MAX_DELAY_TICKS = 10;
    public static final int DEFAULT_TIMEOUT_TICKS = 20;
    public static final double DEFAULT_NOISE_FLOOR = 0.001;

    public FeedbackSettings {
        if (minDelayTicks < 1) {
            throw new IllegalArgumentException("minDelayTicks must be >= 1");
        }
        if (maxDelayTicks < minDelayTicks) {
            throw new IllegalArgumentException("maxDelayTicks must be >= minDelayTicks");
        }
        if (timeoutTicks < maxDelayTicks) {
            throw new IllegalArgumentException("timeoutTicks must be >= maxDelayTicks");
        }
        if (noiseFloor < 0.0) {
            throw new IllegalArgumentException("noiseFloor must be >= 0");
        }
    }

    public static FeedbackSettings defaults() {
        return new FeedbackSettings(DEFAULT_MIN_DELAY_TICKS, DEFAULT_MAX_DELAY_TICKS, DEFAULT_TIMEOUT_TICKS, DEFAULT_NOISE_FLOOR);
    }

    /**
     * Reads the settings from a {@code feedback} config block, falling back to defaults for missing keys.
     * @param options The config block.
     * @return The settings.
     */
    public static FeedbackSettings fromConfig(Config options) {
        return new FeedbackSettings(
            options.hasPath("minDelayTicks") ? options.getInt("minDelayTicks") : DEFAULT_MIN_DELAY_TICKS,
            options.hasPath("maxDelayTicks") ? options.getInt("maxDelayTicks") : DEFAULT_MAX_DELAY_TICKS,
            options.hasPath("timeoutTicks") ? options.getInt("timeoutTicks") : DEFAULT_TIMEOUT_TICKS,
            options.hasPath("noiseFloor") ? options.getDouble("noiseFloor") : DEFAULT_NOISE_FLOOR);
    }
}
