package org.vivarium.runtime.model;

import java.util.Locale;
import java.util.Optional;

/**
 * How the organism responds to an interpreted event. The tick engine scales the
 * event's impact by {@link #impactScale()} before applying it.
 */
public enum ResponsePattern {
    IGNORE,
    DAMPEN,
    ABSORB,
    AMPLIFY;

    /** Scale applied to a dampened impact. */
    public static final double DAMPEN_FACTOR = 0.5;
    /** Scale applied to an amplified impact. */
    public static final double AMPLIFY_FACTOR = 1.5;

    public double impactScale() {
        return switch (this) {
            case IGNORE -> 0.0;
            case DAMPEN -> DAMPEN_FACTOR;
            case ABSORB -> 1.0;
            case AMPLIFY -> AMPLIFY_FACTOR;
        };
    }

    /**
     * @return the lower-case identifier used in action ids, logs and persisted patterns.
     */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses an identifier produced by {@link #id()}, case-insensitively.
     * @param id The identifier.
     * @return The pattern, or empty if the identifier is unknown.
     */
    public static Optional<ResponsePattern> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (ResponsePattern p : values()) {
            if (p.name().equalsIgnoreCase(id.trim())) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }
}
