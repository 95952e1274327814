package org.vivarium.runtime.model;

import java.util.Objects;

/**
 * The interpretation of an event.
 *
 * @param pattern      The chosen response.
 * @param impact       The unscaled impact on the vital quantities.
 * @param significance How much the event matters, in {@code [0, 1]}.
 */
public record Meaning(ResponsePattern pattern, StateVector impact, double significance) {

    public Meaning {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(impact, "impact");
        if (significance < 0.0 || significance > 1.0) {
            throw new IllegalArgumentException("Significance must be within [0, 1], got " + significance);
        }
    }
}
