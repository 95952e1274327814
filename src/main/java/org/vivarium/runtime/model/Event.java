package org.vivarium.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable stimulus delivered to the organism.
 *
 * @param type      The event type, e.g. {@code noise}, {@code shock}, {@code recovery}.
 * @param intensity The signed intensity in {@code [-1, 1]}.
 * @param timestamp Wall-clock creation time in epoch seconds.
 * @param metadata  Free-form attributes attached by the producer.
 */
public record Event(String type, double intensity, double timestamp, Map<String, Object> metadata) {

    public Event {
        Objects.requireNonNull(type, "type");
        if (type.isBlank()) {
            throw new IllegalArgumentException("Event type must not be blank");
        }
        if (Double.isNaN(intensity) || intensity < -1.0 || intensity > 1.0) {
            throw new IllegalArgumentException("Event intensity must be within [-1, 1], got " + intensity);
        }
        metadata = metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Convenience constructor for an event without metadata.
     * @param type The event type.
     * @param intensity The signed intensity.
     * @param timestamp Epoch seconds.
     */
    public Event(String type, double intensity, double timestamp) {
        this(type, intensity, timestamp, Map.of());
    }

    /**
     * @return the magnitude of the intensity, ignoring its sign.
     */
    public double magnitude() {
        return Math.abs(intensity);
    }
}
