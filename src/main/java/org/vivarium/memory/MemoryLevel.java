package org.vivarium.memory;

import java.util.Locale;

/**
 * The levels of the memory hierarchy, from most transient to most abstract.
 */
public enum MemoryLevel {
    SENSORY,
    EPISODIC,
    SEMANTIC,
    PROCEDURAL;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param level A level name such as {@code "semantic"}, case-insensitive.
     * @return The matching level.
     * @throws InvalidMemoryQueryException if the name is null or unknown.
     */
    public static MemoryLevel parse(String level) {
        if (level != null) {
            for (MemoryLevel candidate : values()) {
                if (candidate.name().equalsIgnoreCase(level.trim())) {
                    return candidate;
                }
            }
        }
        throw new InvalidMemoryQueryException("Unknown memory level: " + level
            + " (expected one of sensory, episodic, semantic, procedural)");
    }
}
