package org.vivarium.runtime.spi;

import org.vivarium.runtime.model.Event;
import org.vivarium.runtime.model.Meaning;
import org.vivarium.runtime.model.SelfState;

/**
 * Interprets events for the tick engine: how significant an event is, what it would do to
 * the vital state, and how the organism chooses to respond.
 * <p>
 * Implementations must not mutate the state they are given.
 */
public interface IMeaningEngine {

    /**
     * @param event The event to interpret.
     * @param state The current organism state, read-only.
     * @return The interpretation. The impact is unscaled; the tick engine applies the pattern.
     */
    Meaning interpret(Event event, SelfState state);
}
