package org.vivarium.runtime.spi;

import java.util.Optional;

import org.vivarium.runtime.model.Event;

/**
 * Produces events for the organism, typically once per tick.
 */
public interface IEventSource {

    /**
     * @return the next event, or empty if the source has nothing to deliver right now.
     */
    Optional<Event> next();
}
