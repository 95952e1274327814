package org.vivarium.memory;

/**
 * Thrown when a memory query names an unknown level or carries malformed parameters.
 */
public class InvalidMemoryQueryException extends IllegalArgumentException {

    public InvalidMemoryQueryException(String message) {
        super(message);
    }
}
