package org.vivarium.datapipeline.api.resources;

import java.time.Instant;

/**
 * A transient error that did not stop the component reporting it.
 *
 * @param timestamp When the error occurred.
 * @param code      Category such as {@code TICK_FAILED}.
 * @param message   Human-readable summary.
 * @param details   Additional context.
 */
public record OperationalError(Instant timestamp, String code, String message, String details) {
}
