package org.vivarium.runtime.spi;

import java.util.Map;

/**
 * Fire-and-forget sink for structured runtime records (event processed, feedback emitted, ...).
 * <p>
 * Implementations must never block the caller and must never throw; records may be dropped
 * under load.
 */
public interface IStructuredLogSink {

    /** A sink that discards everything. */
    IStructuredLogSink NO_OP = (type, fields) -> { };

    /**
     * @param type   Record type, e.g. {@code "event"} or {@code "feedback"}.
     * @param fields Record payload. The sink copies it; callers may reuse the map.
     */
    void log(String type, Map<String, Object> fields);
}
