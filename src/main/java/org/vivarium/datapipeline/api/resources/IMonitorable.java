package org.vivarium.datapipeline.api.resources;

import java.util.List;
import java.util.Map;

/**
 * Exposes metrics, transient errors and a health verdict.
 */
public interface IMonitorable {

    /**
     * @return current metric values keyed by metric name.
     */
    Map<String, Number> getMetrics();

    /**
     * @return recorded operational errors, oldest first.
     */
    List<OperationalError> getErrors();

    void clearErrors();

    boolean isHealthy();
}
