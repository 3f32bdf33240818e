package com.travelmesh.observability;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate health of every registered component.
 *
 * @param status    overall health (worst of the individual results)
 * @param checks    individual results keyed by component name
 * @param timestamp when the probes completed
 */
public record HealthResult(
        HealthStatus status,
        Map<String, ComponentHealth> checks,
        Instant timestamp
) {

    public HealthResult {
        checks = Map.copyOf(checks);
    }
}
