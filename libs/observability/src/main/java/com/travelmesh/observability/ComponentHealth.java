package com.travelmesh.observability;

import java.util.Map;

/**
 * Health result for a single component (a worker agent, the context service, a gateway).
 *
 * @param name      component name (e.g. "hotel-agent", "context-service")
 * @param status    health status of this component
 * @param message   optional human-readable message (e.g. the failure reason)
 * @param latencyMs time taken to probe this component
 * @param details   extra facts reported by the probe (e.g. tool count); never null
 */
public record ComponentHealth(
        String name,
        HealthStatus status,
        String message,
        long latencyMs,
        Map<String, Object> details
) {

    public ComponentHealth {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    /** Creates a healthy component result. */
    public static ComponentHealth healthy(String name, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, null, latencyMs, Map.of());
    }

    /** Creates a healthy component result with probe details. */
    public static ComponentHealth healthy(String name, long latencyMs, Map<String, Object> details) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, null, latencyMs, details);
    }

    /** Creates an unhealthy component result. */
    public static ComponentHealth unhealthy(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, message, latencyMs, Map.of());
    }
}
