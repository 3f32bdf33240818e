package com.travelmesh.observability;

/**
 * Health of a single downstream component or of the service as a whole.
 */
public enum HealthStatus {

    /** Reachable and answering. */
    HEALTHY,

    /** Reachable but impaired; dispatch may still succeed. */
    DEGRADED,

    /** Unreachable or failing; callers skip it until it recovers. */
    UNHEALTHY
}
