package com.travelmesh.observability;

import java.util.concurrent.CompletableFuture;

/**
 * A single asynchronous health probe.
 * <p>
 * The orchestrator registers one probe per worker agent plus one for the context service:
 * <pre>{@code
 * registry.register("hotel-agent", () -> CompletableFuture.supplyAsync(() -> {
 *     long start = System.currentTimeMillis();
 *     var catalog = agentClient.discover(descriptor);
 *     return ComponentHealth.healthy("hotel-agent", System.currentTimeMillis() - start,
 *             Map.of("tools", catalog.tools().size()));
 * }));
 * }</pre>
 */
@FunctionalInterface
public interface HealthCheck {

    /**
     * Probes the component.
     *
     * @return a future that completes with the component health
     */
    CompletableFuture<ComponentHealth> check();
}
