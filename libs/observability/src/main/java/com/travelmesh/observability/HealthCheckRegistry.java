package com.travelmesh.observability;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs every registered {@link HealthCheck} concurrently and folds the results into one
 * {@link HealthResult}.
 * <p>
 * Each probe is bounded by the registry timeout; a probe that times out or throws is reported
 * as {@link HealthStatus#UNHEALTHY} rather than stalling the health endpoint.
 */
public final class HealthCheckRegistry {

    /** Default timeout for individual probes (5 seconds). */
    public static final long DEFAULT_TIMEOUT_MS = 5000;

    private final Map<String, HealthCheck> checks = new ConcurrentHashMap<>();
    private final long timeoutMs;
    private final Clock clock;

    public HealthCheckRegistry() {
        this(DEFAULT_TIMEOUT_MS);
    }

    public HealthCheckRegistry(long timeoutMs) {
        this(timeoutMs, Clock.systemUTC());
    }

    /**
     * @param timeoutMs timeout in milliseconds for each individual probe
     * @param clock     clock used to stamp results
     */
    public HealthCheckRegistry(long timeoutMs, Clock clock) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.timeoutMs = timeoutMs;
        this.clock = clock;
    }

    /**
     * Registers a probe under the given component name, replacing any existing one.
     */
    public void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    /**
     * Removes a probe.
     *
     * @return true if a probe was removed
     */
    public boolean deregister(String name) {
        return checks.remove(name) != null;
    }

    /**
     * Runs one probe by name.
     *
     * @return the result, or empty if no probe is registered under that name
     */
    public Optional<ComponentHealth> check(String name) {
        HealthCheck check = checks.get(name);
        if (check == null) {
            return Optional.empty();
        }
        return Optional.of(await(name, check.check()));
    }

    /**
     * Runs all probes concurrently and aggregates the results. With nothing registered the
     * service is {@link HealthStatus#HEALTHY}.
     */
    public HealthResult checkAll() {
        if (checks.isEmpty()) {
            return new HealthResult(HealthStatus.HEALTHY, Map.of(), clock.instant());
        }

        Map<String, CompletableFuture<ComponentHealth>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, HealthCheck> entry : checks.entrySet()) {
            futures.put(entry.getKey(), start(entry.getKey(), entry.getValue()));
        }

        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;
        for (Map.Entry<String, CompletableFuture<ComponentHealth>> entry : futures.entrySet()) {
            ComponentHealth result = await(entry.getKey(), entry.getValue());
            results.put(entry.getKey(), result);
            overall = worst(overall, result.status());
        }
        return new HealthResult(overall, results, clock.instant());
    }

    /** Number of registered probes. */
    public int size() {
        return checks.size();
    }

    /** Configured per-probe timeout in milliseconds. */
    public long timeoutMs() {
        return timeoutMs;
    }

    private static CompletableFuture<ComponentHealth> start(String name, HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private ComponentHealth await(String name, CompletableFuture<ComponentHealth> future) {
        try {
            return future.orTimeout(timeoutMs, TimeUnit.MILLISECONDS).join();
        } catch (Exception e) {
            return ComponentHealth.unhealthy(name, "Timeout or error: " + e.getMessage(), timeoutMs);
        }
    }

    private static HealthStatus worst(HealthStatus current, HealthStatus next) {
        return next.ordinal() > current.ordinal() ? next : current;
    }
}
