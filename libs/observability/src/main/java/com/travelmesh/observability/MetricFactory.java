package com.travelmesh.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Creates Micrometer meters that all carry a {@code service} tag naming the component identity
 * (e.g. {@code hotel-agent}, {@code travel-planner}).
 * <p>
 * Tag values are always low-cardinality: outcomes, tool names, domains. Caller identities are
 * bounded by the policy registry so they are acceptable as tags; correlation ids never are.
 */
public final class MetricFactory {

    /** Tag key for the component identity emitting the meter. */
    public static final String TAG_SERVICE = "service";

    /** Tag key for a result/outcome label. */
    public static final String TAG_OUTCOME = "outcome";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    the Micrometer meter registry (Prometheus in services, simple in tests)
     * @param serviceName component identity included as the {@code service} tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Returns (registering on first use) a counter with the service tag plus {@code tags}.
     *
     * @param name        metric name (e.g. "travelmesh.tool.invocations")
     * @param description human-readable description
     * @param tags        additional tags as key-value pairs
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Increments the counter {@code name} tagged with {@code outcome}, plus any extra tags.
     */
    public void increment(String name, String description, String outcome, String... tags) {
        counter(name, description, withOutcome(outcome, tags)).increment();
    }

    /**
     * Returns (registering on first use) a timer with the service tag plus {@code tags}.
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /** Returns the underlying meter registry. */
    public MeterRegistry registry() {
        return registry;
    }

    /** Returns the component identity used as the service tag. */
    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }

    private static String[] withOutcome(String outcome, String... tags) {
        String[] all = new String[tags.length + 2];
        all[0] = TAG_OUTCOME;
        all[1] = outcome == null ? "unknown" : outcome;
        System.arraycopy(tags, 0, all, 2, tags.length);
        return all;
    }
}
