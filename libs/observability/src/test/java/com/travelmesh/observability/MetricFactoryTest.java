package com.travelmesh.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "hotel-gateway");
    }

    @Test
    @DisplayName("should reject a blank service name")
    void shouldRejectBlankService() {
        assertThatThrownBy(() -> new MetricFactory(registry, ""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("serviceName");
    }

    @Test
    @DisplayName("should tag counters with the service identity")
    void shouldTagService() {
        factory.counter("travelmesh.tool.invocations", "tool calls", "tool", "search_hotels").increment();

        Counter counter = registry.get("travelmesh.tool.invocations")
                .tag(MetricFactory.TAG_SERVICE, "hotel-gateway")
                .tag("tool", "search_hotels")
                .counter();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should count per outcome")
    void shouldCountPerOutcome() {
        factory.increment("travelmesh.enforcement.decisions", "decisions", "allowed");
        factory.increment("travelmesh.enforcement.decisions", "decisions", "allowed");
        factory.increment("travelmesh.enforcement.decisions", "decisions", "forbidden");

        assertThat(registry.get("travelmesh.enforcement.decisions").tag("outcome", "allowed").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("travelmesh.enforcement.decisions").tag("outcome", "forbidden").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should record timer durations")
    void shouldRecordTimer() {
        factory.timer("travelmesh.agent.dispatch", "dispatch latency", "domain", "lodging")
                .record(Duration.ofMillis(40));

        assertThat(registry.get("travelmesh.agent.dispatch").timer().count()).isEqualTo(1);
    }
}
