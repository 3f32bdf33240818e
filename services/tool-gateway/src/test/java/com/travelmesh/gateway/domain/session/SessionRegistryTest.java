package com.travelmesh.gateway.domain.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SessionRegistry")
class SessionRegistryTest {

    private MutableClock clock;
    private SessionRegistry registry;

    /** Clock the test advances by hand. */
    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2026-03-01T10:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new SessionRegistry(clock, Duration.ofMinutes(30));
    }

    @Test
    @DisplayName("a session opened by a caller resolves for that caller")
    void resolvesOwnSession() {
        GatewaySession session = registry.open("hotel-agent");

        assertThat(registry.resolve(session.sessionId(), "hotel-agent")).contains(session);
    }

    @Test
    @DisplayName("blank and unknown ids do not resolve")
    void unknownIds() {
        assertThat(registry.resolve(null, "hotel-agent")).isEmpty();
        assertThat(registry.resolve("  ", "hotel-agent")).isEmpty();
        assertThat(registry.resolve("no-such-session", "hotel-agent")).isEmpty();
    }

    @Test
    @DisplayName("a session presented by another identity is treated as unknown")
    void foreignSessionRejected() {
        GatewaySession session = registry.open("hotel-agent");

        assertThat(registry.resolve(session.sessionId(), "airline-agent")).isEmpty();
        assertThat(registry.resolve(session.sessionId(), "hotel-agent")).isPresent();
    }

    @Test
    @DisplayName("sessions expire after the idle TTL")
    void expiresWhenIdle() {
        GatewaySession session = registry.open("hotel-agent");

        clock.advance(Duration.ofMinutes(30));

        assertThat(registry.resolve(session.sessionId(), "hotel-agent")).isEmpty();
        assertThat(registry.size()).isZero();
    }

    @Test
    @DisplayName("use refreshes the idle timer")
    void useRefreshesTimer() {
        GatewaySession session = registry.open("hotel-agent");

        clock.advance(Duration.ofMinutes(20));
        assertThat(registry.resolve(session.sessionId(), "hotel-agent")).isPresent();
        clock.advance(Duration.ofMinutes(20));

        assertThat(registry.resolve(session.sessionId(), "hotel-agent")).isPresent();
    }

    @Test
    @DisplayName("purge drops only expired sessions")
    void purgeExpired() {
        registry.open("hotel-agent");
        clock.advance(Duration.ofMinutes(31));
        GatewaySession fresh = registry.open("hotel-agent");

        assertThat(registry.purgeExpired()).isEqualTo(1);
        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.resolve(fresh.sessionId(), "hotel-agent")).isPresent();
    }

    @Test
    @DisplayName("the scheduled purger drops expired sessions from the registry")
    void purgerRun() {
        registry.open("hotel-agent");
        clock.advance(Duration.ofMinutes(31));

        new SessionPurger(registry).purge();

        assertThat(registry.size()).isZero();
    }

    @Test
    @DisplayName("rejects a non-positive TTL")
    void rejectsBadTtl() {
        assertThatThrownBy(() -> new SessionRegistry(clock, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
