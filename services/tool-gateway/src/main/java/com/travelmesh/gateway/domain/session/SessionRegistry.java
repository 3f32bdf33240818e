package com.travelmesh.gateway.domain.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sessions opened by worker agents, expiring after an idle TTL.
 *
 * <p>A session presented by anyone other than its owner is treated exactly like an unknown one,
 * so session ids cannot be borrowed across identities.
 */
public class SessionRegistry {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, GatewaySession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public SessionRegistry(Clock clock, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Returns the live session with this id owned by {@code caller}, refreshing its idle timer.
     * Empty for a blank, unknown, expired or foreign id.
     */
    public Optional<GatewaySession> resolve(String sessionId, String caller) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        GatewaySession refreshed = sessions.computeIfPresent(sessionId, (id, session) -> {
            if (isExpired(session, now)) {
                return null;
            }
            return session.owner().equals(caller) ? session.touchedAt(now) : session;
        });
        if (refreshed == null || !refreshed.owner().equals(caller)) {
            return Optional.empty();
        }
        return Optional.of(refreshed);
    }

    public GatewaySession open(String caller) {
        Instant now = clock.instant();
        GatewaySession session = new GatewaySession(UUID.randomUUID().toString(), caller, now, now);
        sessions.put(session.sessionId(), session);
        log.info("Opened session {} for {}", session.sessionId(), caller);
        return session;
    }

    /** Drops expired sessions; returns how many were removed. */
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (GatewaySession session : sessions.values()) {
            if (isExpired(session, now) && sessions.remove(session.sessionId(), session)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Purged {} expired sessions", removed);
        }
        return removed;
    }

    public int size() {
        return sessions.size();
    }

    public Duration ttl() {
        return ttl;
    }

    private boolean isExpired(GatewaySession session, Instant now) {
        return !session.lastUsedAt().plus(ttl).isAfter(now);
    }
}
