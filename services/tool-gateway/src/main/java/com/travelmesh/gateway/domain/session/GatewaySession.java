package com.travelmesh.gateway.domain.session;

import java.time.Instant;

/**
 * A tool session. Bound to the identity that opened it.
 *
 * @param lastUsedAt drives idle expiry
 */
public record GatewaySession(String sessionId, String owner, Instant createdAt, Instant lastUsedAt) {

    GatewaySession touchedAt(Instant now) {
        return new GatewaySession(sessionId, owner, createdAt, now);
    }
}
