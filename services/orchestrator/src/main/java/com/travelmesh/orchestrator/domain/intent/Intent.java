package com.travelmesh.orchestrator.domain.intent;

import com.travelmesh.agentapi.Domain;

/**
 * Classification of one inbound message. Never persisted.
 *
 * @param addsToActiveTrip a successful booking is appended to the caller's active trip
 */
public record Intent(IntentType type, Domain domain, double confidence, Route route, boolean addsToActiveTrip) {
}
