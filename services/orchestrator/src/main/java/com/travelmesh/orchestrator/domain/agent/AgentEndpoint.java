package com.travelmesh.orchestrator.domain.agent;

import com.travelmesh.agentapi.Domain;

/**
 * Where the worker agent of one domain is reached.
 *
 * @param agentId identity the agent enforces as target
 */
public record AgentEndpoint(String agentId, Domain domain, String baseUrl) {
}
