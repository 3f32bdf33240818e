package com.travelmesh.orchestrator.domain.agent;

import com.travelmesh.agentapi.AgentCatalog;
import com.travelmesh.agentapi.AgentRequest;
import com.travelmesh.agentapi.AgentResponse;

/**
 * Calls worker agents. Failures are {@link com.travelmesh.security.TravelMeshException}s carrying
 * the stable error kind.
 */
public interface AgentClient {

    AgentResponse invoke(AgentEndpoint agent, AgentRequest request);

    AgentCatalog discover(AgentEndpoint agent);
}
