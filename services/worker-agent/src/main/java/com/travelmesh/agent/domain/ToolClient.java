package com.travelmesh.agent.domain;

import java.util.Map;

/**
 * Calls a tool on this agent's gateway.
 *
 * <p>A tool that ran and failed is a {@link ToolCallResult} error. A call that could not be made
 * (denied, no decision, gateway down) throws a {@link com.travelmesh.security.TravelMeshException}.
 */
public interface ToolClient {

    ToolCallResult invoke(String tool, Map<String, Object> arguments);
}
