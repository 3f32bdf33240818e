package com.travelmesh.orchestrator.domain.agent;

import java.util.List;

/**
 * What one probe of an agent found.
 *
 * @param tools null keeps the previously known tools
 */
public record DiscoveryResult(boolean healthy, List<String> tools, String error) {

    public static DiscoveryResult reachable(List<String> tools) {
        return new DiscoveryResult(true, List.copyOf(tools), null);
    }

    public static DiscoveryResult unreachable(String error) {
        return new DiscoveryResult(false, null, error);
    }
}
