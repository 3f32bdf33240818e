package com.travelmesh.orchestrator.domain.agent;

import com.travelmesh.agentapi.Domain;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Known worker agents and whether each is believed healthy.
 *
 * <p>Agents start unhealthy. {@link #recordDiscovery} is the only mutation: discovery runs and
 * failed dispatches both report through it.
 */
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Clock clock;
    private final ConcurrentMap<Domain, AgentStatus> agents = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException if two endpoints serve the same domain
     */
    public AgentRegistry(List<AgentEndpoint> endpoints, Clock clock) {
        this.clock = clock;
        for (AgentEndpoint endpoint : endpoints) {
            if (agents.putIfAbsent(endpoint.domain(), AgentStatus.undiscovered(endpoint)) != null) {
                throw new IllegalArgumentException("Two agents registered for domain " + endpoint.domain().value());
            }
        }
    }

    public Optional<AgentStatus> find(Domain domain) {
        return Optional.ofNullable(agents.get(domain));
    }

    public List<AgentEndpoint> endpoints() {
        return snapshot().values().stream().map(AgentStatus::endpoint).toList();
    }

    /** Statuses in domain order. */
    public Map<Domain, AgentStatus> snapshot() {
        return new EnumMap<>(agents);
    }

    /** Records the outcome of probing or calling the agent of {@code domain}; unknown domains are ignored. */
    public void recordDiscovery(Domain domain, DiscoveryResult result) {
        AgentStatus updated = agents.computeIfPresent(domain, (key, current) -> new AgentStatus(
                current.endpoint(),
                result.healthy(),
                result.tools() == null ? current.tools() : result.tools(),
                clock.instant(),
                result.error()));
        if (updated == null) {
            return;
        }
        if (result.healthy()) {
            log.debug("Agent {} healthy with {} tools", updated.agentId(), updated.tools().size());
        } else {
            log.warn("Agent {} marked unhealthy: {}", updated.agentId(), result.error());
        }
    }
}
