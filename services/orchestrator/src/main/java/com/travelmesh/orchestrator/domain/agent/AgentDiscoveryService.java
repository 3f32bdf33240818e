package com.travelmesh.orchestrator.domain.agent;

import com.travelmesh.agentapi.AgentCatalog;
import com.travelmesh.security.TravelMeshException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Reads every agent's tool catalog at startup and on a fixed delay after that.
 */
public class AgentDiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(AgentDiscoveryService.class);

    private final AgentRegistry registry;
    private final AgentClient client;

    public AgentDiscoveryService(AgentRegistry registry, AgentClient client) {
        this.registry = registry;
        this.client = client;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void discoverAtStartup() {
        discoverAll();
        log.info("Discovered agents: {}", registry.snapshot().values().stream()
                .map(status -> status.agentId() + (status.healthy() ? " (healthy)" : " (unhealthy)"))
                .toList());
    }

    @Scheduled(
            initialDelayString = "${travelmesh.orchestrator.discovery-interval:PT30S}",
            fixedDelayString = "${travelmesh.orchestrator.discovery-interval:PT30S}")
    public void discoverAll() {
        for (AgentEndpoint endpoint : registry.endpoints()) {
            registry.recordDiscovery(endpoint.domain(), probe(endpoint));
        }
    }

    DiscoveryResult probe(AgentEndpoint endpoint) {
        try {
            AgentCatalog catalog = client.discover(endpoint);
            if (catalog == null || catalog.domain() != endpoint.domain()) {
                return DiscoveryResult.unreachable("catalog does not serve " + endpoint.domain().value());
            }
            return DiscoveryResult.reachable(catalog.toolNames());
        } catch (TravelMeshException e) {
            return DiscoveryResult.unreachable(e.errorKind().name());
        }
    }
}
