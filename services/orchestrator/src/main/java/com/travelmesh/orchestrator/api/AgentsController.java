package com.travelmesh.orchestrator.api;

import com.travelmesh.orchestrator.domain.agent.AgentRegistry;
import com.travelmesh.orchestrator.domain.agent.AgentStatus;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Registry state as last discovered. Does not probe the agents.
 */
@RestController
@RequestMapping("/v1")
public class AgentsController {

    private final AgentRegistry registry;

    public AgentsController(AgentRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/agents")
    public Map<String, List<AgentStatus>> agents() {
        return Map.of("agents", List.copyOf(registry.snapshot().values()));
    }
}
