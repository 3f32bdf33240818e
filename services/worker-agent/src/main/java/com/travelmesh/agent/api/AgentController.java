package com.travelmesh.agent.api;

import com.travelmesh.agent.domain.AgentService;
import com.travelmesh.agentapi.AgentCatalog;
import com.travelmesh.agentapi.AgentRequest;
import com.travelmesh.agentapi.AgentResponse;
import com.travelmesh.support.config.ServiceIdentityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private final AgentService agentService;
    private final String agentId;

    public AgentController(AgentService agentService, ServiceIdentityProperties identity) {
        this.agentService = agentService;
        this.agentId = identity.identity();
    }

    /**
     * @throws IllegalArgumentException for a blank message (400 {@code VALIDATION_ERROR})
     */
    @PostMapping("/invoke")
    public AgentResponse invoke(@RequestBody AgentRequest request) {
        if (request.message() == null || request.message().isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
        log.info("Invoke (conversation {})", request.conversationId());
        AgentResponse response = agentService.process(request);
        log.info("Invoke finished: success={} tools={} error={}",
                response.success(), response.toolsCalled(), response.error());
        return response;
    }

    @GetMapping("/tools")
    public AgentCatalog tools() {
        return agentService.catalog(agentId);
    }
}
