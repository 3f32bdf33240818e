package com.travelmesh.pdp.api;

import com.travelmesh.security.AuthorizationDecision;
import com.travelmesh.security.AuthorizationRequest;
import com.travelmesh.security.PolicyDecisionPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * {@code POST /v1/decisions}. Every decision is written to the {@code travelmesh.pdp.decisions}
 * logger, the PDP's own decision log.
 */
@RestController
@RequestMapping("/v1")
public class DecisionController {

    private static final Logger decisionLog = LoggerFactory.getLogger("travelmesh.pdp.decisions");

    private final PolicyDecisionPoint decisionPoint;

    public DecisionController(PolicyDecisionPoint decisionPoint) {
        this.decisionPoint = decisionPoint;
    }

    @PostMapping("/decisions")
    public AuthorizationDecision decide(@RequestBody(required = false) AuthorizationRequest request) {
        AuthorizationDecision decision = decisionPoint.decide(request);
        if (request == null) {
            decisionLog.warn("decision request=<empty> allow={} reason=\"{}\"", decision.allow(), decision.reason().label());
        } else {
            decisionLog.info("decision caller={} target={} path={} allow={} reason=\"{}\"",
                    request.callerIdentity(), request.targetIdentity(), request.path(),
                    decision.allow(), decision.reason().label());
        }
        return decision;
    }
}
