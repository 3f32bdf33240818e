package com.travelmesh.agent.domain.rules;

import com.travelmesh.agentapi.Domain;
import com.travelmesh.agentapi.ToolDescriptor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered dispatch rules of one domain. The first matching rule wins, so the most specific rules
 * are declared first.
 */
public final class RuleTable {

    private final Domain domain;
    private final List<DispatchRule> rules;

    public RuleTable(Domain domain, List<DispatchRule> rules) {
        this.domain = domain;
        this.rules = List.copyOf(rules);
    }

    /**
     * @throws IllegalArgumentException for {@link Domain#NONE}
     */
    public static RuleTable forDomain(Domain domain, LocationResolver resolver) {
        return switch (domain) {
            case FLIGHTS -> new RuleTable(domain, FlightRules.rules(resolver));
            case LODGING -> new RuleTable(domain, LodgingRules.rules(resolver));
            case VEHICLES -> new RuleTable(domain, VehicleRules.rules(resolver));
            case NONE -> throw new IllegalArgumentException("No rule table for domain 'none'");
        };
    }

    public Optional<DispatchRule> firstMatch(RuleInput input) {
        return rules.stream().filter(rule -> rule.matches(input)).findFirst();
    }

    public Domain domain() {
        return domain;
    }

    public List<DispatchRule> rules() {
        return rules;
    }

    /** One descriptor per tool, in rule order. */
    public List<ToolDescriptor> tools() {
        Map<String, ToolDescriptor> byTool = new LinkedHashMap<>();
        for (DispatchRule rule : rules) {
            byTool.putIfAbsent(rule.tool(), rule.toDescriptor());
        }
        return List.copyOf(byTool.values());
    }
}
