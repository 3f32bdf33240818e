package com.travelmesh.gateway.domain.tool;

import com.travelmesh.agentapi.Domain;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Fixed, ordered tool table of one domain. */
public final class ToolCatalog {

    private final Domain domain;
    private final Map<String, ToolDefinition> tools;

    ToolCatalog(Domain domain, List<ToolDefinition> definitions) {
        this.domain = domain;
        Map<String, ToolDefinition> byName = new LinkedHashMap<>();
        for (ToolDefinition definition : definitions) {
            if (byName.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("Duplicate tool: " + definition.name());
            }
        }
        this.tools = Collections.unmodifiableMap(byName);
    }

    /**
     * @throws IllegalArgumentException for {@link Domain#NONE}
     */
    public static ToolCatalog forDomain(Domain domain) {
        return switch (domain) {
            case FLIGHTS -> new ToolCatalog(domain, FlightTools.definitions());
            case LODGING -> new ToolCatalog(domain, LodgingTools.definitions());
            case VEHICLES -> new ToolCatalog(domain, VehicleTools.definitions());
            case NONE -> throw new IllegalArgumentException("No tool table for domain 'none'");
        };
    }

    public Domain domain() {
        return domain;
    }

    public Optional<ToolDefinition> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    public Collection<ToolDefinition> definitions() {
        return tools.values();
    }
}
