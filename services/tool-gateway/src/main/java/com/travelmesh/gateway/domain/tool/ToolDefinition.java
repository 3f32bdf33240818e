package com.travelmesh.gateway.domain.tool;

import com.travelmesh.agentapi.ToolDescriptor;
import java.util.List;
import java.util.Objects;

/**
 * One entry of a gateway's tool table.
 *
 * @param requiredArguments validated before the handler runs
 * @param sideEffecting books or cancels something
 */
public record ToolDefinition(
        String name,
        String description,
        List<String> requiredArguments,
        List<String> optionalArguments,
        boolean sideEffecting,
        ToolHandler handler) {

    public ToolDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
        description = description == null ? "" : description;
        requiredArguments = requiredArguments == null ? List.of() : List.copyOf(requiredArguments);
        optionalArguments = optionalArguments == null ? List.of() : List.copyOf(optionalArguments);
    }

    static ToolDefinition query(String name, String description, List<String> required,
            List<String> optional, ToolHandler handler) {
        return new ToolDefinition(name, description, required, optional, false, handler);
    }

    static ToolDefinition sideEffecting(String name, String description, List<String> required,
            List<String> optional, ToolHandler handler) {
        return new ToolDefinition(name, description, required, optional, true, handler);
    }

    public ToolDescriptor toDescriptor() {
        return new ToolDescriptor(name, description, requiredArguments, optionalArguments, sideEffecting);
    }
}
