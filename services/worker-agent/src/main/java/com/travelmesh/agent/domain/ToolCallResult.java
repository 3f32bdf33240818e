package com.travelmesh.agent.domain;

import java.util.Map;

/**
 * Outcome of a tool that ran: its result map, or the gateway's normalized error message.
 */
public record ToolCallResult(Map<String, Object> result, String error) {

    public static ToolCallResult success(Map<String, Object> result) {
        return new ToolCallResult(result == null ? Map.of() : result, null);
    }

    public static ToolCallResult failure(String error) {
        return new ToolCallResult(null, error);
    }

    public boolean failed() {
        return error != null;
    }
}
