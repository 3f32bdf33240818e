package com.travelmesh.gateway.domain.tool;

import java.util.Map;

/**
 * Normalized outcome of one tool call: either a result payload or an error string, never both.
 */
public record ToolResult(Map<String, Object> result, String error) {

    public static final String UNSUPPORTED_TOOL = "unsupported_tool";
    public static final String INVALID_ARGUMENTS = "invalid_arguments";
    public static final String INTERNAL_ERROR = "internal_error";

    public ToolResult {
        result = result == null ? Map.of() : result;
    }

    public static ToolResult success(Map<String, Object> result) {
        return new ToolResult(result, null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(Map.of(), error);
    }

    public boolean failed() {
        return error != null;
    }
}
