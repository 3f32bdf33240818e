package com.travelmesh.gateway.domain.tool;

import com.travelmesh.gateway.domain.backend.BookingBackend;
import java.util.Map;

/** Maps one tool call onto backend calls. */
@FunctionalInterface
public interface ToolHandler {

    Map<String, Object> handle(BookingBackend backend, ToolArguments arguments);
}
