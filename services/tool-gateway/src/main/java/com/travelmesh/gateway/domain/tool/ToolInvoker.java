package com.travelmesh.gateway.domain.tool;

import com.travelmesh.gateway.domain.backend.BackendException;
import com.travelmesh.gateway.domain.backend.BookingBackend;
import com.travelmesh.observability.MetricFactory;
import com.travelmesh.observability.SensitiveDataRedactor;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a tool by name, validates its arguments and runs it against the backend.
 *
 * <p>Never throws for a tool-level problem: unknown tools, missing arguments and backend failures
 * all come back as a {@link ToolResult} error. No call is retried.
 */
public class ToolInvoker {

    static final String INVOCATIONS_METRIC = "travelmesh.gateway.tool.invocations";

    private static final Logger log = LoggerFactory.getLogger(ToolInvoker.class);

    private final ToolCatalog catalog;
    private final BookingBackend backend;
    private final MetricFactory metrics;
    private final SensitiveDataRedactor redactor;

    public ToolInvoker(
            ToolCatalog catalog, BookingBackend backend, MetricFactory metrics, SensitiveDataRedactor redactor) {
        this.catalog = catalog;
        this.backend = backend;
        this.metrics = metrics;
        this.redactor = redactor;
    }

    public ToolResult invoke(String toolName, Map<String, Object> arguments) {
        ToolDefinition tool = catalog.find(toolName).orElse(null);
        if (tool == null) {
            log.warn("Unsupported tool '{}' requested", toolName);
            return record("unknown", "unsupported", ToolResult.failure(ToolResult.UNSUPPORTED_TOOL));
        }

        ToolArguments args = new ToolArguments(arguments);
        var missing = args.firstMissing(tool.requiredArguments());
        if (missing.isPresent()) {
            log.info("Tool {} rejected: missing argument {}", tool.name(), missing.get());
            return record(tool.name(), "invalid_arguments",
                    ToolResult.failure(ToolResult.INVALID_ARGUMENTS + ": " + missing.get()));
        }

        log.info("Invoking tool {} with {}", tool.name(), redactor.redact(args.asMap()));
        try {
            return record(tool.name(), "success", ToolResult.success(tool.handler().handle(backend, args)));
        } catch (BackendException e) {
            log.warn("Tool {} failed in the backend: {}", tool.name(), e.getMessage());
            return record(tool.name(), "backend_error", ToolResult.failure(e.getMessage()));
        } catch (IllegalArgumentException e) {
            log.info("Tool {} rejected: {}", tool.name(), e.getMessage());
            return record(tool.name(), "invalid_arguments",
                    ToolResult.failure(ToolResult.INVALID_ARGUMENTS + ": " + e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Tool {} failed unexpectedly", tool.name(), e);
            return record(tool.name(), "internal_error", ToolResult.failure(ToolResult.INTERNAL_ERROR));
        }
    }

    public ToolCatalog catalog() {
        return catalog;
    }

    private ToolResult record(String tool, String outcome, ToolResult result) {
        metrics.increment(INVOCATIONS_METRIC, "Tool invocations", outcome, "tool", tool);
        return result;
    }
}
