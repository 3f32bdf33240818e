package com.travelmesh.agent.domain;

import com.travelmesh.agent.domain.rules.DispatchRule;
import com.travelmesh.agent.domain.rules.MissingArgumentException;
import com.travelmesh.agent.domain.rules.RuleInput;
import com.travelmesh.agent.domain.rules.RuleTable;
import com.travelmesh.agentapi.AgentCatalog;
import com.travelmesh.agentapi.AgentRequest;
import com.travelmesh.agentapi.AgentResponse;
import com.travelmesh.agentapi.Domain;
import com.travelmesh.agentapi.ToolDescriptor;
import com.travelmesh.observability.MetricFactory;
import com.travelmesh.observability.SensitiveDataRedactor;
import com.travelmesh.security.ErrorKind;
import com.travelmesh.security.TravelMeshException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns one natural-language request into at most one tool call.
 *
 * <p>Order: first matching rule, then the language model (text only), then the capability list.
 * Side-effecting rules stop at a confirmation prompt unless the request is confirmed.
 */
public class AgentService {

    static final String REQUESTS_METRIC = "travelmesh.agent.requests";

    private static final Logger log = LoggerFactory.getLogger(AgentService.class);

    private final RuleTable rules;
    private final ToolClient tools;
    private final LanguageModelClient languageModel;
    private final MetricFactory metrics;
    private final SensitiveDataRedactor redactor;

    /**
     * @param languageModel null when no fallback model is configured
     */
    public AgentService(
            RuleTable rules,
            ToolClient tools,
            LanguageModelClient languageModel,
            MetricFactory metrics,
            SensitiveDataRedactor redactor) {
        this.rules = rules;
        this.tools = tools;
        this.languageModel = languageModel;
        this.metrics = metrics;
        this.redactor = redactor;
    }

    public AgentResponse process(AgentRequest request) {
        RuleInput input = RuleInput.of(request.message(), request.context());
        Optional<DispatchRule> rule = rules.firstMatch(input);
        if (rule.isPresent()) {
            return dispatch(rule.get(), input);
        }
        if (languageModel != null) {
            Optional<AgentResponse> answer = askLanguageModel(input.message());
            if (answer.isPresent()) {
                return answer.get();
            }
        }
        return record("capabilities", capabilities());
    }

    public AgentCatalog catalog(String agentId) {
        return new AgentCatalog(agentId, rules.domain(), describe(rules.domain()), rules.tools());
    }

    private AgentResponse dispatch(DispatchRule rule, RuleInput input) {
        Map<String, Object> arguments;
        try {
            arguments = rule.extractArguments(input);
        } catch (MissingArgumentException e) {
            log.info("Rule {} matched but {} is missing", rule.tool(), e.argument());
            return record("missing_argument", AgentResponse.failure(
                    "Please provide the " + e.argument().replace('_', ' ') + ".",
                    e.errorCode(), null, List.of()));
        }

        if (rule.sideEffecting() && !input.context().confirmed()) {
            Map<String, Object> pending = new LinkedHashMap<>();
            pending.put("requires_confirmation", true);
            pending.put("pending_tool", rule.tool());
            pending.put("pending_arguments", arguments);
            log.info("Holding {} for confirmation", rule.tool());
            return record("confirmation_required", AgentResponse.success(
                    "Please confirm: " + rule.description().toLowerCase(Locale.ROOT) + ".", pending, List.of()));
        }

        List<String> called = List.of(rule.tool());
        log.info("Calling {} with {}", rule.tool(), redactor.redact(arguments));
        try {
            ToolCallResult result = tools.invoke(rule.tool(), arguments);
            if (result.failed()) {
                log.info("Tool {} reported an error: {}", rule.tool(), result.error());
                return record("tool_error", AgentResponse.failure(
                        "The " + rule.tool() + " tool could not complete the request.",
                        ErrorKind.TOOL_ERROR.name(), Map.of("error", result.error()), called));
            }
            return record("tool_success", AgentResponse.success(rule.successMessage(), result.result(), called));
        } catch (TravelMeshException e) {
            log.warn("Call to {} failed with {}: {}", rule.tool(), e.errorKind(), e.getMessage());
            return record(e.errorKind().name().toLowerCase(Locale.ROOT), AgentResponse.failure(
                    "The request could not be completed right now.", e.errorKind().name(), null, called));
        }
    }

    private Optional<AgentResponse> askLanguageModel(String message) {
        try {
            String answer = languageModel.generate(prompt(message));
            if (answer == null || answer.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(record("language_model", AgentResponse.success(answer.trim(), null, List.of())));
        } catch (RuntimeException e) {
            // WHY: a broken model degrades to the capability list instead of failing the request.
            log.warn("Language model unavailable, answering with capabilities: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private String prompt(String message) {
        String toolNames = rules.tools().stream().map(ToolDescriptor::name).collect(Collectors.joining(", "));
        return "You are a " + rules.domain().value() + " travel assistant with the tools " + toolNames
                + ". Answer briefly without claiming to have booked anything.\nUser: " + message;
    }

    private AgentResponse capabilities() {
        List<ToolDescriptor> available = rules.tools();
        String summary = available.stream()
                .map(ToolDescriptor::description)
                .map(description -> description.toLowerCase(Locale.ROOT))
                .collect(Collectors.joining("; "));
        return AgentResponse.success(
                "I can help you " + summary + ".", Map.of("available_tools", available), List.of());
    }

    private AgentResponse record(String outcome, AgentResponse response) {
        metrics.increment(REQUESTS_METRIC, "Worker agent requests", outcome, "domain", rules.domain().value());
        return response;
    }

    static String describe(Domain domain) {
        return switch (domain) {
            case FLIGHTS -> "Finds and books flights";
            case LODGING -> "Finds and books hotel stays";
            case VEHICLES -> "Finds and books rental cars";
            case NONE -> "No bookable domain";
        };
    }
}
