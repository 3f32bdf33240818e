package com.travelmesh.agent.domain.rules;

import com.travelmesh.agentapi.ToolDescriptor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One row of a rule table: when {@code predicate} holds, call {@code tool} with arguments built
 * from {@code arguments}.
 *
 * @param sideEffecting books or cancels; runs only with explicit confirmation
 * @param successMessage user-facing summary when the tool succeeds
 */
public record DispatchRule(
        RulePredicate predicate,
        String tool,
        String description,
        List<ArgumentSpec> arguments,
        boolean sideEffecting,
        String successMessage) {

    public DispatchRule {
        arguments = List.copyOf(arguments);
    }

    public boolean matches(RuleInput input) {
        return predicate.test(input);
    }

    /**
     * Resolves every argument; optional ones without a value are left out.
     *
     * @throws MissingArgumentException for the first required argument without a value
     */
    public Map<String, Object> extractArguments(RuleInput input) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (ArgumentSpec spec : arguments) {
            Optional<Object> value = spec.resolve(input);
            if (value.isPresent()) {
                values.put(spec.name(), value.get());
            } else if (spec.required()) {
                throw new MissingArgumentException(spec.name());
            }
        }
        return values;
    }

    public ToolDescriptor toDescriptor() {
        return new ToolDescriptor(
                tool,
                description,
                arguments.stream().filter(ArgumentSpec::required).map(ArgumentSpec::name).toList(),
                arguments.stream().filter(spec -> !spec.required()).map(ArgumentSpec::name).toList(),
                sideEffecting);
    }
}
