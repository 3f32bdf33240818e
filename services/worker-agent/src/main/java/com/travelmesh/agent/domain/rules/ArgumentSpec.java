package com.travelmesh.agent.domain.rules;

import java.util.List;
import java.util.Optional;

/**
 * A tool argument and where its value comes from.
 *
 * @param required a required argument with no value fails the request with {@code missing_<name>}
 */
public record ArgumentSpec(String name, boolean required, List<ArgumentSource> sources) {

    public ArgumentSpec {
        sources = List.copyOf(sources);
    }

    public static ArgumentSpec required(String name, ArgumentSource... sources) {
        return new ArgumentSpec(name, true, List.of(sources));
    }

    public static ArgumentSpec optional(String name, ArgumentSource... sources) {
        return new ArgumentSpec(name, false, List.of(sources));
    }

    public Optional<Object> resolve(RuleInput input) {
        for (ArgumentSource source : sources) {
            Optional<Object> value = source.resolve(input);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }
}
