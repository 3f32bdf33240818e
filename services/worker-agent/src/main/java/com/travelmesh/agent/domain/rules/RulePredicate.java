package com.travelmesh.agent.domain.rules;

import java.util.Arrays;
import java.util.List;

/** When a dispatch rule applies. */
@FunctionalInterface
public interface RulePredicate {

    boolean test(RuleInput input);

    default RulePredicate and(RulePredicate other) {
        return input -> test(input) && other.test(input);
    }

    /** The message contains at least one of the words (whole words, ignoring case). */
    static RulePredicate anyWord(String... words) {
        List<String> candidates = Arrays.asList(words);
        return input -> candidates.stream().anyMatch(input::hasWord);
    }

    /** The request carries a non-blank structured parameter. */
    static RulePredicate hasParameter(String name) {
        return input -> input.context().parameter(name).isPresent();
    }
}
