package com.travelmesh.agent.domain.rules;

import com.travelmesh.agentapi.DispatchContext;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * What rules are evaluated against: the message, its lower-case words and the dispatch context.
 */
public record RuleInput(String message, Set<String> words, DispatchContext context) {

    public static RuleInput of(String message, DispatchContext context) {
        String text = message == null ? "" : message;
        Set<String> words = Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9_]+"))
                .filter(word -> !word.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        return new RuleInput(text, words, context == null ? DispatchContext.empty() : context);
    }

    public boolean hasWord(String word) {
        return words.contains(word);
    }
}
