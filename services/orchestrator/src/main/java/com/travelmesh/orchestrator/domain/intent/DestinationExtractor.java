package com.travelmesh.orchestrator.domain.intent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Pulls a trip destination out of a message: a known city anywhere in the text, else a
 * capitalized name after "trip to", "visit" and similar phrases.
 */
public class DestinationExtractor {

    public static final String UNKNOWN = "Unknown";

    private static final List<String> KNOWN_CITIES = List.of(
            "New York", "Los Angeles", "Chicago", "Houston", "Phoenix", "Philadelphia", "San Antonio",
            "San Diego", "Dallas", "San Jose", "Austin", "Jacksonville", "Fort Worth", "Columbus",
            "Charlotte", "San Francisco", "Indianapolis", "Seattle", "Denver", "Boston", "Miami",
            "Atlanta", "Las Vegas", "Orlando", "Tampa", "Portland", "Paris", "London", "Tokyo",
            "Sydney", "Dubai", "Singapore");

    private static final Map<String, Pattern> CITY_PATTERNS = KNOWN_CITIES.stream().collect(Collectors.toMap(
            city -> city,
            city -> Pattern.compile("\\b" + Pattern.quote(city.toLowerCase(Locale.ROOT)) + "\\b"),
            (first, second) -> first,
            LinkedHashMap::new));

    private static final String NAME = "([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)?)";

    private static final List<Pattern> PHRASES = List.of(
            Pattern.compile("trip to " + NAME),
            Pattern.compile("going to " + NAME),
            Pattern.compile("travel(?:ing)? to " + NAME),
            Pattern.compile("fly to " + NAME),
            Pattern.compile("visit " + NAME),
            Pattern.compile("vacation in " + NAME),
            Pattern.compile("to " + NAME));

    private static final Set<String> NOT_PLACES = Set.of("plan", "book", "search", "find", "help", "want", "need");

    public String extract(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Pattern> city : CITY_PATTERNS.entrySet()) {
            if (city.getValue().matcher(lower).find()) {
                return city.getKey();
            }
        }
        for (Pattern phrase : PHRASES) {
            Matcher matcher = phrase.matcher(message);
            while (matcher.find()) {
                String candidate = matcher.group(1).trim();
                if (!NOT_PLACES.contains(candidate.toLowerCase(Locale.ROOT))) {
                    return candidate;
                }
            }
        }
        return UNKNOWN;
    }
}
