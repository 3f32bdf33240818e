package com.travelmesh.orchestrator.domain.intent;

import com.travelmesh.agentapi.Domain;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keyword classifier. Keywords match at the start of a word, so "hotel" also matches "hotels"
 * and "lodg" matches "lodging", but "car" does not match "scar".
 *
 * <p>Type tables are checked in a fixed order; the first table with a hit decides the type.
 * Travel words without a bookable domain ("trip", "vacation") route to {@link Route#MULTI_DOMAIN}.
 */
public class IntentClassifier {

    static final double KEYWORD_CONFIDENCE = 0.8;
    static final double FALLBACK_CONFIDENCE = 0.3;

    private static final List<Pattern> QUERY_PHRASES = keywords(
            "my booking", "my flight", "my hotel", "my reservation", "my trip", "my itinerary",
            "what time", "when is", "show me", "what do i have");
    private static final List<Pattern> CANCEL_WORDS = keywords("cancel", "delete", "remove");
    private static final List<Pattern> MODIFY_WORDS = keywords("change", "modify", "update", "reschedule");
    private static final List<Pattern> TRIP_CREATION_PHRASES = keywords(
            "plan a trip", "planning a trip", "new trip", "going to", "want to go", "need to go",
            "traveling to", "travel to");
    private static final List<Pattern> ADD_WORDS = keywords(
            "add", "book", "reserve", "get me", "find me", "i need", "i want");
    private static final List<Pattern> SEARCH_WORDS = keywords(
            "search", "find", "look for", "show", "list", "available", "options");
    private static final List<Pattern> BOOK_WORDS = keywords("book", "reserve", "purchase");

    private static final List<Pattern> FLIGHT_WORDS = keywords("flight", "fly", "airport", "airline", "plane");
    private static final List<Pattern> LODGING_WORDS = keywords("hotel", "room", "stay", "accommodation", "lodg");
    private static final List<Pattern> VEHICLE_WORDS = keywords("car", "vehicle", "rent", "rental", "drive");
    private static final List<Pattern> TRAVEL_WORDS = keywords("trip", "travel", "vacation", "journey");

    public Intent classify(String message, boolean hasActiveTrip) {
        String text = message == null ? "" : message.toLowerCase(Locale.ROOT);
        Domain domain = domainOf(text);
        boolean travelRelated = domain == Domain.NONE && containsAny(text, TRAVEL_WORDS);

        if (containsAny(text, QUERY_PHRASES)) {
            return new Intent(IntentType.QUERY, domain, KEYWORD_CONFIDENCE, Route.ITINERARY_QUERY, false);
        }
        if (containsAny(text, CANCEL_WORDS)) {
            return routed(IntentType.CANCEL, domain, false, travelRelated);
        }
        if (containsAny(text, MODIFY_WORDS)) {
            return routed(IntentType.MODIFY, domain, false, travelRelated);
        }
        if (containsAny(text, TRIP_CREATION_PHRASES)) {
            return new Intent(IntentType.CREATE, domain, KEYWORD_CONFIDENCE, Route.TRIP_CREATION, false);
        }
        if (hasActiveTrip && containsAny(text, ADD_WORDS)) {
            return routed(IntentType.CREATE, domain, true, travelRelated);
        }
        if (containsAny(text, SEARCH_WORDS)) {
            return routed(IntentType.SEARCH, domain, false, travelRelated);
        }
        if (containsAny(text, BOOK_WORDS)) {
            return routed(IntentType.CREATE, domain, hasActiveTrip, travelRelated);
        }
        return routed(IntentType.UNKNOWN, domain, false, travelRelated);
    }

    private static Intent routed(IntentType type, Domain domain, boolean addsToActiveTrip, boolean travelRelated) {
        if (travelRelated) {
            return new Intent(type, domain, KEYWORD_CONFIDENCE, Route.MULTI_DOMAIN, false);
        }
        if (domain == Domain.NONE) {
            double confidence = type == IntentType.UNKNOWN ? FALLBACK_CONFIDENCE : KEYWORD_CONFIDENCE;
            return new Intent(type, domain, confidence, Route.GENERAL, false);
        }
        return new Intent(type, domain, KEYWORD_CONFIDENCE, Route.DISPATCH, addsToActiveTrip);
    }

    static Domain domainOf(String text) {
        if (containsAny(text, FLIGHT_WORDS)) {
            return Domain.FLIGHTS;
        }
        if (containsAny(text, LODGING_WORDS)) {
            return Domain.LODGING;
        }
        if (containsAny(text, VEHICLE_WORDS)) {
            return Domain.VEHICLES;
        }
        return Domain.NONE;
    }

    private static boolean containsAny(String text, List<Pattern> keywords) {
        return keywords.stream().anyMatch(keyword -> keyword.matcher(text).find());
    }

    private static List<Pattern> keywords(String... words) {
        return Arrays.stream(words).map(word -> Pattern.compile("\\b" + Pattern.quote(word))).toList();
    }
}
