package com.travelmesh.agent.domain.rules;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds known cities in free text.
 *
 * <p>City names and aliases match case-insensitively on word boundaries. Airport codes match only
 * when written in upper case ("JFK"), so ordinary words like "den" or "bos" are never mistaken for
 * one.
 */
public final class LocationResolver {

    /** A city the booking domains serve, with its primary airport code. */
    public record KnownCity(String name, String code, List<String> aliases) {

        public KnownCity {
            aliases = List.copyOf(aliases);
        }
    }

    private static final List<KnownCity> DEFAULT_CITIES = List.of(
            new KnownCity("New York", "JFK", List.of("new york", "nyc", "manhattan")),
            new KnownCity("Los Angeles", "LAX", List.of("los angeles")),
            new KnownCity("Chicago", "ORD", List.of("chicago")),
            new KnownCity("San Francisco", "SFO", List.of("san francisco")),
            new KnownCity("Miami", "MIA", List.of("miami")),
            new KnownCity("Seattle", "SEA", List.of("seattle")),
            new KnownCity("Boston", "BOS", List.of("boston")),
            new KnownCity("Dallas", "DFW", List.of("dallas")),
            new KnownCity("Atlanta", "ATL", List.of("atlanta")),
            new KnownCity("Denver", "DEN", List.of("denver")));

    private final List<KnownCity> cities;

    public LocationResolver(List<KnownCity> cities) {
        this.cities = List.copyOf(cities);
    }

    public static LocationResolver standard() {
        return new LocationResolver(DEFAULT_CITIES);
    }

    /** The city mentioned earliest in the text. */
    public Optional<KnownCity> firstMentioned(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        KnownCity earliest = null;
        int earliestIndex = Integer.MAX_VALUE;
        for (KnownCity city : cities) {
            int index = indexOf(text, city, "");
            if (index >= 0 && index < earliestIndex) {
                earliest = city;
                earliestIndex = index;
            }
        }
        return Optional.ofNullable(earliest);
    }

    /** The city directly following a preposition, as in "from Boston" or "to MIA". */
    public Optional<KnownCity> after(String text, String preposition) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String prefix = "(?i:\\b" + Pattern.quote(preposition) + ")\\s+(?i:the\\s+)?";
        return cities.stream().filter(city -> indexOf(text, city, prefix) >= 0).findFirst();
    }

    /** Resolves a name, alias or code; empty when the city is not known. */
    public Optional<KnownCity> resolve(String nameOrCode) {
        if (nameOrCode == null) {
            return Optional.empty();
        }
        String wanted = nameOrCode.trim().toLowerCase(Locale.ROOT);
        return cities.stream()
                .filter(city -> city.code().equalsIgnoreCase(wanted)
                        || city.name().equalsIgnoreCase(wanted)
                        || city.aliases().contains(wanted))
                .findFirst();
    }

    private static int indexOf(String text, KnownCity city, String prefix) {
        int best = -1;
        for (String alias : city.aliases()) {
            best = earliest(best, find(Pattern.compile(prefix + "(?i:\\b" + Pattern.quote(alias) + "\\b)"), text));
        }
        return earliest(best, find(Pattern.compile(prefix + "\\b" + city.code() + "\\b"), text));
    }

    private static int find(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.start() : -1;
    }

    private static int earliest(int a, int b) {
        if (a < 0) {
            return b;
        }
        return b < 0 ? a : Math.min(a, b);
    }
}
