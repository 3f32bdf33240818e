package com.travelmesh.agentapi;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of the caller's travel context handed to a worker agent by value.
 * <p>
 * Collections are copied on construction with null entries dropped, so a context can be shared
 * across threads as is.
 *
 * @param activeTrip      the trip new bookings attach to, if any
 * @param priorItinerary  items already booked on the active trip
 * @param userPreferences free-form preferences (e.g. seat class)
 * @param parameters      structured fields supplied by the client (e.g. {@code hotel_id}, {@code check_in})
 * @param confirmed       explicit confirmation for side-effecting actions
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DispatchContext(
        @JsonProperty("active_trip") TripSnapshot activeTrip,
        @JsonProperty("prior_itinerary") List<ItineraryItemSnapshot> priorItinerary,
        @JsonProperty("user_preferences") Map<String, Object> userPreferences,
        @JsonProperty("parameters") Map<String, Object> parameters,
        @JsonProperty("confirmed") boolean confirmed
) {

    public DispatchContext {
        priorItinerary = priorItinerary == null ? List.of()
                : priorItinerary.stream().filter(Objects::nonNull).toList();
        userPreferences = copyWithoutNulls(userPreferences);
        parameters = copyWithoutNulls(parameters);
    }

    /** Context of a caller with no trips and no parameters. */
    public static DispatchContext empty() {
        return new DispatchContext(null, List.of(), Map.of(), Map.of(), false);
    }

    /** Returns a copy carrying the given client parameters and confirmation flag. */
    public DispatchContext withRequest(Map<String, Object> requestParameters, boolean requestConfirmed) {
        return new DispatchContext(activeTrip, priorItinerary, userPreferences, requestParameters, requestConfirmed);
    }

    /**
     * A non-blank parameter rendered as a string.
     */
    @JsonIgnore
    public Optional<String> parameter(String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return Optional.empty();
        }
        String text = value instanceof Double d && d == Math.rint(d) && !d.isInfinite()
                ? String.valueOf(d.longValue())
                : value.toString();
        return text.isBlank() ? Optional.empty() : Optional.of(text.trim());
    }

    @JsonIgnore
    public Optional<TripSnapshot> activeTripSnapshot() {
        return Optional.ofNullable(activeTrip);
    }

    private static Map<String, Object> copyWithoutNulls(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
