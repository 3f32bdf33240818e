package com.travelmesh.orchestrator.domain.context;

import com.travelmesh.agentapi.DispatchContext;
import com.travelmesh.agentapi.ItineraryItemSnapshot;
import com.travelmesh.agentapi.TripSnapshot;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * What the context collaborator knows about one user.
 *
 * @param activeTrip the trip new bookings attach to; null when the user has none
 * @param trips every trip of the user, including the active one
 * @param itinerary items of the active trip
 */
public record UserContext(
        String userId,
        TripSnapshot activeTrip,
        List<TripSnapshot> trips,
        List<ItineraryItemSnapshot> itinerary,
        Map<String, Object> preferences) {

    public UserContext {
        trips = trips == null ? List.of() : List.copyOf(trips);
        itinerary = itinerary == null ? List.of() : List.copyOf(itinerary);
        preferences = preferences == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(preferences));
    }

    /** Context of a user the collaborator has never seen. */
    public static UserContext newUser(String userId) {
        return new UserContext(userId, null, List.of(), List.of(), Map.of());
    }

    public Optional<TripSnapshot> activeTripSnapshot() {
        return Optional.ofNullable(activeTrip);
    }

    public boolean hasActiveTrip() {
        return activeTrip != null;
    }

    /**
     * Makes the given trip the active one when it is one of this user's trips. The stored itinerary
     * belongs to the previous active trip, so the selected trip's items are loaded through
     * {@code itineraryOf}.
     */
    public UserContext selectTrip(String tripId, Function<String, List<ItineraryItemSnapshot>> itineraryOf) {
        if (tripId == null || tripId.isBlank() || (activeTrip != null && tripId.equals(activeTrip.tripId()))) {
            return this;
        }
        return trips.stream()
                .filter(trip -> tripId.equals(trip.tripId()))
                .findFirst()
                .map(trip -> new UserContext(userId, trip, trips, itineraryOf.apply(trip.tripId()), preferences))
                .orElse(this);
    }

    /** Immutable snapshot handed to a worker agent. */
    public DispatchContext toDispatchContext() {
        List<ItineraryItemSnapshot> prior = activeTrip == null ? List.of() : itinerary.stream()
                .filter(item -> Objects.equals(item.tripId(), activeTrip.tripId()))
                .toList();
        return new DispatchContext(activeTrip, prior, preferences, Map.of(), false);
    }
}
