package com.travelmesh.orchestrator.infrastructure.context;

import com.travelmesh.agentapi.ItineraryItemSnapshot;
import com.travelmesh.agentapi.TripSnapshot;
import com.travelmesh.orchestrator.domain.context.ContextClient;
import com.travelmesh.orchestrator.domain.context.NewItineraryItem;
import com.travelmesh.orchestrator.domain.context.UserContext;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local context store. The newest trip of a user is the active one. Item lists are
 * append-only, so concurrent bookings on one trip never overwrite each other.
 */
public class InMemoryContextClient implements ContextClient {

    private final ConcurrentMap<String, List<TripSnapshot>> tripsByUser = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<ItineraryItemSnapshot>> itemsByTrip = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Map<String, Object>> preferencesByUser = new ConcurrentHashMap<>();

    @Override
    public Optional<UserContext> findContext(String userId) {
        List<TripSnapshot> trips = tripsByUser.get(userId);
        Map<String, Object> preferences = preferencesByUser.getOrDefault(userId, Map.of());
        if (trips == null && !preferencesByUser.containsKey(userId)) {
            return Optional.empty();
        }
        List<TripSnapshot> allTrips = trips == null ? List.of() : List.copyOf(trips);
        TripSnapshot active = allTrips.isEmpty() ? null : allTrips.get(allTrips.size() - 1);
        List<ItineraryItemSnapshot> itinerary = active == null ? List.of() : findItinerary(active.tripId());
        return Optional.of(new UserContext(userId, active, allTrips, itinerary, preferences));
    }

    @Override
    public List<ItineraryItemSnapshot> findItinerary(String tripId) {
        return List.copyOf(itemsByTrip.getOrDefault(tripId, List.of()));
    }

    @Override
    public TripSnapshot createTrip(String userId, String destination) {
        TripSnapshot trip = new TripSnapshot(
                UUID.randomUUID().toString(),
                userId,
                "Trip to " + destination,
                destination,
                null,
                null,
                null,
                "planning");
        tripsByUser.computeIfAbsent(userId, id -> new CopyOnWriteArrayList<>()).add(trip);
        return trip;
    }

    @Override
    public ItineraryItemSnapshot appendItineraryItem(String tripId, NewItineraryItem item) {
        ItineraryItemSnapshot snapshot = new ItineraryItemSnapshot(
                UUID.randomUUID().toString(),
                tripId,
                item.itemType(),
                item.bookingReference(),
                item.provider(),
                item.status(),
                null,
                null,
                null,
                "USD");
        itemsByTrip.computeIfAbsent(tripId, id -> new CopyOnWriteArrayList<>()).add(snapshot);
        return snapshot;
    }

    /** Stores preferences for a user; a user with preferences has a context even without trips. */
    public void savePreferences(String userId, Map<String, Object> preferences) {
        preferencesByUser.put(userId, Map.copyOf(preferences));
    }
}
