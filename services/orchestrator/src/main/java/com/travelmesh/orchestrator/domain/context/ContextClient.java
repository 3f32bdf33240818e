package com.travelmesh.orchestrator.domain.context;

import com.travelmesh.agentapi.ItineraryItemSnapshot;
import com.travelmesh.agentapi.TripSnapshot;
import java.util.List;
import java.util.Optional;

/**
 * The external store of users, trips and itineraries.
 *
 * <p>Failures to reach the store are {@link com.travelmesh.security.UpstreamUnavailableException}s.
 */
public interface ContextClient {

    /** Empty for a user the store does not know. */
    Optional<UserContext> findContext(String userId);

    /** Items of one trip in the order they were added; empty for an unknown trip. */
    List<ItineraryItemSnapshot> findItinerary(String tripId);

    /** Creates a trip; it becomes the user's active trip. */
    TripSnapshot createTrip(String userId, String destination);

    /** Appends to the trip's item list without reading it first. */
    ItineraryItemSnapshot appendItineraryItem(String tripId, NewItineraryItem item);
}
