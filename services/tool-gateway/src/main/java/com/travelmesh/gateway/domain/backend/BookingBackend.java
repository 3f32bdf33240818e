package com.travelmesh.gateway.domain.backend;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Record-of-truth store behind one tool gateway.
 *
 * <p>Offers and bookings are plain JSON-shaped maps so tool results pass through to the wire
 * unchanged. Every operation throws {@link BackendException} when the store fails or refuses.
 */
public interface BookingBackend {

    /** Offers matching the given criteria; criteria the store does not know are ignored. */
    List<Map<String, Object>> search(Map<String, Object> criteria);

    Optional<Map<String, Object>> findOffer(String offerId);

    /** Books an offer and returns the new booking, including its id. */
    Map<String, Object> book(String offerId, Map<String, Object> details);

    Optional<Map<String, Object>> get(String bookingId);

    /** Cancels a booking and returns it in its cancelled state. */
    Map<String, Object> cancel(String bookingId);

    List<Map<String, Object>> listLocations();
}
