package com.travelmesh.agentapi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only view of one booked itinerary item.
 *
 * @param itemType         "flight", "hotel" or "car"
 * @param bookingReference confirmation code issued by the backend
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ItineraryItemSnapshot(
        @JsonProperty("item_id") String itemId,
        @JsonProperty("trip_id") String tripId,
        @JsonProperty("item_type") String itemType,
        @JsonProperty("booking_reference") String bookingReference,
        @JsonProperty("provider") String provider,
        @JsonProperty("status") String status,
        @JsonProperty("check_in") String checkIn,
        @JsonProperty("check_out") String checkOut,
        @JsonProperty("price_cents") Long priceCents,
        @JsonProperty("currency") String currency
) {
}
