package com.travelmesh.orchestrator.domain.context;

import java.util.Map;

/**
 * Item to append to a trip after a successful booking.
 *
 * @param itemType {@code flight}, {@code hotel} or {@code car}
 * @param details the booking record as the agent returned it
 */
public record NewItineraryItem(
        String itemType, String bookingReference, String provider, String status, Map<String, Object> details) {

    public NewItineraryItem {
        details = details == null ? Map.of() : details;
    }
}
