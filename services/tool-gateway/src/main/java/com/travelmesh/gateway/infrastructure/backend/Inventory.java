package com.travelmesh.gateway.infrastructure.backend;

import java.util.List;
import java.util.Map;

/**
 * Seed data of an in-memory backend.
 *
 * @param idField offer field holding the offer id ("flight_id", "hotel_id", ...)
 */
public record Inventory(String idField, List<Map<String, Object>> locations, List<Map<String, Object>> offers) {

    public Inventory {
        locations = List.copyOf(locations);
        offers = List.copyOf(offers);
    }
}
