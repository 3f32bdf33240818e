package com.travelmesh.gateway.domain.tool;

import static com.travelmesh.gateway.domain.tool.ToolDefinition.query;
import static com.travelmesh.gateway.domain.tool.ToolDefinition.sideEffecting;

import com.travelmesh.gateway.domain.backend.BackendException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Tool table of the hotel gateway. */
final class LodgingTools {

    private LodgingTools() {}

    static List<ToolDefinition> definitions() {
        return List.of(
                query("list_cities", "List cities with available hotels", List.of(), List.of(),
                        (backend, args) -> Map.of("cities", backend.listLocations())),
                query("search_hotels", "Search for hotels in a city",
                        List.of("city"), List.of("check_in", "check_out", "guests", "min_stars"),
                        (backend, args) -> {
                            int minStars = args.integer("min_stars", 1);
                            var hotels = backend.search(args.select(List.of("city", "check_in", "check_out"))).stream()
                                    .filter(hotel -> stars(hotel) >= minStars)
                                    .toList();
                            return Map.of("hotels", hotels, "count", hotels.size());
                        }),
                query("get_hotel_details", "Get detailed information about a hotel",
                        List.of("hotel_id"), List.of(),
                        (backend, args) -> {
                            String hotelId = args.required("hotel_id");
                            return Map.of("hotel", backend.findOffer(hotelId)
                                    .orElseThrow(() -> new BackendException("Hotel not found: " + hotelId)));
                        }),
                sideEffecting("book_hotel", "Book a hotel room",
                        List.of("hotel_id"), List.of("room_type", "check_in", "check_out", "guest_name", "guest_email"),
                        (backend, args) -> {
                            Map<String, Object> details = new LinkedHashMap<>(
                                    args.select(List.of("check_in", "check_out", "guest_name", "guest_email")));
                            details.put("room_type", args.text("room_type").orElse("standard"));
                            return Map.of("reservation", backend.book(args.required("hotel_id"), details));
                        }),
                query("get_reservation", "Get reservation details",
                        List.of("reservation_id"), List.of(),
                        (backend, args) -> {
                            String reservationId = args.required("reservation_id");
                            return Map.of("reservation", backend.get(reservationId)
                                    .orElseThrow(() -> new BackendException("Reservation not found: " + reservationId)));
                        }),
                sideEffecting("cancel_reservation", "Cancel a hotel reservation",
                        List.of("reservation_id"), List.of(),
                        (backend, args) -> Map.of("reservation", backend.cancel(args.required("reservation_id")))));
    }

    private static int stars(Map<String, Object> hotel) {
        return hotel.get("star_rating") instanceof Number n ? n.intValue() : 0;
    }
}
