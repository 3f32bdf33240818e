package com.travelmesh.gateway.domain.tool;

import static com.travelmesh.gateway.domain.tool.ToolDefinition.query;
import static com.travelmesh.gateway.domain.tool.ToolDefinition.sideEffecting;

import com.travelmesh.gateway.domain.backend.BackendException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Tool table of the airline gateway. */
final class FlightTools {

    private FlightTools() {}

    static List<ToolDefinition> definitions() {
        return List.of(
                query("list_airports", "List all available airports", List.of(), List.of(),
                        (backend, args) -> Map.of("airports", backend.listLocations())),
                query("search_flights", "Search for flights between airports",
                        List.of("origin", "destination"), List.of("date", "passengers"),
                        (backend, args) -> {
                            var flights = backend.search(args.select(List.of("origin", "destination", "date")));
                            return Map.of("flights", flights, "count", flights.size());
                        }),
                query("get_flight_details", "Get detailed information about a specific flight",
                        List.of("flight_id"), List.of(),
                        (backend, args) -> {
                            String flightId = args.required("flight_id");
                            return Map.of("flight", backend.findOffer(flightId)
                                    .orElseThrow(() -> new BackendException("Flight not found: " + flightId)));
                        }),
                sideEffecting("book_flight", "Book a flight for passengers",
                        List.of("flight_id"), List.of("passengers", "passenger_name", "email"),
                        (backend, args) -> {
                            Map<String, Object> details = new LinkedHashMap<>(args.select(List.of("passenger_name", "email")));
                            details.put("passengers", args.integer("passengers", 1));
                            return Map.of("booking", backend.book(args.required("flight_id"), details));
                        }),
                query("get_booking", "Retrieve booking details by confirmation code",
                        List.of("confirmation_code"), List.of(),
                        (backend, args) -> {
                            String code = args.required("confirmation_code");
                            return Map.of("booking", backend.get(code)
                                    .orElseThrow(() -> new BackendException("Booking not found: " + code)));
                        }),
                sideEffecting("cancel_booking", "Cancel an existing booking",
                        List.of("confirmation_code"), List.of(),
                        (backend, args) -> Map.of("booking", backend.cancel(args.required("confirmation_code")))));
    }
}
