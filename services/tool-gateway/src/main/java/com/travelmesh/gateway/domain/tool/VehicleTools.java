package com.travelmesh.gateway.domain.tool;

import static com.travelmesh.gateway.domain.tool.ToolDefinition.query;
import static com.travelmesh.gateway.domain.tool.ToolDefinition.sideEffecting;

import com.travelmesh.gateway.domain.backend.BackendException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Tool table of the car-rental gateway. */
final class VehicleTools {

    private VehicleTools() {}

    static List<ToolDefinition> definitions() {
        return List.of(
                query("list_locations", "List available rental locations", List.of(), List.of(),
                        (backend, args) -> Map.of("locations", backend.listLocations())),
                query("list_vehicle_categories", "Get available vehicle categories", List.of(), List.of("location"),
                        (backend, args) -> {
                            // one search, distinct categories of all offers
                            List<Object> categories = backend.search(args.select(List.of("location"))).stream()
                                    .map(offer -> offer.get("category"))
                                    .filter(Objects::nonNull)
                                    .distinct()
                                    .toList();
                            return Map.of("categories", categories);
                        }),
                query("search_vehicles", "Search for available vehicles",
                        List.of("location"), List.of("pickup_date", "return_date", "category"),
                        (backend, args) -> {
                            var vehicles = backend.search(
                                    args.select(List.of("location", "pickup_date", "return_date", "category")));
                            return Map.of("vehicles", vehicles, "count", vehicles.size());
                        }),
                query("get_vehicle_details", "Get detailed information about a vehicle",
                        List.of("vehicle_id"), List.of(),
                        (backend, args) -> {
                            String vehicleId = args.required("vehicle_id");
                            return Map.of("vehicle", backend.findOffer(vehicleId)
                                    .orElseThrow(() -> new BackendException("Vehicle not found: " + vehicleId)));
                        }),
                sideEffecting("book_vehicle", "Book a rental vehicle",
                        List.of("vehicle_id"), List.of("pickup_date", "return_date", "driver_name"),
                        (backend, args) -> {
                            Map<String, Object> details = new LinkedHashMap<>(
                                    args.select(List.of("pickup_date", "return_date", "driver_name")));
                            return Map.of("rental", backend.book(args.required("vehicle_id"), details));
                        }),
                query("get_rental", "Get rental details",
                        List.of("rental_id"), List.of(),
                        (backend, args) -> {
                            String rentalId = args.required("rental_id");
                            return Map.of("rental", backend.get(rentalId)
                                    .orElseThrow(() -> new BackendException("Rental not found: " + rentalId)));
                        }),
                sideEffecting("cancel_rental", "Cancel a rental booking",
                        List.of("rental_id"), List.of(),
                        (backend, args) -> Map.of("rental", backend.cancel(args.required("rental_id")))));
    }
}
