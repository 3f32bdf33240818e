package com.travelmesh.agent.domain.rules;

import static com.travelmesh.agent.domain.rules.ArgumentSource.cityInMessage;
import static com.travelmesh.agent.domain.rules.ArgumentSource.parameter;
import static com.travelmesh.agent.domain.rules.ArgumentSource.preference;
import static com.travelmesh.agent.domain.rules.ArgumentSource.tripDestination;
import static com.travelmesh.agent.domain.rules.ArgumentSource.tripEndDate;
import static com.travelmesh.agent.domain.rules.ArgumentSource.tripStartDate;
import static com.travelmesh.agent.domain.rules.ArgumentSource.wordIn;
import static com.travelmesh.agent.domain.rules.ArgumentSpec.optional;
import static com.travelmesh.agent.domain.rules.ArgumentSpec.required;
import static com.travelmesh.agent.domain.rules.RulePredicate.anyWord;
import static com.travelmesh.agent.domain.rules.RulePredicate.hasParameter;

import com.travelmesh.agent.domain.rules.ArgumentSource.CityForm;
import java.util.List;

/** Rules of the car-rental agent. Locations are passed by city name. */
final class VehicleRules {

    private VehicleRules() {}

    static List<DispatchRule> rules(LocationResolver resolver) {
        return List.of(
                new DispatchRule(
                        anyWord("locations").and(anyWord("list", "which", "what", "available", "show", "all")),
                        "list_locations", "List available rental locations",
                        List.of(), false, "Rental locations"),
                new DispatchRule(
                        anyWord("categories", "types", "classes"),
                        "list_vehicle_categories", "Get available vehicle categories",
                        List.of(optional("location",
                                parameter("location"),
                                cityInMessage(resolver, CityForm.NAME),
                                tripDestination(resolver, CityForm.NAME))),
                        false, "Vehicle categories"),
                new DispatchRule(
                        anyWord("book", "reserve"),
                        "book_vehicle", "Book a rental vehicle",
                        List.of(
                                required("vehicle_id", parameter("vehicle_id")),
                                optional("pickup_date", parameter("pickup_date"), tripStartDate()),
                                optional("return_date", parameter("return_date"), tripEndDate()),
                                optional("driver_name", parameter("driver_name"), preference("name"))),
                        true, "Vehicle booked"),
                new DispatchRule(
                        anyWord("cancel"),
                        "cancel_rental", "Cancel a rental booking",
                        List.of(required("rental_id", parameter("rental_id"))),
                        true, "Rental cancelled"),
                new DispatchRule(
                        hasParameter("rental_id"),
                        "get_rental", "Get rental details",
                        List.of(required("rental_id", parameter("rental_id"))),
                        false, "Rental details"),
                new DispatchRule(
                        hasParameter("vehicle_id"),
                        "get_vehicle_details", "Get detailed information about a vehicle",
                        List.of(required("vehicle_id", parameter("vehicle_id"))),
                        false, "Vehicle details"),
                new DispatchRule(
                        anyWord("car", "cars", "vehicle", "vehicles", "rent", "rental", "search", "find", "suv", "drive"),
                        "search_vehicles", "Search for available vehicles",
                        List.of(
                                required("location",
                                        parameter("location"),
                                        cityInMessage(resolver, CityForm.NAME),
                                        tripDestination(resolver, CityForm.NAME)),
                                optional("pickup_date", parameter("pickup_date"), tripStartDate()),
                                optional("return_date", parameter("return_date"), tripEndDate()),
                                optional("category", parameter("category"),
                                        wordIn("economy", "compact", "suv", "luxury"))),
                        false, "Available vehicles"));
    }
}
