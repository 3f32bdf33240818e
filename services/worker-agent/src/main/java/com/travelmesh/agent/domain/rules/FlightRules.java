package com.travelmesh.agent.domain.rules;

import static com.travelmesh.agent.domain.rules.ArgumentSource.cityAfter;
import static com.travelmesh.agent.domain.rules.ArgumentSource.parameter;
import static com.travelmesh.agent.domain.rules.ArgumentSource.preference;
import static com.travelmesh.agent.domain.rules.ArgumentSource.tripDestination;
import static com.travelmesh.agent.domain.rules.ArgumentSource.tripOrigin;
import static com.travelmesh.agent.domain.rules.ArgumentSource.tripStartDate;
import static com.travelmesh.agent.domain.rules.ArgumentSpec.optional;
import static com.travelmesh.agent.domain.rules.ArgumentSpec.required;
import static com.travelmesh.agent.domain.rules.RulePredicate.anyWord;
import static com.travelmesh.agent.domain.rules.RulePredicate.hasParameter;

import com.travelmesh.agent.domain.rules.ArgumentSource.CityForm;
import java.util.List;

/** Rules of the airline agent. Airports are passed as codes. */
final class FlightRules {

    private FlightRules() {}

    static List<DispatchRule> rules(LocationResolver resolver) {
        return List.of(
                new DispatchRule(
                        anyWord("airports").and(anyWord("list", "which", "what", "available", "show", "all")),
                        "list_airports", "List all available airports",
                        List.of(), false, "Available airports"),
                new DispatchRule(
                        anyWord("book", "reserve", "purchase"),
                        "book_flight", "Book a flight for passengers",
                        List.of(
                                required("flight_id", parameter("flight_id")),
                                optional("passengers", parameter("passengers"), preference("passengers")),
                                optional("passenger_name", parameter("passenger_name"), preference("name")),
                                optional("email", parameter("email"), preference("email"))),
                        true, "Flight booked"),
                new DispatchRule(
                        anyWord("cancel"),
                        "cancel_booking", "Cancel an existing booking",
                        List.of(required("confirmation_code", parameter("confirmation_code"))),
                        true, "Booking cancelled"),
                new DispatchRule(
                        hasParameter("confirmation_code"),
                        "get_booking", "Retrieve booking details by confirmation code",
                        List.of(required("confirmation_code", parameter("confirmation_code"))),
                        false, "Booking details"),
                new DispatchRule(
                        hasParameter("flight_id"),
                        "get_flight_details", "Get detailed information about a specific flight",
                        List.of(required("flight_id", parameter("flight_id"))),
                        false, "Flight details"),
                new DispatchRule(
                        anyWord("flight", "flights", "fly", "flying", "search", "find", "plane", "airline", "airport"),
                        "search_flights", "Search for flights between airports",
                        List.of(
                                required("origin",
                                        parameter("origin"),
                                        cityAfter(resolver, "from", CityForm.CODE),
                                        tripOrigin(resolver, CityForm.CODE)),
                                required("destination",
                                        parameter("destination"),
                                        cityAfter(resolver, "to", CityForm.CODE),
                                        tripDestination(resolver, CityForm.CODE)),
                                optional("date", parameter("date"), tripStartDate()),
                                optional("passengers", parameter("passengers"), preference("passengers"))),
                        false, "Available flights"));
    }
}
