package com.travelmesh.agent.domain.rules;

import static com.travelmesh.agent.domain.rules.ArgumentSource.cityInMessage;
import static com.travelmesh.agent.domain.rules.ArgumentSource.parameter;
import static com.travelmesh.agent.domain.rules.ArgumentSource.preference;
import static com.travelmesh.agent.domain.rules.ArgumentSource.tripDestination;
import static com.travelmesh.agent.domain.rules.ArgumentSource.tripEndDate;
import static com.travelmesh.agent.domain.rules.ArgumentSource.tripStartDate;
import static com.travelmesh.agent.domain.rules.ArgumentSpec.optional;
import static com.travelmesh.agent.domain.rules.ArgumentSpec.required;
import static com.travelmesh.agent.domain.rules.RulePredicate.anyWord;
import static com.travelmesh.agent.domain.rules.RulePredicate.hasParameter;

import com.travelmesh.agent.domain.rules.ArgumentSource.CityForm;
import java.util.List;

/** Rules of the hotel agent. Cities are passed by name. */
final class LodgingRules {

    private LodgingRules() {}

    static List<DispatchRule> rules(LocationResolver resolver) {
        return List.of(
                new DispatchRule(
                        anyWord("cities").and(anyWord("list", "which", "what", "available", "show", "all")),
                        "list_cities", "List cities with available hotels",
                        List.of(), false, "Available cities"),
                new DispatchRule(
                        anyWord("book", "reserve"),
                        "book_hotel", "Book a hotel room",
                        List.of(
                                required("hotel_id", parameter("hotel_id")),
                                optional("room_type", parameter("room_type"), preference("room_type")),
                                optional("check_in", parameter("check_in"), tripStartDate()),
                                optional("check_out", parameter("check_out"), tripEndDate()),
                                optional("guest_name", parameter("guest_name"), preference("name")),
                                optional("guest_email", parameter("guest_email"), preference("email"))),
                        true, "Hotel booked"),
                new DispatchRule(
                        anyWord("cancel"),
                        "cancel_reservation", "Cancel a hotel reservation",
                        List.of(required("reservation_id", parameter("reservation_id"))),
                        true, "Reservation cancelled"),
                new DispatchRule(
                        hasParameter("reservation_id"),
                        "get_reservation", "Get reservation details",
                        List.of(required("reservation_id", parameter("reservation_id"))),
                        false, "Reservation details"),
                new DispatchRule(
                        hasParameter("hotel_id"),
                        "get_hotel_details", "Get detailed information about a hotel",
                        List.of(required("hotel_id", parameter("hotel_id"))),
                        false, "Hotel details"),
                new DispatchRule(
                        anyWord("hotel", "hotels", "search", "find", "stay", "room", "rooms", "accommodation", "lodging"),
                        "search_hotels", "Search for hotels in a city",
                        List.of(
                                required("city",
                                        parameter("city"),
                                        cityInMessage(resolver, CityForm.NAME),
                                        tripDestination(resolver, CityForm.NAME)),
                                optional("check_in", parameter("check_in"), tripStartDate()),
                                optional("check_out", parameter("check_out"), tripEndDate()),
                                optional("guests", parameter("guests"), preference("guests")),
                                optional("min_stars", parameter("min_stars"), preference("min_stars"))),
                        false, "Available hotels"));
    }
}
