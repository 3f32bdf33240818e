package com.travelmesh.orchestrator.domain.chat;

import com.travelmesh.agentapi.ItineraryItemSnapshot;
import com.travelmesh.agentapi.TripSnapshot;
import com.travelmesh.orchestrator.domain.context.UserContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Renders a user's active trip as chat text. */
public class ItineraryFormatter {

    static final String NO_ACTIVE_TRIP = "You don't have any active trips. Would you like me to help you plan one?";

    public String format(UserContext context) {
        TripSnapshot trip = context.activeTrip();
        if (trip == null) {
            return NO_ACTIVE_TRIP;
        }
        List<String> lines = new ArrayList<>();
        lines.add(orDefault(trip.name(), "Your trip"));
        lines.add("Destination: " + orDefault(trip.destination(), "TBD"));
        if (trip.startDate() != null && trip.endDate() != null) {
            lines.add("Dates: " + trip.startDate() + " to " + trip.endDate());
        }
        lines.add("Status: " + capitalize(orDefault(trip.status(), "planning")));
        if (context.trips().size() > 1) {
            lines.add("Other trips: " + (context.trips().size() - 1));
        }
        lines.add("");
        if (context.itinerary().isEmpty()) {
            lines.add("No bookings yet. What would you like to add?");
        } else {
            lines.add("Itinerary:");
            for (ItineraryItemSnapshot item : context.itinerary()) {
                lines.add("- " + describe(item));
            }
        }
        return String.join("\n", lines);
    }

    private static String describe(ItineraryItemSnapshot item) {
        String kind = switch (orDefault(item.itemType(), "")) {
            case "flight" -> "Flight";
            case "hotel" -> "Hotel";
            case "car" -> "Car rental";
            default -> capitalize(orDefault(item.itemType(), "Booking"));
        };
        String reference = item.bookingReference() == null ? "" : " " + item.bookingReference();
        String provider = item.provider() == null ? "" : " with " + item.provider();
        return kind + reference + provider + " [" + capitalize(orDefault(item.status(), "pending")) + "]";
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
    }
}
