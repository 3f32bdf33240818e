package com.travelmesh.orchestrator.domain.chat;

import static org.assertj.core.api.Assertions.assertThat;

import com.travelmesh.agentapi.ItineraryItemSnapshot;
import com.travelmesh.agentapi.TripSnapshot;
import com.travelmesh.orchestrator.domain.context.UserContext;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ItineraryFormatter")
class ItineraryFormatterTest {

    private final ItineraryFormatter formatter = new ItineraryFormatter();

    @Test
    @DisplayName("lists the bookings of the active trip")
    void withBookings() {
        TripSnapshot trip = new TripSnapshot("t-1", "user-1", "Spring break", "Miami",
                null, "2026-03-10", "2026-03-15", "booked");
        ItineraryItemSnapshot flight = new ItineraryItemSnapshot("i-1", "t-1", "flight", "BK-7", "SkyJet",
                "confirmed", null, null, null, "USD");
        UserContext context = new UserContext("user-1", trip, List.of(trip), List.of(flight), Map.of());

        assertThat(formatter.format(context)).isEqualTo("""
                Spring break
                Destination: Miami
                Dates: 2026-03-10 to 2026-03-15
                Status: Booked

                Itinerary:
                - Flight BK-7 with SkyJet [Confirmed]""");
    }

    @Test
    @DisplayName("without an active trip suggests planning one")
    void noTrip() {
        assertThat(formatter.format(UserContext.newUser("user-1"))).isEqualTo(ItineraryFormatter.NO_ACTIVE_TRIP);
    }
}
