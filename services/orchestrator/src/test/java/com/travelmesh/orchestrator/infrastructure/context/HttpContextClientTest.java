package com.travelmesh.orchestrator.infrastructure.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.travelmesh.agentapi.ItineraryItemSnapshot;
import com.travelmesh.agentapi.TripSnapshot;
import com.travelmesh.orchestrator.domain.context.NewItineraryItem;
import com.travelmesh.orchestrator.domain.context.UserContext;
import com.travelmesh.security.UpstreamUnavailableException;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

@DisplayName("HttpContextClient")
class HttpContextClientTest {

    private MockRestServiceServer server;
    private HttpContextClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://itinerary.local");
        server = MockRestServiceServer.bindTo(builder).build();
        client = new HttpContextClient(builder.build());
    }

    @Test
    @DisplayName("the context document maps to a user context")
    void findContext() {
        server.expect(requestTo("http://itinerary.local/api/v1/users/user-1/context"))
                .andRespond(withSuccess("""
                        {"user":{"user_id":"user-1","preferences":{"seat":"aisle"}},
                         "active_trip":{"trip_id":"t-1","user_id":"user-1","destination":"Miami","status":"planning"},
                         "all_trips":[{"trip_id":"t-1","user_id":"user-1","destination":"Miami","status":"planning"}],
                         "itinerary":[{"item_id":"i-1","trip_id":"t-1","item_type":"hotel","booking_reference":"BK-1"}]}
                        """, MediaType.APPLICATION_JSON));

        UserContext context = client.findContext("user-1").orElseThrow();

        assertThat(context.activeTrip().tripId()).isEqualTo("t-1");
        assertThat(context.trips()).hasSize(1);
        assertThat(context.itinerary()).extracting(ItineraryItemSnapshot::bookingReference).containsExactly("BK-1");
        assertThat(context.preferences()).containsEntry("seat", "aisle");
    }

    @Test
    @DisplayName("an unknown user has no context")
    void unknownUser() {
        server.expect(requestTo("http://itinerary.local/api/v1/users/ghost/context"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.findContext("ghost")).isEmpty();
    }

    @Test
    @DisplayName("other failures are outages of the itinerary service")
    void outage() {
        server.expect(requestTo("http://itinerary.local/api/v1/users/user-1/context")).andRespond(withServerError());

        assertThatThrownBy(() -> client.findContext("user-1"))
                .isInstanceOf(UpstreamUnavailableException.class)
                .extracting(e -> ((UpstreamUnavailableException) e).upstream())
                .isEqualTo("itinerary-service");
    }

    @Test
    @DisplayName("a trip's itinerary is read from the trip resource")
    void findItinerary() {
        server.expect(requestTo("http://itinerary.local/api/v1/trips/t-1/itinerary"))
                .andRespond(withSuccess("""
                        [{"item_id":"i-1","trip_id":"t-1","item_type":"hotel","booking_reference":"BK-1"},
                         {"item_id":"i-2","trip_id":"t-1","item_type":"car","booking_reference":"RN-2"}]
                        """, MediaType.APPLICATION_JSON));

        assertThat(client.findItinerary("t-1"))
                .extracting(ItineraryItemSnapshot::bookingReference)
                .containsExactly("BK-1", "RN-2");
    }

    @Test
    @DisplayName("an unknown trip has no items")
    void unknownTripItinerary() {
        server.expect(requestTo("http://itinerary.local/api/v1/trips/t-9/itinerary"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.findItinerary("t-9")).isEmpty();
    }

    @Test
    @DisplayName("trip creation posts the destination")
    void createTrip() {
        server.expect(requestTo("http://itinerary.local/api/v1/trips"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json(
                        "{\"user_id\":\"user-1\",\"destination\":\"Paris\",\"name\":\"Trip to Paris\"}"))
                .andRespond(withSuccess(
                        "{\"trip_id\":\"t-2\",\"user_id\":\"user-1\",\"destination\":\"Paris\",\"status\":\"planning\"}",
                        MediaType.APPLICATION_JSON));

        TripSnapshot trip = client.createTrip("user-1", "Paris");

        assertThat(trip.tripId()).isEqualTo("t-2");
    }

    @Test
    @DisplayName("itinerary items are posted against the trip")
    void appendItem() {
        server.expect(requestTo("http://itinerary.local/api/v1/itinerary"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json(
                        "{\"trip_id\":\"t-1\",\"item_type\":\"car\",\"status\":\"confirmed\",\"booking_reference\":\"RN-9\"}"))
                .andRespond(withSuccess(
                        "{\"item_id\":\"i-9\",\"trip_id\":\"t-1\",\"item_type\":\"car\",\"booking_reference\":\"RN-9\"}",
                        MediaType.APPLICATION_JSON));

        ItineraryItemSnapshot item = client.appendItineraryItem(
                "t-1", new NewItineraryItem("car", "RN-9", null, "confirmed", Map.of()));

        assertThat(item.itemId()).isEqualTo("i-9");
        server.verify();
    }
}
