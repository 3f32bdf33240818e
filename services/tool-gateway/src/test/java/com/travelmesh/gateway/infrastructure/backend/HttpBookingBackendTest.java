package com.travelmesh.gateway.infrastructure.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.travelmesh.gateway.domain.backend.BackendException;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

@DisplayName("HttpBookingBackend")
class HttpBookingBackendTest {

    private MockRestServiceServer server;
    private HttpBookingBackend backend;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://bookings");
        server = MockRestServiceServer.bindTo(builder).build();
        backend = new HttpBookingBackend(builder.build());
    }

    @Test
    @DisplayName("search posts the criteria and returns the results list")
    void search() {
        server.expect(requestTo("http://bookings/search"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.city").value("Miami"))
                .andRespond(withSuccess("{\"results\":[{\"hotel_id\":\"H1\"}]}", MediaType.APPLICATION_JSON));

        assertThat(backend.search(Map.of("city", "Miami")))
                .singleElement()
                .satisfies(offer -> assertThat(offer).containsEntry("hotel_id", "H1"));
        server.verify();
    }

    @Test
    @DisplayName("a results list holding non-objects is a backend failure")
    void nonObjectResults() {
        server.expect(requestTo("http://bookings/search"))
                .andRespond(withSuccess("{\"results\":[1,\"two\"]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> backend.search(Map.of("city", "Miami")))
                .isInstanceOf(BackendException.class)
                .hasMessageContaining("'results'");
    }

    @Test
    @DisplayName("a 404 lookup is an empty result")
    void notFoundIsEmpty() {
        server.expect(requestTo("http://bookings/bookings/ABC")).andRespond(withResourceNotFound());

        assertThat(backend.get("ABC")).isEmpty();
    }

    @Test
    @DisplayName("book posts the offer id with the booking details")
    void book() {
        server.expect(requestTo("http://bookings/bookings"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.offer_id").value("H1"))
                .andExpect(jsonPath("$.details.guest_name").value("Ada"))
                .andRespond(withSuccess("{\"booking_id\":\"B1\",\"status\":\"confirmed\"}", MediaType.APPLICATION_JSON));

        assertThat(backend.book("H1", Map.of("guest_name", "Ada"))).containsEntry("booking_id", "B1");
    }

    @Test
    @DisplayName("a refused cancellation becomes a BackendException")
    void refusedCancellation() {
        server.expect(requestTo("http://bookings/bookings/B1"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.CONFLICT));

        assertThatThrownBy(() -> backend.cancel("B1"))
                .isInstanceOf(BackendException.class)
                .hasMessageContaining("409");
    }

    @Test
    @DisplayName("a server error becomes a BackendException")
    void serverError() {
        server.expect(requestTo("http://bookings/locations")).andRespond(withServerError());

        assertThatThrownBy(() -> backend.listLocations())
                .isInstanceOf(BackendException.class)
                .hasMessageContaining("unavailable");
    }

    @Test
    @DisplayName("a body without the expected list becomes a BackendException")
    void missingList() {
        server.expect(requestTo("http://bookings/locations"))
                .andRespond(withSuccess("{\"unexpected\":true}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> backend.listLocations()).isInstanceOf(BackendException.class);
    }
}
