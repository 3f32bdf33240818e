package com.travelmesh.orchestrator.infrastructure.context;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.travelmesh.agentapi.ItineraryItemSnapshot;
import com.travelmesh.agentapi.TripSnapshot;
import com.travelmesh.orchestrator.domain.context.ContextClient;
import com.travelmesh.orchestrator.domain.context.NewItineraryItem;
import com.travelmesh.orchestrator.domain.context.UserContext;
import com.travelmesh.security.UpstreamUnavailableException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * REST adapter to the itinerary service.
 *
 * <pre>
 * GET  {base}/api/v1/users/{id}/context  -> {user, active_trip, all_trips, itinerary}
 * GET  {base}/api/v1/trips/{id}/itinerary -> [item]
 * POST {base}/api/v1/trips               {user_id, destination, name}  -> trip
 * POST {base}/api/v1/itinerary           {trip_id, item_type, ...}     -> item
 * GET  {base}/health
 * </pre>
 */
public class HttpContextClient implements ContextClient {

    static final String UPSTREAM = "itinerary-service";

    private final RestClient restClient;

    public HttpContextClient(RestClient.Builder builder, String baseUrl, Duration timeout) {
        this(builder.clone().baseUrl(baseUrl).requestFactory(requestFactory(timeout)).build());
    }

    public HttpContextClient(RestClient restClient) {
        this.restClient = restClient;
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());
        return requestFactory;
    }

    @Override
    public Optional<UserContext> findContext(String userId) {
        ContextDocument document;
        try {
            document = restClient.get()
                    .uri("/api/v1/users/{id}/context", userId)
                    .retrieve()
                    .body(ContextDocument.class);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
                return Optional.empty();
            }
            throw failure("context lookup", e);
        } catch (RestClientException e) {
            throw failure("context lookup", e);
        }
        return Optional.ofNullable(document).map(doc -> doc.toUserContext(userId));
    }

    @Override
    public List<ItineraryItemSnapshot> findItinerary(String tripId) {
        ItineraryItemSnapshot[] items;
        try {
            items = restClient.get()
                    .uri("/api/v1/trips/{id}/itinerary", tripId)
                    .retrieve()
                    .body(ItineraryItemSnapshot[].class);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
                return List.of();
            }
            throw failure("itinerary lookup", e);
        } catch (RestClientException e) {
            throw failure("itinerary lookup", e);
        }
        return items == null ? List.of() : List.of(items);
    }

    @Override
    public TripSnapshot createTrip(String userId, String destination) {
        Map<String, Object> body = Map.of(
                "user_id", userId,
                "destination", destination,
                "name", "Trip to " + destination);
        TripSnapshot trip = call("trip creation", () -> restClient.post()
                .uri("/api/v1/trips")
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(TripSnapshot.class));
        if (trip == null) {
            throw new UpstreamUnavailableException(UPSTREAM, "Itinerary service returned no trip");
        }
        return trip;
    }

    @Override
    public ItineraryItemSnapshot appendItineraryItem(String tripId, NewItineraryItem item) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("trip_id", tripId);
        body.put("item_type", item.itemType());
        body.put("status", item.status());
        body.put("details", item.details());
        if (item.bookingReference() != null) {
            body.put("booking_reference", item.bookingReference());
        }
        if (item.provider() != null) {
            body.put("provider", item.provider());
        }
        return call("itinerary append", () -> restClient.post()
                .uri("/api/v1/itinerary")
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(ItineraryItemSnapshot.class));
    }

    /** Liveness of the itinerary service, for the health endpoint. */
    public void ping() {
        call("health probe", () -> restClient.get().uri("/health").retrieve().toBodilessEntity());
    }

    private static <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientException e) {
            throw failure(operation, e);
        }
    }

    private static UpstreamUnavailableException failure(String operation, RestClientException e) {
        return new UpstreamUnavailableException(UPSTREAM, "Itinerary service failed during " + operation, e);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ContextDocument(
            @JsonProperty("user") Map<String, Object> user,
            @JsonProperty("active_trip") TripSnapshot activeTrip,
            @JsonProperty("all_trips") List<TripSnapshot> allTrips,
            @JsonProperty("itinerary") List<ItineraryItemSnapshot> itinerary) {

        UserContext toUserContext(String userId) {
            Map<String, Object> preferences = new LinkedHashMap<>();
            if (user != null && user.get("preferences") instanceof Map<?, ?> map) {
                map.forEach((name, value) -> preferences.put(String.valueOf(name), value));
            }
            return new UserContext(userId, activeTrip, allTrips, itinerary, preferences);
        }
    }
}
