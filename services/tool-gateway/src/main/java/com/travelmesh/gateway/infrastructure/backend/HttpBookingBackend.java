package com.travelmesh.gateway.infrastructure.backend;

import com.travelmesh.gateway.domain.backend.BackendException;
import com.travelmesh.gateway.domain.backend.BookingBackend;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * REST adapter to an external booking service.
 *
 * <pre>
 * POST   {base}/search          {criteria}           -> {"results": [...]}
 * GET    {base}/offers/{id}                          -> offer
 * POST   {base}/bookings        {offer_id, details}  -> booking
 * GET    {base}/bookings/{id}                        -> booking
 * DELETE {base}/bookings/{id}                        -> booking
 * GET    {base}/locations                            -> {"locations": [...]}
 * </pre>
 *
 * A 404 on a lookup is an empty result; every other failure becomes a {@link BackendException}.
 */
public class HttpBookingBackend implements BookingBackend {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private final RestClient restClient;

    public HttpBookingBackend(RestClient.Builder builder, String baseUrl, Duration timeout) {
        this(builder.clone().baseUrl(baseUrl).requestFactory(requestFactory(timeout)).build());
    }

    public HttpBookingBackend(RestClient restClient) {
        this.restClient = restClient;
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());
        return requestFactory;
    }

    @Override
    public List<Map<String, Object>> search(Map<String, Object> criteria) {
        Map<String, Object> body = call("search", () -> restClient.post()
                .uri("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .body(criteria)
                .retrieve()
                .body(JSON_OBJECT));
        return listField(body, "results");
    }

    @Override
    public Optional<Map<String, Object>> findOffer(String offerId) {
        return lookup("offer lookup", "/offers/{id}", offerId);
    }

    @Override
    public Map<String, Object> book(String offerId, Map<String, Object> details) {
        Map<String, Object> booking = call("booking", () -> restClient.post()
                .uri("/bookings")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("offer_id", offerId, "details", details))
                .retrieve()
                .body(JSON_OBJECT));
        return requireBody(booking, "booking");
    }

    @Override
    public Optional<Map<String, Object>> get(String bookingId) {
        return lookup("booking lookup", "/bookings/{id}", bookingId);
    }

    @Override
    public Map<String, Object> cancel(String bookingId) {
        Map<String, Object> booking = call("cancellation", () -> restClient.delete()
                .uri("/bookings/{id}", bookingId)
                .retrieve()
                .body(JSON_OBJECT));
        return requireBody(booking, "cancellation");
    }

    @Override
    public List<Map<String, Object>> listLocations() {
        Map<String, Object> body = call("location listing", () -> restClient.get()
                .uri("/locations")
                .retrieve()
                .body(JSON_OBJECT));
        return listField(body, "locations");
    }

    private Optional<Map<String, Object>> lookup(String operation, String uri, String id) {
        try {
            return Optional.ofNullable(restClient.get().uri(uri, id).retrieve().body(JSON_OBJECT));
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
                return Optional.empty();
            }
            throw failure(operation, e);
        } catch (RestClientException e) {
            throw failure(operation, e);
        }
    }

    private static Map<String, Object> call(String operation, RestCall call) {
        try {
            return call.execute();
        } catch (RestClientException e) {
            throw failure(operation, e);
        }
    }

    private static BackendException failure(String operation, RestClientException e) {
        if (e instanceof HttpClientErrorException clientError) {
            return new BackendException("Booking service rejected the %s: %s"
                    .formatted(operation, clientError.getStatusCode().value()), e);
        }
        return new BackendException("Booking service unavailable during " + operation, e);
    }

    private static Map<String, Object> requireBody(Map<String, Object> body, String operation) {
        if (body == null) {
            throw new BackendException("Booking service returned no body for the " + operation);
        }
        return body;
    }

    private static List<Map<String, Object>> listField(Map<String, Object> body, String field) {
        if (body == null || !(body.get(field) instanceof List<?> list)) {
            throw new BackendException("Booking service returned no '" + field + "' list");
        }
        List<Map<String, Object>> entries = new ArrayList<>(list.size());
        for (Object element : list) {
            if (!(element instanceof Map<?, ?> entry)) {
                throw new BackendException("Booking service returned a non-object entry in '" + field + "'");
            }
            Map<String, Object> copy = new LinkedHashMap<>();
            entry.forEach((key, value) -> copy.put(String.valueOf(key), value));
            entries.add(copy);
        }
        return entries;
    }

    @FunctionalInterface
    private interface RestCall {
        Map<String, Object> execute();
    }
}
