package com.travelmesh.orchestrator.infrastructure.context;

import static org.assertj.core.api.Assertions.assertThat;

import com.travelmesh.agentapi.ItineraryItemSnapshot;
import com.travelmesh.agentapi.TripSnapshot;
import com.travelmesh.orchestrator.domain.context.NewItineraryItem;
import com.travelmesh.orchestrator.domain.context.UserContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryContextClient")
class InMemoryContextClientTest {

    private final InMemoryContextClient client = new InMemoryContextClient();

    @Test
    @DisplayName("an unknown user has no context")
    void unknownUser() {
        assertThat(client.findContext("nobody")).isEmpty();
    }

    @Test
    @DisplayName("the newest trip is active and carries its own items")
    void newestTripActive() {
        TripSnapshot miami = client.createTrip("user-1", "Miami");
        client.appendItineraryItem(miami.tripId(), new NewItineraryItem("hotel", "BK-1", null, "confirmed", Map.of()));
        TripSnapshot paris = client.createTrip("user-1", "Paris");

        UserContext context = client.findContext("user-1").orElseThrow();

        assertThat(context.activeTrip()).isEqualTo(paris);
        assertThat(context.trips()).containsExactly(miami, paris);
        assertThat(context.itinerary()).isEmpty();
    }

    @Test
    @DisplayName("selecting an older trip brings back its bookings")
    void olderTripSelected() {
        TripSnapshot miami = client.createTrip("user-1", "Miami");
        client.appendItineraryItem(miami.tripId(), new NewItineraryItem("hotel", "BK-A", null, "confirmed", Map.of()));
        client.createTrip("user-1", "Paris");

        UserContext selected = client.findContext("user-1").orElseThrow()
                .selectTrip(miami.tripId(), client::findItinerary);

        assertThat(selected.activeTrip()).isEqualTo(miami);
        assertThat(selected.itinerary()).extracting(ItineraryItemSnapshot::bookingReference).containsExactly("BK-A");
        assertThat(selected.toDispatchContext().priorItinerary())
                .extracting(ItineraryItemSnapshot::bookingReference)
                .containsExactly("BK-A");
    }

    @Test
    @DisplayName("concurrent appends to one trip are all kept")
    void concurrentAppends() throws Exception {
        TripSnapshot trip = client.createTrip("user-1", "Miami");
        int bookings = 32;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < bookings; i++) {
                String reference = "BK-" + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return client.appendItineraryItem(
                            trip.tripId(), new NewItineraryItem("hotel", reference, null, "confirmed", Map.of()));
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(client.findItinerary(trip.tripId()))
                .hasSize(bookings)
                .extracting(ItineraryItemSnapshot::bookingReference)
                .doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("preferences alone make a context")
    void preferencesOnly() {
        client.savePreferences("user-2", Map.of("seat", "window"));

        UserContext context = client.findContext("user-2").orElseThrow();

        assertThat(context.hasActiveTrip()).isFalse();
        assertThat(context.preferences()).containsEntry("seat", "window");
    }
}
