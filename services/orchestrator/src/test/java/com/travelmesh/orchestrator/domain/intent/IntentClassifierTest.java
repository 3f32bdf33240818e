package com.travelmesh.orchestrator.domain.intent;

import static org.assertj.core.api.Assertions.assertThat;

import com.travelmesh.agentapi.Domain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("IntentClassifier")
class IntentClassifierTest {

    private final IntentClassifier classifier = new IntentClassifier();

    @Test
    @DisplayName("a hotel search is dispatched to lodging")
    void hotelSearch() {
        Intent intent = classifier.classify("Find hotels in Miami", false);

        assertThat(intent.type()).isEqualTo(IntentType.SEARCH);
        assertThat(intent.domain()).isEqualTo(Domain.LODGING);
        assertThat(intent.route()).isEqualTo(Route.DISPATCH);
        assertThat(intent.confidence()).isEqualTo(IntentClassifier.KEYWORD_CONFIDENCE);
        assertThat(intent.addsToActiveTrip()).isFalse();
    }

    @Test
    @DisplayName("questions about the caller's own trip are answered from context")
    void itineraryQuery() {
        Intent intent = classifier.classify("What's on my itinerary?", true);

        assertThat(intent.type()).isEqualTo(IntentType.QUERY);
        assertThat(intent.route()).isEqualTo(Route.ITINERARY_QUERY);
    }

    @Test
    @DisplayName("trip phrases create a trip whatever the domain")
    void tripCreation() {
        Intent intent = classifier.classify("I want to go to Paris next month", false);

        assertThat(intent.type()).isEqualTo(IntentType.CREATE);
        assertThat(intent.route()).isEqualTo(Route.TRIP_CREATION);
    }

    @Test
    @DisplayName("booking with an active trip adds to that trip")
    void bookingWithActiveTrip() {
        Intent intent = classifier.classify("Book hotel HTL-MIA-1", true);

        assertThat(intent.type()).isEqualTo(IntentType.CREATE);
        assertThat(intent.domain()).isEqualTo(Domain.LODGING);
        assertThat(intent.addsToActiveTrip()).isTrue();
    }

    @Test
    @DisplayName("booking without a trip is still dispatched")
    void bookingWithoutTrip() {
        Intent intent = classifier.classify("Book flight FL100", false);

        assertThat(intent.type()).isEqualTo(IntentType.CREATE);
        assertThat(intent.route()).isEqualTo(Route.DISPATCH);
        assertThat(intent.addsToActiveTrip()).isFalse();
    }

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource({
            "Cancel my rental car,CANCEL,VEHICLES",
            "Change the flight to Friday,MODIFY,FLIGHTS",
            "Search flights from JFK to LAX,SEARCH,FLIGHTS",
            "List rental cars in Denver,SEARCH,VEHICLES"
    })
    void typeAndDomain(String message, IntentType type, Domain domain) {
        Intent intent = classifier.classify(message, false);

        assertThat(intent.type()).isEqualTo(type);
        assertThat(intent.domain()).isEqualTo(domain);
    }

    @Test
    @DisplayName("keywords match at word starts only")
    void wordStarts() {
        assertThat(IntentClassifier.domainOf("i have a scar")).isEqualTo(Domain.NONE);
        assertThat(IntentClassifier.domainOf("cheap hotels")).isEqualTo(Domain.LODGING);
    }

    @Test
    @DisplayName("travel words without a domain ask which domain to start with")
    void travelWithoutDomain() {
        Intent vacation = classifier.classify("I'm dreaming of a long vacation", false);
        Intent journey = classifier.classify("Help me organise a journey", true);

        assertThat(vacation.route()).isEqualTo(Route.MULTI_DOMAIN);
        assertThat(vacation.domain()).isEqualTo(Domain.NONE);
        assertThat(journey.route()).isEqualTo(Route.MULTI_DOMAIN);
        assertThat(classifier.classify("Plan a trip to Paris", false).route()).isEqualTo(Route.TRIP_CREATION);
        assertThat(classifier.classify("Find a hotel for my vacation", false).route()).isEqualTo(Route.DISPATCH);
    }

    @Test
    @DisplayName("messages without keywords get general help at low confidence")
    void unknown() {
        Intent intent = classifier.classify("hello there", false);

        assertThat(intent.type()).isEqualTo(IntentType.UNKNOWN);
        assertThat(intent.domain()).isEqualTo(Domain.NONE);
        assertThat(intent.route()).isEqualTo(Route.GENERAL);
        assertThat(intent.confidence()).isEqualTo(IntentClassifier.FALLBACK_CONFIDENCE);
    }
}
