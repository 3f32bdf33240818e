package com.travelmesh.orchestrator.domain.intent;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DestinationExtractor")
class DestinationExtractorTest {

    private final DestinationExtractor extractor = new DestinationExtractor();

    @Test
    @DisplayName("known cities are found regardless of case")
    void knownCity() {
        assertThat(extractor.extract("plan a trip to new york in june")).isEqualTo("New York");
        assertThat(extractor.extract("Going to San Francisco")).isEqualTo("San Francisco");
    }

    @Test
    @DisplayName("unlisted places are taken from travel phrases")
    void phrase() {
        assertThat(extractor.extract("Plan a trip to Reykjavik")).isEqualTo("Reykjavik");
        assertThat(extractor.extract("I'd love to visit Cape Town")).isEqualTo("Cape Town");
    }

    @Test
    @DisplayName("no destination yields Unknown")
    void unknown() {
        assertThat(extractor.extract("plan a new trip")).isEqualTo(DestinationExtractor.UNKNOWN);
        assertThat(extractor.extract("  ")).isEqualTo(DestinationExtractor.UNKNOWN);
        assertThat(extractor.extract(null)).isEqualTo(DestinationExtractor.UNKNOWN);
    }
}
