package com.travelmesh.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Test
    @DisplayName("should redact guest contact details in tool arguments")
    void shouldRedactContactDetails() {
        Map<String, Object> arguments = Map.of(
                "hotel_id", "H-MIA-01",
                "guest_email", "ana@example.com",
                "guest_phone", "+1 305 555 0100");

        Map<String, Object> redacted = redactor.redact(arguments);

        assertThat(redacted)
                .containsEntry("hotel_id", "H-MIA-01")
                .containsEntry("guest_email", SensitiveDataRedactor.REDACTED)
                .containsEntry("guest_phone", SensitiveDataRedactor.REDACTED);
    }

    @Test
    @DisplayName("should walk nested maps and lists")
    void shouldRedactNested() {
        Map<String, Object> payload = Map.of(
                "passengers", List.of(Map.of("name", "Ana", "passport_number", "X123")),
                "payment", Map.of("card_number", "4111"));

        Map<String, Object> redacted = redactor.redact(payload);

        assertThat(redacted.get("passengers")).isEqualTo(
                List.of(Map.of("name", "Ana", "passport_number", SensitiveDataRedactor.REDACTED)));
        assertThat(redacted.get("payment")).isEqualTo(Map.of("card_number", SensitiveDataRedactor.REDACTED));
    }

    @Test
    @DisplayName("should match case-insensitively")
    void shouldMatchCaseInsensitively() {
        assertThat(redactor.isSensitive("Authorization")).isTrue();
        assertThat(redactor.isSensitive("refresh_token")).isTrue();
        assertThat(redactor.isSensitive("apiKey")).isTrue();
        assertThat(redactor.isSensitive(null)).isFalse();
    }

    @Test
    @DisplayName("should return an empty map for null input")
    void shouldHandleNull() {
        assertThat(redactor.redact(null)).isEmpty();
    }

    @Test
    @DisplayName("should support custom patterns")
    void shouldSupportCustomPatterns() {
        var custom = new SensitiveDataRedactor(Set.of("loyalty"));

        assertThat(custom.redact(Map.of("loyalty_number", "L-1", "city", "Miami")))
                .containsEntry("loyalty_number", SensitiveDataRedactor.REDACTED)
                .containsEntry("city", "Miami");
        assertThatThrownBy(() -> new SensitiveDataRedactor(Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
