package com.travelmesh.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Uses {@link InMemorySpanExporter} directly for reliable span collection in nested classes.
 */
@DisplayName("SpanHelper")
class SpanHelperTest {

    private InMemorySpanExporter spanExporter;
    private SpanHelper spanHelper;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        OpenTelemetrySdk sdk = OpenTelemetrySdk.builder().setTracerProvider(tracerProvider).build();
        spanHelper = new SpanHelper(sdk.getTracer("test-tracer"));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
        spanExporter.reset();
    }

    @Test
    @DisplayName("should reject null tracer")
    void shouldRejectNullTracer() {
        assertThatThrownBy(() -> new SpanHelper(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tracer");
    }

    @Nested
    @DisplayName("inSpan")
    class InSpan {

        @Test
        @DisplayName("should return the result and end an OK span")
        void shouldCreateSpan() {
            String result = spanHelper.inSpan("chat", () -> "done");

            assertThat(result).isEqualTo("done");
            assertThat(spanExporter.getFinishedSpanItems()).hasSize(1);
            SpanData span = spanExporter.getFinishedSpanItems().get(0);
            assertThat(span.getName()).isEqualTo("chat");
            assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
        }

        @Test
        @DisplayName("should attach correlation id and caller identities")
        void shouldAttachCorrelation() {
            CorrelationContextHolder.set(CorrelationContext.of("corr-9").withCaller("hotel-agent", "travel-planner"));

            spanHelper.inSpan("invoke", SpanKind.SERVER, Map.of("travelmesh.domain", "lodging"), () -> 1);

            SpanData span = spanExporter.getFinishedSpanItems().get(0);
            assertThat(span.getKind()).isEqualTo(SpanKind.SERVER);
            assertThat(span.getAttributes().get(AttributeKey.stringKey(SpanHelper.ATTR_CORRELATION_ID)))
                    .isEqualTo("corr-9");
            assertThat(span.getAttributes().get(AttributeKey.stringKey(SpanHelper.ATTR_CALLER)))
                    .isEqualTo("hotel-agent");
            assertThat(span.getAttributes().get(AttributeKey.stringKey(SpanHelper.ATTR_ON_BEHALF_OF)))
                    .isEqualTo("travel-planner");
            assertThat(span.getAttributes().get(AttributeKey.stringKey("travelmesh.domain"))).isEqualTo("lodging");
        }

        @Test
        @DisplayName("should record mid-span annotations on the active span")
        void shouldAnnotateCurrent() {
            spanHelper.inSpan("chat", () -> {
                SpanHelper.annotateCurrent("travelmesh.intent", "search");
                return null;
            });

            SpanData span = spanExporter.getFinishedSpanItems().get(0);
            assertThat(span.getAttributes().get(AttributeKey.stringKey("travelmesh.intent"))).isEqualTo("search");
        }

        @Test
        @DisplayName("should mark the span as error and rethrow")
        void shouldRecordError() {
            assertThatThrownBy(() -> spanHelper.inSpan("chat", () -> {
                throw new IllegalStateException("agent down");
            })).isInstanceOf(IllegalStateException.class).hasMessage("agent down");

            SpanData span = spanExporter.getFinishedSpanItems().get(0);
            assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
            assertThat(span.getEvents()).anyMatch(e -> e.getName().equals("exception"));
        }
    }
}
