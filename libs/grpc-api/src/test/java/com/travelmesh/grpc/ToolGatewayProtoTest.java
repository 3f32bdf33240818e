package com.travelmesh.grpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.protobuf.Struct;
import com.travelmesh.gateway.v1.InvocationOutcome;
import com.travelmesh.gateway.v1.InvokeToolRequest;
import com.travelmesh.gateway.v1.InvokeToolResponse;
import com.travelmesh.gateway.v1.ToolGatewayServiceGrpc;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies the generated tool gateway messages and the Struct codec.
 */
@DisplayName("Tool gateway proto")
class ToolGatewayProtoTest {

    private final StructCodec codec = new StructCodec(new ObjectMapper());

    @Nested
    @DisplayName("Messages")
    class Messages {

        @Test
        @DisplayName("should expose the fully-qualified method names used as enforcement paths")
        void shouldExposeMethodNames() {
            assertThat("/" + ToolGatewayServiceGrpc.getInvokeToolMethod().getFullMethodName())
                    .isEqualTo("/travelmesh.gateway.v1.ToolGatewayService/InvokeTool");
            assertThat("/" + ToolGatewayServiceGrpc.getListToolsMethod().getFullMethodName())
                    .isEqualTo("/travelmesh.gateway.v1.ToolGatewayService/ListTools");
        }

        @Test
        @DisplayName("should default to an empty session and unspecified outcome")
        void shouldDefault() {
            var request = InvokeToolRequest.newBuilder().setToolName("search_hotels").build();
            var response = InvokeToolResponse.getDefaultInstance();

            assertThat(request.getSessionId()).isEmpty();
            assertThat(request.hasArguments()).isFalse();
            assertThat(response.getOutcome()).isEqualTo(InvocationOutcome.INVOCATION_OUTCOME_UNSPECIFIED);
        }
    }

    @Nested
    @DisplayName("StructCodec")
    class Codec {

        @Test
        @DisplayName("should carry nested arguments through a Struct")
        void shouldCarryNested() {
            Map<String, Object> arguments = new LinkedHashMap<>();
            arguments.put("city", "Miami");
            arguments.put("guests", 2);
            arguments.put("amenities", List.of("pool", "wifi"));
            arguments.put("filters", Map.of("max_price", 300.5, "refundable", true));

            Map<String, Object> back = codec.toMap(codec.toStruct(arguments));

            assertThat(back.get("city")).isEqualTo("Miami");
            assertThat(back.get("guests")).isEqualTo(2.0);
            assertThat(back.get("amenities")).isEqualTo(List.of("pool", "wifi"));
            assertThat(back.get("filters")).isEqualTo(Map.of("max_price", 300.5, "refundable", true));
        }

        @Test
        @DisplayName("should map empty and null payloads to empty values")
        void shouldHandleEmpty() {
            assertThat(codec.toStruct(null)).isEqualTo(Struct.getDefaultInstance());
            assertThat(codec.toMap(null)).isEmpty();
            assertThat(codec.toMap(Struct.getDefaultInstance())).isEmpty();
        }

        @Test
        @DisplayName("should keep null values as JSON nulls")
        void shouldKeepNulls() {
            Map<String, Object> arguments = new LinkedHashMap<>();
            arguments.put("return_date", null);

            assertThat(codec.toMap(codec.toStruct(arguments))).containsEntry("return_date", null);
        }
    }
}
