package com.travelmesh.grpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Struct;
import com.google.protobuf.util.JsonFormat;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between {@link Struct} (the tool argument/result payload on the wire) and plain
 * {@code Map<String, Object>} (what tools and agents work with), going through JSON.
 * <p>
 * Struct has a single number type, so integers come back as {@link Double}.
 */
public final class StructCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final JsonFormat.Printer printer = JsonFormat.printer().omittingInsignificantWhitespace();
    private final JsonFormat.Parser parser = JsonFormat.parser();

    public StructCodec(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper must not be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IllegalArgumentException if the map holds values JSON cannot represent
     */
    public Struct toStruct(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return Struct.getDefaultInstance();
        }
        try {
            Struct.Builder builder = Struct.newBuilder();
            parser.merge(objectMapper.writeValueAsString(values), builder);
            return builder.build();
        } catch (JsonProcessingException | InvalidProtocolBufferException e) {
            throw new IllegalArgumentException("Payload is not representable as a Struct", e);
        }
    }

    /** Returns a mutable map; an absent struct yields an empty map. */
    public Map<String, Object> toMap(Struct struct) {
        if (struct == null || struct.getFieldsCount() == 0) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(printer.print(struct), MAP_TYPE);
        } catch (JsonProcessingException | InvalidProtocolBufferException e) {
            throw new IllegalArgumentException("Struct could not be converted to a map", e);
        }
    }
}
