package com.travelmesh.gateway.domain.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view over the arguments of one tool call.
 *
 * <p>Values arrive from a protobuf Struct, so numbers are doubles; whole numbers read back as
 * integers ("2", not "2.0").
 */
public final class ToolArguments {

    private final Map<String, Object> values;

    public ToolArguments(Map<String, ?> values) {
        this.values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /** First required argument that is absent or blank, if any. */
    public Optional<String> firstMissing(List<String> required) {
        return required.stream().filter(name -> text(name).isEmpty()).findFirst();
    }

    public Optional<String> text(String name) {
        Object value = values.get(name);
        if (value == null) {
            return Optional.empty();
        }
        String text = value instanceof Number number ? render(number) : value.toString();
        return text.isBlank() ? Optional.empty() : Optional.of(text.trim());
    }

    /** Value of an argument validated as required. */
    public String required(String name) {
        return text(name).orElseThrow(() -> new IllegalStateException("argument not validated: " + name));
    }

    /**
     * @throws IllegalArgumentException if the value is present but not a whole number
     */
    public int integer(String name, int defaultValue) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("argument '%s' is not a whole number".formatted(name), e);
        }
    }

    /** Raw value, as received. */
    public Object raw(String name) {
        return values.get(name);
    }

    /** The subset of arguments with the given names, absent ones skipped. */
    public Map<String, Object> select(List<String> names) {
        Map<String, Object> selected = new LinkedHashMap<>();
        for (String name : names) {
            Object value = values.get(name);
            if (value != null) {
                selected.put(name, value);
            }
        }
        return selected;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private static String render(Number number) {
        double d = number.doubleValue();
        if (d == Math.rint(d) && !Double.isInfinite(d)) {
            return Long.toString((long) d);
        }
        return number.toString();
    }
}
