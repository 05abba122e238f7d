package io.github.vishalmysore.cloudslash.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single value in a resource's property bag. Scanners attach heterogeneous
 * data to nodes (states, sizes, flags, launch times, tag maps); each value
 * carries its {@link Kind} so consumers can read it back without casting.
 */
@EqualsAndHashCode
public final class PropertyValue {

    public enum Kind {
        STRING,
        NUMBER,
        BOOLEAN,
        TIMESTAMP,
        STRING_LIST,
        STRING_MAP
    }

    @Getter
    private final Kind kind;
    // Exactly one of these is set, matching kind
    private final String stringValue;
    private final Double numberValue;
    private final Boolean booleanValue;
    private final Instant timestampValue;
    private final List<String> listValue;
    private final Map<String, String> mapValue;

    private PropertyValue(Kind kind, String stringValue, Double numberValue, Boolean booleanValue,
                          Instant timestampValue, List<String> listValue, Map<String, String> mapValue) {
        this.kind = kind;
        this.stringValue = stringValue;
        this.numberValue = numberValue;
        this.booleanValue = booleanValue;
        this.timestampValue = timestampValue;
        this.listValue = listValue;
        this.mapValue = mapValue;
    }

    public static PropertyValue of(String value) {
        Objects.requireNonNull(value, "value");
        return new PropertyValue(Kind.STRING, value, null, null, null, null, null);
    }

    public static PropertyValue of(double value) {
        return new PropertyValue(Kind.NUMBER, null, value, null, null, null, null);
    }

    public static PropertyValue of(boolean value) {
        return new PropertyValue(Kind.BOOLEAN, null, null, value, null, null, null);
    }

    public static PropertyValue of(Instant value) {
        Objects.requireNonNull(value, "value");
        return new PropertyValue(Kind.TIMESTAMP, null, null, null, value, null, null);
    }

    public static PropertyValue of(List<String> value) {
        return new PropertyValue(Kind.STRING_LIST, null, null, null, null, List.copyOf(value), null);
    }

    public static PropertyValue of(Map<String, String> value) {
        return new PropertyValue(Kind.STRING_MAP, null, null, null, null, null,
                Collections.unmodifiableMap(new LinkedHashMap<>(value)));
    }

    public Optional<String> asString() {
        return Optional.ofNullable(stringValue);
    }

    public Optional<Double> asNumber() {
        return Optional.ofNullable(numberValue);
    }

    public Optional<Boolean> asBoolean() {
        return Optional.ofNullable(booleanValue);
    }

    public Optional<Instant> asTimestamp() {
        return Optional.ofNullable(timestampValue);
    }

    public Optional<List<String>> asStringList() {
        return Optional.ofNullable(listValue);
    }

    public Optional<Map<String, String>> asStringMap() {
        return Optional.ofNullable(mapValue);
    }

    /**
     * Raw value as written to JSON. Timestamps are rendered as ISO-8601.
     */
    @JsonValue
    public Object toJsonValue() {
        switch (kind) {
            case STRING:
                return stringValue;
            case NUMBER:
                return numberValue;
            case BOOLEAN:
                return booleanValue;
            case TIMESTAMP:
                return timestampValue.toString();
            case STRING_LIST:
                return listValue;
            default:
                return mapValue;
        }
    }

    @Override
    public String toString() {
        return String.valueOf(toJsonValue());
    }
}
