package org.zeno.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A dynamically typed value as exchanged with the JSON primitives. The set of variants is
 * closed; all variants are records and compare structurally.
 */
public sealed interface JsonValue
        permits JsonValue.JsonNull, JsonValue.JsonBool, JsonValue.JsonNumber, JsonValue.JsonString,
                JsonValue.JsonList, JsonValue.JsonObject {

    record JsonNull() implements JsonValue {
        public static final JsonNull INSTANCE = new JsonNull();
    }

    record JsonBool(boolean value) implements JsonValue {}

    record JsonNumber(double value) implements JsonValue {}

    record JsonString(String value) implements JsonValue {
        public JsonString {
            if (value == null) throw new IllegalArgumentException("value must not be null");
        }
    }

    /**
     * An ordered list of values.
     */
    record JsonList(List<JsonValue> items) implements JsonValue {
        public JsonList {
            items = List.copyOf(items);
        }
    }

    /**
     * A string-keyed map that keeps insertion order.
     */
    record JsonObject(Map<String, JsonValue> members) implements JsonValue {
        public JsonObject {
            members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
        }
    }

    /**
     * Converts a Java value produced by generated code into a {@link JsonValue}.
     * Accepts null, {@link Boolean}, {@link Number}, {@link CharSequence}, lists and object arrays
     * (variadic arguments), maps with string keys, and existing {@link JsonValue}s.
     *
     * @param value The value to convert.
     * @return The corresponding JSON value.
     * @throws ZenoPanicException if the value has no JSON representation.
     */
    static JsonValue of(Object value) {
        if (value == null) return JsonNull.INSTANCE;
        if (value instanceof JsonValue json) return json;
        if (value instanceof Boolean b) return new JsonBool(b);
        if (value instanceof Number n) return new JsonNumber(n.doubleValue());
        if (value instanceof CharSequence s) return new JsonString(s.toString());
        if (value instanceof Object[] array) {
            return of(Arrays.asList(array));
        }
        if (value instanceof List<?> list) {
            List<JsonValue> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(of(item));
            }
            return new JsonList(items);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, JsonValue> members = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new ZenoPanicException("JSON object keys must be strings, got " + entry.getKey());
                }
                members.put(key, of(entry.getValue()));
            }
            return new JsonObject(members);
        }
        throw new ZenoPanicException("Value of type " + value.getClass().getSimpleName() + " cannot be represented as JSON");
    }
}
