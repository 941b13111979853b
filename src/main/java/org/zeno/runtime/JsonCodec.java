package org.zeno.runtime;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.Strictness;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between JSON text and {@link JsonValue} using Gson's streaming and tree APIs.
 */
public final class JsonCodec {

    private static final TypeAdapter<JsonElement> ELEMENTS = new Gson().getAdapter(JsonElement.class);

    private JsonCodec() {}

    /**
     * Parses a JSON document as defined by RFC 8259. Unquoted strings or names, trailing commas,
     * empty input and content after the document are rejected.
     * @param text The JSON document.
     * @return The parsed value.
     * @throws ZenoPanicException if the text is not valid JSON.
     */
    public static JsonValue parse(String text) {
        try (JsonReader reader = new JsonReader(new StringReader(text))) {
            reader.setStrictness(Strictness.STRICT);
            JsonElement element = ELEMENTS.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new ZenoPanicException("invalid JSON: unexpected content after the document at " + reader.getPath());
            }
            return fromElement(element);
        } catch (IOException | JsonParseException e) {
            throw new ZenoPanicException("invalid JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Serializes a value as compact JSON. Integral numbers are written without a fraction.
     * @param value The value.
     * @return The JSON text.
     */
    public static String stringify(JsonValue value) {
        StringWriter out = new StringWriter();
        try (JsonWriter writer = new JsonWriter(out)) {
            writer.setSerializeNulls(true);
            write(writer, value);
        } catch (IOException e) {
            throw new ZenoPanicException("failed to serialize JSON", e);
        }
        return out.toString();
    }

    private static JsonValue fromElement(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return JsonValue.JsonNull.INSTANCE;
        }
        if (element.isJsonPrimitive()) {
            JsonPrimitive primitive = element.getAsJsonPrimitive();
            if (primitive.isBoolean()) return new JsonValue.JsonBool(primitive.getAsBoolean());
            if (primitive.isNumber()) return new JsonValue.JsonNumber(primitive.getAsDouble());
            return new JsonValue.JsonString(primitive.getAsString());
        }
        if (element.isJsonArray()) {
            JsonArray array = element.getAsJsonArray();
            List<JsonValue> items = new ArrayList<>(array.size());
            for (JsonElement item : array) {
                items.add(fromElement(item));
            }
            return new JsonValue.JsonList(items);
        }
        Map<String, JsonValue> members = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
            members.put(entry.getKey(), fromElement(entry.getValue()));
        }
        return new JsonValue.JsonObject(members);
    }

    private static void write(JsonWriter writer, JsonValue value) throws IOException {
        if (value instanceof JsonValue.JsonNull) {
            writer.nullValue();
        } else if (value instanceof JsonValue.JsonBool b) {
            writer.value(b.value());
        } else if (value instanceof JsonValue.JsonNumber n) {
            writeNumber(writer, n.value());
        } else if (value instanceof JsonValue.JsonString s) {
            writer.value(s.value());
        } else if (value instanceof JsonValue.JsonList list) {
            writer.beginArray();
            for (JsonValue item : list.items()) {
                write(writer, item);
            }
            writer.endArray();
        } else if (value instanceof JsonValue.JsonObject object) {
            writer.beginObject();
            for (Map.Entry<String, JsonValue> entry : object.members().entrySet()) {
                writer.name(entry.getKey());
                write(writer, entry.getValue());
            }
            writer.endObject();
        }
    }

    private static void writeNumber(JsonWriter writer, double d) throws IOException {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new ZenoPanicException("JSON cannot represent " + d);
        }
        if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            writer.value((long) d);
        } else {
            writer.value(d);
        }
    }
}
