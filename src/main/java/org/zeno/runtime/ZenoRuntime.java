package org.zeno.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.StringJoiner;

/**
 * The native primitives that generated programs call. Every primitive that can fail raises
 * {@link ZenoPanicException} with the underlying cause attached.
 */
public final class ZenoRuntime {

    private static final Logger log = LoggerFactory.getLogger(ZenoRuntime.class);

    private ZenoRuntime() {}

    // === std/fmt ===

    /**
     * Writes the arguments separated by single spaces, without a trailing newline.
     */
    public static void print(Object first, Object... rest) {
        System.out.print(join(first, rest));
        System.out.flush();
    }

    /**
     * Writes the arguments separated by single spaces, followed by a newline.
     */
    public static void println(Object first, Object... rest) {
        System.out.println(join(first, rest));
    }

    /**
     * Renders a value the way {@code print} shows it. Integral floats print without a fraction,
     * JSON values print as JSON.
     * @param value The value.
     * @return Its display text.
     */
    public static String format(Object value) {
        if (value == null) return "null";
        if (value instanceof Double d) return formatDouble(d);
        if (value instanceof Float f) return formatDouble(f.doubleValue());
        if (value instanceof JsonValue json) return JsonCodec.stringify(json);
        return value.toString();
    }

    private static String join(Object first, Object... rest) {
        StringJoiner joiner = new StringJoiner(" ");
        joiner.add(format(first));
        if (rest != null) {
            for (Object value : rest) {
                joiner.add(format(value));
            }
        }
        return joiner.toString();
    }

    private static String formatDouble(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return Double.toString(d);
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    /**
     * Decides whether a dynamic value counts as true in a condition. Null, false, zero and
     * empty strings, lists and objects are false.
     */
    public static boolean truthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0.0;
        if (value instanceof CharSequence s) return s.length() > 0;
        if (value instanceof JsonValue json) {
            if (json instanceof JsonValue.JsonNull) return false;
            if (json instanceof JsonValue.JsonBool b) return b.value();
            if (json instanceof JsonValue.JsonNumber n) return n.value() != 0.0;
            if (json instanceof JsonValue.JsonString s) return !s.value().isEmpty();
            if (json instanceof JsonValue.JsonList l) return !l.items().isEmpty();
            if (json instanceof JsonValue.JsonObject o) return !o.members().isEmpty();
        }
        return true;
    }

    // === std/os ===

    /**
     * Aborts the program with a message.
     * @param message The panic message.
     * @throws ZenoPanicException always.
     */
    public static void panic(String message) {
        throw new ZenoPanicException(message);
    }

    public static void exit(long code) {
        System.exit((int) code);
    }

    // === std/io ===

    public static String readFile(String path) {
        try {
            return Files.readString(Path.of(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ZenoPanicException("failed to read file " + path, e);
        }
    }

    public static void writeFile(String path, String content) {
        try {
            Files.writeString(Path.of(path), content, StandardCharsets.UTF_8);
            log.debug("Wrote {} characters to {}", content.length(), path);
        } catch (IOException e) {
            throw new ZenoPanicException("failed to write file " + path, e);
        }
    }

    public static void remove(String path) {
        try {
            Files.delete(Path.of(path));
        } catch (IOException e) {
            throw new ZenoPanicException("failed to remove " + path, e);
        }
    }

    public static String getCurrentDirectory() {
        return Path.of("").toAbsolutePath().toString();
    }

    // === std/json ===

    public static JsonValue parseJson(String text) {
        return JsonCodec.parse(text);
    }

    public static String stringifyJson(Object value) {
        return JsonCodec.stringify(JsonValue.of(value));
    }
}
