package org.zeno.compiler.frontend.module;

import org.zeno.compiler.model.ZenoType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed table of {@code std/...} modules and the bridge primitives each one exports.
 */
public final class StandardLibrary {

    public static final String STD_PREFIX = "std/";

    private static final Map<String, Map<String, NativeFunction>> MODULES = new LinkedHashMap<>();

    static {
        define("std/fmt",
                NativeFunction.variadic("print", "print", 1),
                NativeFunction.variadic("println", "println", 1));
        define("std/io",
                NativeFunction.fixed("readFile", "readFile", 1, ZenoType.STRING),
                NativeFunction.fixed("writeFile", "writeFile", 2, null),
                NativeFunction.fixed("remove", "remove", 1, null),
                NativeFunction.fixed("getCurrentDirectory", "getCurrentDirectory", 0, ZenoType.STRING));
        define("std/json",
                NativeFunction.fixed("parse", "parseJson", 1, ZenoType.ANY),
                NativeFunction.fixed("stringify", "stringifyJson", 1, ZenoType.STRING));
        define("std/os",
                NativeFunction.fixed("panic", "panic", 1, null),
                NativeFunction.fixed("exit", "exit", 1, null));
    }

    private StandardLibrary() {}

    private static void define(String path, NativeFunction... functions) {
        Map<String, NativeFunction> exports = new LinkedHashMap<>();
        for (NativeFunction function : functions) {
            exports.put(function.name(), function);
        }
        MODULES.put(path, Map.copyOf(exports));
    }

    public static boolean isStandardPath(String path) {
        return path.startsWith(STD_PREFIX);
    }

    /**
     * Looks up a standard-library module.
     * @param path The import path, e.g. {@code std/fmt}.
     * @return The exported functions by name, or empty if no such module exists.
     */
    public static Optional<Map<String, NativeFunction>> module(String path) {
        return Optional.ofNullable(MODULES.get(path));
    }

    /**
     * Finds a bridge primitive by its exported name across all modules. Used for direct
     * {@code __native_<name>} calls.
     * @param name The exported name, e.g. {@code readFile}.
     * @return The primitive, or empty if none has that name.
     */
    public static Optional<NativeFunction> primitive(String name) {
        return MODULES.values().stream()
                .map(exports -> exports.get(name))
                .filter(f -> f != null)
                .findFirst();
    }

    public static List<String> modulePaths() {
        return List.copyOf(MODULES.keySet());
    }
}
