package org.zeno.compiler.backend;

import java.util.Set;

/**
 * Maps Zeno identifiers to legal Java identifiers.
 */
final class JavaNames {

    private static final Set<String> RESERVED = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
            "for", "goto", "implements", "import", "instanceof", "int", "interface", "long", "native", "new",
            "package", "private", "protected", "public", "short", "static", "strictfp", "super", "switch",
            "synchronized", "this", "throw", "throws", "transient", "try", "void", "volatile", "null",
            "true", "false", "var", "yield", "record", "sealed", "permits", "_",
            // Object methods a static method must not hide
            "getClass", "hashCode", "equals", "toString", "notify", "notifyAll", "wait", "clone", "finalize",
            // names the generated code refers to, which a local of the same name would obscure
            "java", "JsonValue", "ZenoRuntime");

    private JavaNames() {}

    static String identifier(String zenoName) {
        return RESERVED.contains(zenoName) ? zenoName + "_" : zenoName;
    }

    /**
     * Derives an UpperCamelCase class name from a file name, e.g. {@code math_utils.zeno} to
     * {@code MathUtils}.
     */
    static String className(String fileName) {
        String base = fileName.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        int dot = base.indexOf('.');
        if (dot > 0) base = base.substring(0, dot);

        StringBuilder sb = new StringBuilder();
        boolean upper = true;
        for (char c : base.toCharArray()) {
            if (!Character.isLetterOrDigit(c)) {
                upper = true;
            } else if (upper) {
                sb.append(Character.toUpperCase(c));
                upper = false;
            } else {
                sb.append(c);
            }
        }
        if (sb.length() == 0 || !Character.isJavaIdentifierStart(sb.charAt(0))) {
            sb.insert(0, "Module");
        }
        return sb.toString();
    }
}
