package org.zeno.compiler.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The value types of the Zeno language and their Java counterparts.
 */
public enum ZenoType {
    INT("int", "long", true),
    FLOAT("float", "double", true),
    BOOL("bool", "boolean", true),
    STRING("string", "String", false),
    ANY("any", "JsonValue", false),
    /** Placeholder for unannotated bindings whose type is not known. */
    UNRESOLVED("?", "var", false);

    private final String zenoName;
    private final String javaName;
    private final boolean primitive;

    ZenoType(String zenoName, String javaName, boolean primitive) {
        this.zenoName = zenoName;
        this.javaName = javaName;
        this.primitive = primitive;
    }

    public String zenoName() {
        return zenoName;
    }

    public String javaName() {
        return javaName;
    }

    /**
     * Whether values of this type compare with {@code ==} in Java.
     * @return true for int, float and bool.
     */
    public boolean isPrimitive() {
        return primitive;
    }

    /**
     * Looks up a type by the name used in annotations.
     * @param name The annotation text, e.g. {@code int}.
     * @return The type, or empty if the name is not a Zeno type.
     */
    public static Optional<ZenoType> fromName(String name) {
        return Arrays.stream(values())
                .filter(t -> t != UNRESOLVED && t.zenoName.equals(name))
                .findFirst();
    }
}
