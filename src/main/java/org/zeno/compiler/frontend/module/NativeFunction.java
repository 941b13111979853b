package org.zeno.compiler.frontend.module;

import org.zeno.compiler.model.ZenoType;

/**
 * A standard-library function implemented by the runtime bridge.
 *
 * @param name          The name under which the function is imported.
 * @param bridgeMethod  The static method of the runtime bridge class that implements it.
 * @param requiredArgs  The number of mandatory arguments.
 * @param variadic      Whether further arguments are accepted.
 * @param returnType    The result type, or null if the function returns nothing.
 */
public record NativeFunction(String name, String bridgeMethod, int requiredArgs, boolean variadic, ZenoType returnType) {

    static NativeFunction fixed(String name, String bridgeMethod, int arity, ZenoType returnType) {
        return new NativeFunction(name, bridgeMethod, arity, false, returnType);
    }

    static NativeFunction variadic(String name, String bridgeMethod, int requiredArgs) {
        return new NativeFunction(name, bridgeMethod, requiredArgs, true, null);
    }
}
