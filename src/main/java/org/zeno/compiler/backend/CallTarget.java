package org.zeno.compiler.backend;

import org.zeno.compiler.model.ZenoType;

import java.util.List;

/**
 * What a call to a Zeno name compiles to.
 *
 * @param javaName       The (possibly qualified) Java method to invoke.
 * @param parameterTypes The declared types of the fixed parameters, used for coercion; may be
 *                       shorter than {@code requiredArgs} when not known.
 * @param requiredArgs   The number of mandatory arguments.
 * @param variadic       Whether additional arguments are accepted.
 * @param returnType     The result type, or null for no result.
 */
record CallTarget(String javaName, List<ZenoType> parameterTypes, int requiredArgs, boolean variadic,
                  ZenoType returnType) {

    CallTarget {
        parameterTypes = List.copyOf(parameterTypes);
    }

    ZenoType parameterType(int index) {
        return index < parameterTypes.size() ? parameterTypes.get(index) : ZenoType.UNRESOLVED;
    }
}
