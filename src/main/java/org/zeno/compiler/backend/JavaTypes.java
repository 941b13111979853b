package org.zeno.compiler.backend;

import org.zeno.compiler.diagnostics.Messages;
import org.zeno.compiler.model.Token;
import org.zeno.compiler.model.ZenoType;

/**
 * Resolves type annotations and maps Zeno types to Java type names.
 */
final class JavaTypes {

    private JavaTypes() {}

    /**
     * Resolves an annotation token.
     * @param annotation The type token, or null if the annotation was omitted.
     * @return The type, or {@link ZenoType#UNRESOLVED} when omitted.
     * @throws GenerationException if the name is not a Zeno type.
     */
    static ZenoType resolve(Token annotation) {
        if (annotation == null) {
            return ZenoType.UNRESOLVED;
        }
        return ZenoType.fromName(annotation.text())
                .orElseThrow(() -> new GenerationException(Messages.UNKNOWN_TYPE, annotation, annotation.text()));
    }

    static String javaName(ZenoType type) {
        return type.javaName();
    }
}
