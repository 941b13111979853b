package org.zeno.compiler.frontend.semantics;

import org.zeno.compiler.model.Token;
import org.zeno.compiler.model.ZenoType;

/**
 * Represents a named entity in a scope.
 *
 * @param name    The token that declares the symbol.
 * @param kind    What the name denotes.
 * @param type    The value type, or {@link ZenoType#UNRESOLVED} when not annotated.
 * @param mutable Whether the binding may be re-assigned.
 */
public record Symbol(Token name, Kind kind, ZenoType type, boolean mutable) {

    /**
     * The kinds of symbols.
     */
    public enum Kind {
        VARIABLE,
        PARAMETER,
        FUNCTION,
        IMPORT
    }

    public String text() {
        return name.text();
    }

    public boolean isLocal() {
        return kind == Kind.VARIABLE || kind == Kind.PARAMETER;
    }
}
