package org.zeno.compiler.frontend.parser.ast;

import org.zeno.compiler.frontend.lexer.StringEscapes;
import org.zeno.compiler.model.Token;

import java.util.List;

/**
 * AST node for {@code import { a, b as c } from "path"}.
 *
 * @param token   The {@code import} keyword.
 * @param path    The string literal token holding the module path.
 * @param symbols The imported symbols in source order.
 */
public record ImportStatement(Token token, Token path, List<ImportedSymbol> symbols) implements Statement {

    public ImportStatement {
        symbols = List.copyOf(symbols);
    }

    /**
     * Returns the module path with quotes removed and escapes processed.
     * @return The module path, e.g. {@code std/fmt} or {@code ./util}.
     */
    public String modulePath() {
        return StringEscapes.unquote(path.text());
    }

    /**
     * One entry in the brace list of an import.
     *
     * @param name  The name exported by the module.
     * @param alias The local alias token, or null if the symbol is not renamed.
     */
    public record ImportedSymbol(Token name, Token alias) {

        /**
         * Returns the name by which the symbol is referenced in the importing file.
         * @return The effective local name.
         */
        public String localName() {
            return alias != null ? alias.text() : name.text();
        }

        /**
         * Returns the token that introduces the local name.
         * @return The alias token if present, otherwise the name token.
         */
        public Token localToken() {
            return alias != null ? alias : name;
        }
    }
}
