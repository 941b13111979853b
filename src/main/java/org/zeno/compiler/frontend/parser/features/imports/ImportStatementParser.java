package org.zeno.compiler.frontend.parser.features.imports;

import org.zeno.compiler.frontend.parser.IStatementParser;
import org.zeno.compiler.frontend.parser.ParsingContext;
import org.zeno.compiler.frontend.parser.ast.ImportStatement;
import org.zeno.compiler.frontend.parser.ast.Statement;
import org.zeno.compiler.model.Token;
import org.zeno.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses an import statement.
 *
 * <p>Syntax: {@code import { name [as alias], ... } from "path"}
 *
 * <p>This parser only produces the {@link ImportStatement}; resolving the path against the
 * standard library or a sibling file happens during generation.
 */
public class ImportStatementParser implements IStatementParser {

    @Override
    public Statement parse(ParsingContext context) {
        Token keyword = context.advance(); // consume 'import'

        if (context.consume(TokenType.LBRACE) == null) return null;

        List<ImportStatement.ImportedSymbol> symbols = new ArrayList<>();
        if (!context.check(TokenType.RBRACE)) {
            do {
                Token name = context.consume(TokenType.IDENTIFIER);
                if (name == null) return null;
                Token alias = null;
                if (context.match(TokenType.AS)) {
                    alias = context.consume(TokenType.IDENTIFIER);
                    if (alias == null) return null;
                }
                symbols.add(new ImportStatement.ImportedSymbol(name, alias));
            } while (context.match(TokenType.COMMA));
        }

        if (context.consume(TokenType.RBRACE) == null) return null;
        if (context.consume(TokenType.FROM) == null) return null;

        Token path = context.consume(TokenType.STRING);
        if (path == null) return null;

        return new ImportStatement(keyword, path, symbols);
    }
}
