package org.zeno.compiler.frontend.parser;

import org.zeno.compiler.frontend.parser.features.control.BlockStatementParser;
import org.zeno.compiler.frontend.parser.features.control.IfStatementParser;
import org.zeno.compiler.frontend.parser.features.control.WhileStatementParser;
import org.zeno.compiler.frontend.parser.features.function.FunctionDefinitionParser;
import org.zeno.compiler.frontend.parser.features.imports.ImportStatementParser;
import org.zeno.compiler.frontend.parser.features.let.LetDeclarationParser;
import org.zeno.compiler.frontend.parser.features.ret.ReturnStatementParser;
import org.zeno.compiler.model.TokenType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry for keyword-introduced statements.
 * Maps the introducing token type (e.g. {@code let}, {@code fn}) to its parser.
 */
public class StatementParserRegistry {

    private final Map<TokenType, IStatementParser> parsers = new EnumMap<>(TokenType.class);

    /**
     * Registers a parser for a keyword.
     * @param keyword The token type that introduces the statement.
     * @param parser  The parser for this statement.
     */
    public void register(TokenType keyword, IStatementParser parser) {
        parsers.put(keyword, parser);
    }

    /**
     * Looks up the parser for a keyword.
     * @param keyword The token type.
     * @return The parser, or empty if the token does not introduce a keyword statement.
     */
    public Optional<IStatementParser> get(TokenType keyword) {
        return Optional.ofNullable(parsers.get(keyword));
    }

    /**
     * Creates a registry with all built-in statement parsers.
     * @return A new registry instance.
     */
    public static StatementParserRegistry initialize() {
        StatementParserRegistry registry = new StatementParserRegistry();
        LetDeclarationParser let = new LetDeclarationParser();
        FunctionDefinitionParser function = new FunctionDefinitionParser();
        registry.register(TokenType.IMPORT, new ImportStatementParser());
        registry.register(TokenType.FN, function);
        registry.register(TokenType.PUB, function);
        registry.register(TokenType.LET, let);
        registry.register(TokenType.MUT, let);
        registry.register(TokenType.RETURN, new ReturnStatementParser());
        registry.register(TokenType.IF, new IfStatementParser());
        registry.register(TokenType.WHILE, new WhileStatementParser());
        registry.register(TokenType.LBRACE, new BlockStatementParser());
        return registry;
    }
}
