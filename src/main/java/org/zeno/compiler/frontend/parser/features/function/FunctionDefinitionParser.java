package org.zeno.compiler.frontend.parser.features.function;

import org.zeno.compiler.diagnostics.Messages;
import org.zeno.compiler.frontend.parser.IStatementParser;
import org.zeno.compiler.frontend.parser.ParsingContext;
import org.zeno.compiler.frontend.parser.ast.Block;
import org.zeno.compiler.frontend.parser.ast.FunctionDefinition;
import org.zeno.compiler.frontend.parser.ast.Parameter;
import org.zeno.compiler.frontend.parser.ast.Statement;
import org.zeno.compiler.model.Token;
import org.zeno.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a function definition, optionally prefixed with {@code pub}.
 *
 * <p>Syntax: {@code [pub] fn name(p: type, ...rest: type): returnType { body }}
 */
public class FunctionDefinitionParser implements IStatementParser {

    @Override
    public Statement parse(ParsingContext context) {
        Token start = context.peek();
        boolean isPublic = context.match(TokenType.PUB);
        if (isPublic && !context.check(TokenType.FN)) {
            context.getDiagnostics().reportError(Messages.PUB_WITHOUT_FN, start);
            return null;
        }
        if (context.consume(TokenType.FN) == null) return null;

        Token name = context.consume(TokenType.IDENTIFIER);
        if (name == null) return null;

        List<Parameter> parameters = parameters(context);
        if (parameters == null) return null;

        Token returnType = null;
        if (context.match(TokenType.COLON)) {
            returnType = context.consume(TokenType.IDENTIFIER);
            if (returnType == null) return null;
        }

        Block body = context.block();
        if (body == null) return null;

        return new FunctionDefinition(start, name, isPublic, parameters, returnType, body);
    }

    private List<Parameter> parameters(ParsingContext context) {
        if (context.consume(TokenType.LPAREN) == null) return null;

        List<Parameter> parameters = new ArrayList<>();
        if (!context.check(TokenType.RPAREN)) {
            do {
                boolean variadic = context.match(TokenType.ELLIPSIS);
                Token name = context.consume(TokenType.IDENTIFIER);
                if (name == null) return null;
                Token type = null;
                if (context.match(TokenType.COLON)) {
                    type = context.consume(TokenType.IDENTIFIER);
                    if (type == null) return null;
                }
                parameters.add(new Parameter(name, type, variadic));
            } while (context.match(TokenType.COMMA));
        }
        if (context.consume(TokenType.RPAREN) == null) return null;

        for (int i = 0; i < parameters.size() - 1; i++) {
            if (parameters.get(i).variadic()) {
                context.getDiagnostics().reportError(Messages.VARIADIC_NOT_LAST, parameters.get(i).name());
                return null;
            }
        }
        return parameters;
    }
}
