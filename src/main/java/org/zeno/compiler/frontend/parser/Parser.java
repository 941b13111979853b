package org.zeno.compiler.frontend.parser;

import org.zeno.compiler.diagnostics.DiagnosticsEngine;
import org.zeno.compiler.diagnostics.Messages;
import org.zeno.compiler.frontend.lexer.Lexer;
import org.zeno.compiler.frontend.lexer.StringEscapes;
import org.zeno.compiler.frontend.parser.ast.AssignmentStatement;
import org.zeno.compiler.frontend.parser.ast.BinaryExpression;
import org.zeno.compiler.frontend.parser.ast.BinaryOperator;
import org.zeno.compiler.frontend.parser.ast.Block;
import org.zeno.compiler.frontend.parser.ast.BooleanLiteral;
import org.zeno.compiler.frontend.parser.ast.Expression;
import org.zeno.compiler.frontend.parser.ast.ExpressionStatement;
import org.zeno.compiler.frontend.parser.ast.FloatLiteral;
import org.zeno.compiler.frontend.parser.ast.FunctionCall;
import org.zeno.compiler.frontend.parser.ast.Identifier;
import org.zeno.compiler.frontend.parser.ast.IntegerLiteral;
import org.zeno.compiler.frontend.parser.ast.Precedence;
import org.zeno.compiler.frontend.parser.ast.Program;
import org.zeno.compiler.frontend.parser.ast.Statement;
import org.zeno.compiler.frontend.parser.ast.StringLiteral;
import org.zeno.compiler.frontend.parser.ast.UnaryExpression;
import org.zeno.compiler.frontend.parser.ast.UnaryOperator;
import org.zeno.compiler.model.Token;
import org.zeno.compiler.model.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;

/**
 * Builds a {@link Program} from the token stream of a {@link Lexer}.
 *
 * <p>Statements are parsed by recursive descent, with keyword statements dispatched through a
 * {@link StatementParserRegistry}; expressions use precedence climbing over {@link Precedence}.
 * Errors are reported to the {@link DiagnosticsEngine} and parsing resumes at the next statement
 * boundary, so one pass reports as many independent defects as possible.
 *
 * <p>Semicolons are optional. Outside of parentheses an expression does not continue onto a new
 * line: an operator at the start of a line begins a new statement.
 */
public class Parser implements ParsingContext {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private final Lexer lexer;
    private final DiagnosticsEngine diagnostics;
    private final StatementParserRegistry registry;
    private final LinkedList<Token> lookahead = new LinkedList<>();

    private Token previous;
    private int consumed = 0;
    private int parenDepth = 0;

    public Parser(Lexer lexer, DiagnosticsEngine diagnostics) {
        this.lexer = lexer;
        this.diagnostics = diagnostics;
        this.registry = StatementParserRegistry.initialize();
    }

    /**
     * Parses the entire input.
     * @return The program; statements that failed to parse are omitted.
     */
    public Program parse() {
        List<Statement> statements = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.SEMICOLON)) continue;
            int start = consumed;
            Statement statement = statement();
            if (statement != null) {
                statements.add(statement);
            } else {
                synchronize(start);
            }
        }
        log.debug("Parsed {} top-level statements from {}", statements.size(), lexer.getFileName());
        return new Program(lexer.getFileName(), statements);
    }

    private Statement statement() {
        Token start = peek();
        Optional<IStatementParser> keywordParser = registry.get(start.type());
        Statement statement;
        if (keywordParser.isPresent()) {
            statement = keywordParser.get().parse(this);
        } else if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ASSIGN)) {
            statement = assignment();
        } else {
            Expression expression = expression(Precedence.LOWEST);
            statement = expression == null ? null : new ExpressionStatement(start, expression);
        }
        if (statement != null) {
            match(TokenType.SEMICOLON);
        }
        return statement;
    }

    private Statement assignment() {
        Token name = advance();
        advance(); // '='
        Expression value = expression(Precedence.LOWEST);
        return value == null ? null : new AssignmentStatement(name, value);
    }

    @Override
    public Block block() {
        Token open = consume(TokenType.LBRACE);
        if (open == null) return null;

        int outerDepth = parenDepth;
        parenDepth = 0;
        try {
            List<Statement> statements = new ArrayList<>();
            while (!check(TokenType.RBRACE)) {
                if (isAtEnd()) {
                    diagnostics.reportError(Messages.UNCLOSED_BLOCK, peek());
                    return null;
                }
                if (match(TokenType.SEMICOLON)) continue;
                int start = consumed;
                Statement statement = statement();
                if (statement != null) {
                    statements.add(statement);
                } else {
                    synchronize(start);
                }
            }
            advance(); // '}'
            return new Block(open, statements);
        } finally {
            parenDepth = outerDepth;
        }
    }

    // === Expressions ===

    @Override
    public Expression expression(Precedence precedence) {
        Expression left = prefix();
        if (left == null) return null;

        while (continuesExpression() && precedence.compareTo(peekPrecedence()) < 0) {
            Token operatorToken = advance();
            BinaryOperator operator = BinaryOperator.fromToken(operatorToken.type()).orElseThrow();
            Expression right = expression(operator.precedence());
            if (right == null) return null;
            left = new BinaryExpression(operatorToken, left, operator, right);
        }
        return left;
    }

    private Expression prefix() {
        Token token = peek();
        switch (token.type()) {
            case IDENTIFIER -> {
                advance();
                if (check(TokenType.LPAREN) && continuesExpression()) {
                    return call(token);
                }
                return new Identifier(token);
            }
            case INT -> {
                advance();
                try {
                    return new IntegerLiteral(token, Long.parseLong(token.text()));
                } catch (NumberFormatException e) {
                    diagnostics.reportError(Messages.INVALID_INTEGER, token, token.text());
                    return null;
                }
            }
            case FLOAT -> {
                advance();
                try {
                    return new FloatLiteral(token, Double.parseDouble(token.text()));
                } catch (NumberFormatException e) {
                    diagnostics.reportError(Messages.INVALID_FLOAT, token, token.text());
                    return null;
                }
            }
            case STRING -> {
                advance();
                return new StringLiteral(token, StringEscapes.unquote(token.text()));
            }
            case TRUE, FALSE -> {
                advance();
                return new BooleanLiteral(token, token.type() == TokenType.TRUE);
            }
            case MINUS, BANG -> {
                advance();
                UnaryOperator operator = UnaryOperator.fromToken(token.type()).orElseThrow();
                Expression operand = expression(Precedence.PREFIX);
                return operand == null ? null : new UnaryExpression(token, operator, operand);
            }
            case LPAREN -> {
                return grouped();
            }
            case ILLEGAL -> {
                diagnostics.reportError(Messages.ILLEGAL_TOKEN, token, token.text());
                advance();
                return null;
            }
            default -> {
                diagnostics.reportError(Messages.NO_PREFIX_PARSE, token, token.type().display());
                return null;
            }
        }
    }

    private Expression grouped() {
        advance(); // '('
        parenDepth++;
        try {
            Expression inner = expression(Precedence.LOWEST);
            if (inner == null || consume(TokenType.RPAREN) == null) return null;
            return inner;
        } finally {
            parenDepth--;
        }
    }

    private Expression call(Token callee) {
        advance(); // '('
        parenDepth++;
        try {
            List<Expression> arguments = new ArrayList<>();
            if (!check(TokenType.RPAREN)) {
                do {
                    Expression argument = expression(Precedence.LOWEST);
                    if (argument == null) return null;
                    arguments.add(argument);
                } while (match(TokenType.COMMA));
            }
            if (consume(TokenType.RPAREN) == null) return null;
            return new FunctionCall(callee, arguments);
        } finally {
            parenDepth--;
        }
    }

    private Precedence peekPrecedence() {
        return BinaryOperator.fromToken(peek().type())
                .map(BinaryOperator::precedence)
                .orElse(Precedence.LOWEST);
    }

    private boolean continuesExpression() {
        return parenDepth > 0 || previous == null || peek().line() <= endLine(previous);
    }

    // === Error recovery ===

    private void synchronize(int startCount) {
        if (consumed == startCount && !isAtEnd()) {
            advance();
        }
        while (!isAtEnd()) {
            if (previous.type() == TokenType.SEMICOLON) return;
            if (check(TokenType.RBRACE)) return;
            if (peek().line() > endLine(previous)) return;
            advance();
        }
    }

    private static int endLine(Token token) {
        int line = token.line();
        String text = token.text();
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') line++;
        }
        return line;
    }

    // === ParsingContext ===

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        return peek().type() == type;
    }

    @Override
    public boolean checkNext(TokenType type) {
        return lookahead(1).type() == type;
    }

    @Override
    public Token advance() {
        Token current = peek();
        if (current.type() != TokenType.EOF) {
            lookahead.removeFirst();
            consumed++;
        }
        previous = current;
        return current;
    }

    @Override
    public Token peek() {
        return lookahead(0);
    }

    @Override
    public Token previous() {
        return previous;
    }

    @Override
    public Token consume(TokenType type) {
        if (check(type)) return advance();
        Token actual = peek();
        diagnostics.reportError(Messages.EXPECTED_TOKEN, actual, type.display(), actual.type().display());
        return null;
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public boolean isAtEnd() {
        return check(TokenType.EOF);
    }

    private Token lookahead(int index) {
        while (lookahead.size() <= index) {
            lookahead.addLast(lexer.nextToken());
        }
        return lookahead.get(index);
    }
}
