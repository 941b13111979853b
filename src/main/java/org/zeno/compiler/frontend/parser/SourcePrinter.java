package org.zeno.compiler.frontend.parser;

import org.zeno.compiler.frontend.lexer.StringEscapes;
import org.zeno.compiler.frontend.parser.ast.AssignmentStatement;
import org.zeno.compiler.frontend.parser.ast.BinaryExpression;
import org.zeno.compiler.frontend.parser.ast.Block;
import org.zeno.compiler.frontend.parser.ast.BooleanLiteral;
import org.zeno.compiler.frontend.parser.ast.Expression;
import org.zeno.compiler.frontend.parser.ast.ExpressionStatement;
import org.zeno.compiler.frontend.parser.ast.FloatLiteral;
import org.zeno.compiler.frontend.parser.ast.FunctionCall;
import org.zeno.compiler.frontend.parser.ast.FunctionDefinition;
import org.zeno.compiler.frontend.parser.ast.Identifier;
import org.zeno.compiler.frontend.parser.ast.IfStatement;
import org.zeno.compiler.frontend.parser.ast.ImportStatement;
import org.zeno.compiler.frontend.parser.ast.IntegerLiteral;
import org.zeno.compiler.frontend.parser.ast.LetDeclaration;
import org.zeno.compiler.frontend.parser.ast.Parameter;
import org.zeno.compiler.frontend.parser.ast.Program;
import org.zeno.compiler.frontend.parser.ast.ReturnStatement;
import org.zeno.compiler.frontend.parser.ast.Statement;
import org.zeno.compiler.frontend.parser.ast.StringLiteral;
import org.zeno.compiler.frontend.parser.ast.UnaryExpression;
import org.zeno.compiler.frontend.parser.ast.WhileStatement;

import java.math.BigDecimal;
import java.util.stream.Collectors;

/**
 * Prints an AST back as Zeno source. The output re-parses to a tree of the same shape;
 * formatting and comments of the original text are not preserved.
 */
public final class SourcePrinter {

    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    private SourcePrinter() {}

    public static String print(Program program) {
        SourcePrinter printer = new SourcePrinter();
        for (Statement statement : program.statements()) {
            printer.statement(statement);
        }
        return printer.out.toString();
    }

    public static String print(Expression expression) {
        return new SourcePrinter().expression(expression);
    }

    private void statement(Statement statement) {
        if (statement instanceof ImportStatement imp) {
            String names = imp.symbols().stream()
                    .map(s -> s.alias() == null ? s.name().text() : s.name().text() + " as " + s.alias().text())
                    .collect(Collectors.joining(", "));
            line("import { " + names + " } from " + StringEscapes.toZenoLiteral(imp.modulePath()));
        } else if (statement instanceof FunctionDefinition fn) {
            String params = fn.parameters().stream().map(this::parameter).collect(Collectors.joining(", "));
            String header = (fn.isPublic() ? "pub " : "") + "fn " + fn.name().text() + "(" + params + ")"
                    + (fn.returnType() != null ? ": " + fn.returnType().text() : "");
            openBlock(header);
            body(fn.body());
        } else if (statement instanceof LetDeclaration let) {
            String keyword = let.mutable() ? "let mut " : "let ";
            String type = let.type() != null ? ": " + let.type().text() : "";
            line(keyword + let.name().text() + type + " = " + expression(let.value()));
        } else if (statement instanceof AssignmentStatement assign) {
            line(assign.name().text() + " = " + expression(assign.value()));
        } else if (statement instanceof ReturnStatement ret) {
            line(ret.value() == null ? "return" : "return " + expression(ret.value()));
        } else if (statement instanceof ExpressionStatement expr) {
            line(expression(expr.expression()));
        } else if (statement instanceof IfStatement ifs) {
            ifChain(ifs, "if ");
        } else if (statement instanceof WhileStatement loop) {
            openBlock("while " + expression(loop.condition()));
            body(loop.body());
        } else if (statement instanceof Block block) {
            openBlock("");
            body(block);
        }
    }

    private void ifChain(IfStatement ifs, String prefix) {
        openBlock(prefix + expression(ifs.condition()));
        depth++;
        ifs.consequence().statements().forEach(this::statement);
        depth--;
        if (ifs.alternative() instanceof IfStatement nested) {
            ifChain(nested, "} else if ");
        } else if (ifs.alternative() instanceof Block block) {
            line("} else {");
            body(block);
        } else {
            line("}");
        }
    }

    private void openBlock(String header) {
        line(header.isEmpty() ? "{" : header + " {");
    }

    private void body(Block block) {
        depth++;
        block.statements().forEach(this::statement);
        depth--;
        line("}");
    }

    private String parameter(Parameter p) {
        return (p.variadic() ? "..." : "") + p.name().text() + (p.type() != null ? ": " + p.type().text() : "");
    }

    private String expression(Expression expression) {
        if (expression instanceof Identifier id) {
            return id.name();
        } else if (expression instanceof IntegerLiteral i) {
            return Long.toString(i.value());
        } else if (expression instanceof FloatLiteral f) {
            return floatLiteral(f.value());
        } else if (expression instanceof StringLiteral s) {
            return StringEscapes.toZenoLiteral(s.value());
        } else if (expression instanceof BooleanLiteral b) {
            return Boolean.toString(b.value());
        } else if (expression instanceof UnaryExpression unary) {
            String operand = expression(unary.operand());
            boolean group = unary.operand() instanceof BinaryExpression || unary.operand() instanceof UnaryExpression;
            return unary.operator().symbol() + (group ? "(" + operand + ")" : operand);
        } else if (expression instanceof BinaryExpression binary) {
            return operand(binary, binary.left(), false) + " " + binary.operator().symbol() + " "
                    + operand(binary, binary.right(), true);
        } else if (expression instanceof FunctionCall call) {
            return call.name() + "(" + call.arguments().stream().map(this::expression)
                    .collect(Collectors.joining(", ")) + ")";
        }
        throw new IllegalStateException("Unhandled expression: " + expression.getClass().getSimpleName());
    }

    private static String floatLiteral(double value) {
        String text = BigDecimal.valueOf(value).toPlainString();
        return text.contains(".") ? text : text + ".0";
    }

    private String operand(BinaryExpression parent, Expression operand, boolean right) {
        String text = expression(operand);
        return parent.operator().requiresGrouping(operand, right) ? "(" + text + ")" : text;
    }

    private void line(String text) {
        out.append(INDENT.repeat(depth)).append(text).append('\n');
    }
}
