package org.zeno.compiler.frontend.parser;

import org.zeno.compiler.diagnostics.DiagnosticsEngine;
import org.zeno.compiler.frontend.lexer.Lexer;
import org.zeno.compiler.frontend.parser.ast.AssignmentStatement;
import org.zeno.compiler.frontend.parser.ast.BinaryExpression;
import org.zeno.compiler.frontend.parser.ast.BinaryOperator;
import org.zeno.compiler.frontend.parser.ast.Block;
import org.zeno.compiler.frontend.parser.ast.ExpressionStatement;
import org.zeno.compiler.frontend.parser.ast.FunctionCall;
import org.zeno.compiler.frontend.parser.ast.FunctionDefinition;
import org.zeno.compiler.frontend.parser.ast.IfStatement;
import org.zeno.compiler.frontend.parser.ast.ImportStatement;
import org.zeno.compiler.frontend.parser.ast.IntegerLiteral;
import org.zeno.compiler.frontend.parser.ast.LetDeclaration;
import org.zeno.compiler.frontend.parser.ast.Program;
import org.zeno.compiler.frontend.parser.ast.ReturnStatement;
import org.zeno.compiler.frontend.parser.ast.StringLiteral;
import org.zeno.compiler.frontend.parser.ast.UnaryExpression;
import org.zeno.compiler.frontend.parser.ast.UnaryOperator;
import org.zeno.compiler.frontend.parser.ast.WhileStatement;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests statement parsing, expression precedence and error recovery of the {@link Parser}.
 */
public class ParserTest {

    private DiagnosticsEngine diagnostics;

    private Program parse(String source) {
        diagnostics = new DiagnosticsEngine();
        return new Parser(new Lexer(source, "test.zeno"), diagnostics).parse();
    }

    private Program parseValid(String source) {
        Program program = parse(source);
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        return program;
    }

    @Test
    @Tag("unit")
    void multiplicationBindsTighterThanAddition() {
        LetDeclaration let = (LetDeclaration) parseValid("let x = 2 * 3 + 4").statements().get(0);

        BinaryExpression sum = (BinaryExpression) let.value();
        assertThat(sum.operator()).isEqualTo(BinaryOperator.ADD);
        assertThat(sum.left()).isInstanceOf(BinaryExpression.class);
        assertThat(((BinaryExpression) sum.left()).operator()).isEqualTo(BinaryOperator.MULTIPLY);
        assertThat(sum.right()).isInstanceOf(IntegerLiteral.class);
    }

    @Test
    @Tag("unit")
    void parenthesesOverridePrecedence() {
        LetDeclaration let = (LetDeclaration) parseValid("let x = 2 * (3 + 4)").statements().get(0);

        BinaryExpression product = (BinaryExpression) let.value();
        assertThat(product.operator()).isEqualTo(BinaryOperator.MULTIPLY);
        assertThat(((BinaryExpression) product.right()).operator()).isEqualTo(BinaryOperator.ADD);
    }

    @Test
    @Tag("unit")
    void logicalAndEqualityFollowPrecedenceLadder() {
        LetDeclaration let = (LetDeclaration) parseValid("let ok = a < b == c && d || !e").statements().get(0);

        BinaryExpression or = (BinaryExpression) let.value();
        assertThat(or.operator()).isEqualTo(BinaryOperator.OR);
        BinaryExpression and = (BinaryExpression) or.left();
        assertThat(and.operator()).isEqualTo(BinaryOperator.AND);
        BinaryExpression eq = (BinaryExpression) and.left();
        assertThat(eq.operator()).isEqualTo(BinaryOperator.EQ);
        assertThat(((BinaryExpression) eq.left()).operator()).isEqualTo(BinaryOperator.LT);
        assertThat(((UnaryExpression) or.right()).operator()).isEqualTo(UnaryOperator.NOT);
    }

    @Test
    @Tag("unit")
    void subtractionIsLeftAssociative() {
        LetDeclaration let = (LetDeclaration) parseValid("let x = 10 - 4 - 3").statements().get(0);

        BinaryExpression outer = (BinaryExpression) let.value();
        assertThat(outer.left()).isInstanceOf(BinaryExpression.class);
        assertThat(outer.right()).isInstanceOf(IntegerLiteral.class);
    }

    @Test
    @Tag("unit")
    void semicolonsAreOptional() {
        Program program = parseValid("let a = 1; let b = 2\nlet c = 3;");

        assertThat(program.statements()).hasSize(3).allMatch(LetDeclaration.class::isInstance);
    }

    @Test
    @Tag("unit")
    void expressionEndsAtLineBreak() {
        Program program = parseValid("let a = 1\n-2");

        assertThat(program.statements()).hasSize(2);
        assertThat(((LetDeclaration) program.statements().get(0)).value()).isInstanceOf(IntegerLiteral.class);
        ExpressionStatement second = (ExpressionStatement) program.statements().get(1);
        assertThat(second.expression()).isInstanceOf(UnaryExpression.class);
    }

    @Test
    @Tag("unit")
    void expressionContinuesAcrossLinesInsideParentheses() {
        Program program = parseValid("let a = (1\n+ 2)\nprintln(a,\n  3)");

        assertThat(((LetDeclaration) program.statements().get(0)).value()).isInstanceOf(BinaryExpression.class);
        FunctionCall call = (FunctionCall) ((ExpressionStatement) program.statements().get(1)).expression();
        assertThat(call.name()).isEqualTo("println");
        assertThat(call.arguments()).hasSize(2);
    }

    @Test
    @Tag("unit")
    void parsesDeclarationKinds() {
        Program program = parseValid("let a = 1\nmut b = 2\nlet mut c: int = 3\nb = 4");

        LetDeclaration a = (LetDeclaration) program.statements().get(0);
        LetDeclaration b = (LetDeclaration) program.statements().get(1);
        LetDeclaration c = (LetDeclaration) program.statements().get(2);
        assertThat(a.mutable()).isFalse();
        assertThat(b.mutable()).isTrue();
        assertThat(c.mutable()).isTrue();
        assertThat(c.type().text()).isEqualTo("int");
        assertThat(program.statements().get(3)).isInstanceOf(AssignmentStatement.class);
    }

    @Test
    @Tag("unit")
    void parsesPublicFunctionWithTypedParameters() {
        Program program = parseValid("pub fn Add(a: int, b: int): int {\n  return a + b\n}");

        FunctionDefinition fn = program.functions().get(0);
        assertThat(fn.isPublic()).isTrue();
        assertThat(fn.name().text()).isEqualTo("Add");
        assertThat(fn.parameters()).extracting(p -> p.name().text()).containsExactly("a", "b");
        assertThat(fn.returnType().text()).isEqualTo("int");
        ReturnStatement ret = (ReturnStatement) fn.body().statements().get(0);
        assertThat(ret.value()).isInstanceOf(BinaryExpression.class);
    }

    @Test
    @Tag("unit")
    void bareReturnHasNoValue() {
        Program program = parseValid("fn stop() {\n  return\n}");

        ReturnStatement ret = (ReturnStatement) program.functions().get(0).body().statements().get(0);
        assertThat(ret.value()).isNull();
    }

    @Test
    @Tag("unit")
    void parsesVariadicLastParameter() {
        Program program = parseValid("fn log(prefix: string, ...rest: any) {}");

        FunctionDefinition fn = program.functions().get(0);
        assertThat(fn.isVariadic()).isTrue();
        assertThat(fn.parameters().get(1).variadic()).isTrue();
    }

    @Test
    @Tag("unit")
    void parsesImportWithAlias() {
        Program program = parseValid("import { readFile as read, writeFile } from \"std/io\"");

        ImportStatement imp = program.imports().get(0);
        assertThat(imp.modulePath()).isEqualTo("std/io");
        assertThat(imp.symbols()).extracting(ImportStatement.ImportedSymbol::localName)
                .containsExactly("read", "writeFile");
    }

    @Test
    @Tag("unit")
    void parsesElseIfChainsAndLoops() {
        Program program = parseValid("if a { x() } else if b { y() } else { z() }\nwhile n > 0 { n = n - 1 }");

        IfStatement ifs = (IfStatement) program.statements().get(0);
        IfStatement elseIf = (IfStatement) ifs.alternative();
        assertThat(elseIf.alternative()).isInstanceOf(Block.class);
        WhileStatement loop = (WhileStatement) program.statements().get(1);
        assertThat(loop.body().statements()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void processesStringEscapesInLiterals() {
        LetDeclaration let = (LetDeclaration) parseValid("let s = \"a\\tb\"").statements().get(0);

        assertThat(((StringLiteral) let.value()).value()).isEqualTo("a\tb");
    }

    @Test
    @Tag("unit")
    void accumulatesErrorsAndRecovers() {
        Program program = parse("let = 5\nlet y = \nlet z = 3");

        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.errorMessages(false)).hasSize(2);
        assertThat(diagnostics.errorMessages(false).get(0))
                .isEqualTo("test.zeno:1:5: expected next token to be IDENT, got = instead");
        assertThat(diagnostics.errorMessages(false).get(1)).contains("no prefix parse function for let found");
        assertThat(program.statements()).hasSize(1);
        assertThat(((LetDeclaration) program.statements().get(0)).name().text()).isEqualTo("z");
    }

    @Test
    @Tag("unit")
    void reportsIllegalTokens() {
        parse("let x = 1 & 2");

        assertThat(diagnostics.errorMessages(false)).isNotEmpty();
        assertThat(String.join("\n", diagnostics.errorMessages(false))).contains("illegal token '&'");
    }

    @Test
    @Tag("unit")
    void rejectsVariadicParameterBeforeLast() {
        parse("fn f(...a: int, b: int) {}");

        assertThat(diagnostics.errorMessages(false))
                .anyMatch(m -> m.contains("variadic parameter must be the last parameter"));
    }

    @Test
    @Tag("unit")
    void rejectsPubWithoutFunction() {
        Program program = parse("pub let x = 1\nlet y = 2");

        assertThat(diagnostics.errorMessages(false))
                .containsExactly("test.zeno:1:1: pub can only be used with function definitions");
        assertThat(program.statements()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void reportsUnclosedBlock() {
        parse("fn main() {\n  let x = 1\n");

        assertThat(diagnostics.errorMessages(false)).anyMatch(m -> m.contains("expected '}' to close block"));
    }

    @Test
    @Tag("unit")
    void nodesCarrySourcePositions() {
        Program program = parseValid("\n  let value = 1");

        LetDeclaration let = (LetDeclaration) program.statements().get(0);
        assertThat(let.getLine()).isEqualTo(2);
        assertThat(let.getColumn()).isEqualTo(3);
        assertThat(let.getSourceFileName()).isEqualTo("test.zeno");
    }
}
