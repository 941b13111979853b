package org.zeno.compiler.frontend.parser;

import org.zeno.compiler.diagnostics.DiagnosticsEngine;
import org.zeno.compiler.frontend.lexer.Lexer;
import org.zeno.compiler.frontend.parser.ast.AstNode;
import org.zeno.compiler.frontend.parser.ast.Program;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies that printed source re-parses to a tree of the same shape.
 */
public class SourcePrinterTest {

    private static final String PROGRAM = String.join("\n",
            "import { println, print as show } from \"std/fmt\"",
            "import { Helper } from \"./util\"",
            "",
            "pub fn Sum(a: int, ...rest: int): int {",
            "    return a",
            "}",
            "",
            "fn main() {",
            "    let x = 2 * (3 + 4)",
            "    mut y = 10 - (4 - 3) % 2",
            "    let mut z: float = -(1.5 + 2.0)",
            "    if x > 3 && !(y == 2) {",
            "        println(\"big\\n\", x)",
            "    } else if y != 0 || false {",
            "        show(y)",
            "    } else {",
            "        { y = y + 1; }",
            "    }",
            "    while y < 100 { y = y * 2 }",
            "    return",
            "}");

    private static Program parse(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Program program = new Parser(new Lexer(source, "test.zeno"), diagnostics).parse();
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        return program;
    }

    /**
     * Describes the node kinds of a tree, ignoring tokens and positions.
     */
    private static String shape(AstNode node) {
        String children = node.getChildren().stream().map(SourcePrinterTest::shape).collect(Collectors.joining(","));
        return node.getClass().getSimpleName() + "(" + children + ")";
    }

    @Test
    @Tag("unit")
    void reprintedProgramHasSameShape() {
        Program original = parse(PROGRAM);
        Program reparsed = parse(SourcePrinter.print(original));

        assertThat(shape(reparsed)).isEqualTo(shape(original));
        assertThat(SourcePrinter.print(reparsed)).isEqualTo(SourcePrinter.print(original));
    }

    @Test
    @Tag("unit")
    void printsOnlyNecessaryParentheses() {
        Program program = parse("let a = (2 * 3) + 4\nlet b = 2 * (3 + 4)\nlet c = (10 - 4) - 3\nlet d = 10 - (4 - 3)");

        assertThat(SourcePrinter.print(program)).isEqualTo(String.join("\n",
                "let a = 2 * 3 + 4",
                "let b = 2 * (3 + 4)",
                "let c = 10 - 4 - 3",
                "let d = 10 - (4 - 3)",
                ""));
    }

    @Test
    @Tag("unit")
    void printsFloatsAndStringsAsValidLiterals() {
        Program program = parse("let f = 2.0\nlet s = \"say \\\"hi\\\"\"");

        assertThat(SourcePrinter.print(program)).isEqualTo("let f = 2.0\nlet s = \"say \\\"hi\\\"\"\n");
    }
}
