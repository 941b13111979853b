package org.zeno.compiler.api;

import org.zeno.compiler.frontend.semantics.Issue;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests of the compiler facade.
 */
public class ZenoCompilerTest {

    @TempDir
    Path tempDir;

    private static final String SAMPLE = String.join("\n",
            "import { println } from \"std/fmt\"",
            "let x = 10; let unused = 42; let y = x + 5; println(y)");

    @Test
    @Tag("integration")
    void compilesProgramAndReportsIssues() {
        CompilationResult result = new ZenoCompiler(CompilerOptions.defaults()).compile(SAMPLE, "main.zeno");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.javaSource()).contains("public final class Main {", "ZenoRuntime.println(y);");
        assertThat(result.issues()).extracting(Issue::format)
                .containsExactly("main.zeno:2:17: [unused-variable] Variable 'unused' is declared but not used.");
    }

    @Test
    @Tag("integration")
    void parseErrorsStopBeforeGeneration() {
        CompilationResult result = new ZenoCompiler(CompilerOptions.defaults()).compile("let = 5\nlet y = 1", "main.zeno");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.javaSource()).isNull();
        assertThat(result.javaSourceIfPresent()).isEmpty();
        assertThat(result.errors()).containsExactly("main.zeno:1:5: expected next token to be IDENT, got = instead");
    }

    @Test
    @Tag("integration")
    void appendsJapaneseTextWhenEnabled() {
        ZenoCompiler compiler = new ZenoCompiler(CompilerOptions.defaults().withSecondaryDiagnostics(true));

        assertThat(compiler.compile("let = 5", "main.zeno").errors()).containsExactly(
                "main.zeno:1:5: expected next token to be IDENT, got = instead"
                        + "\n  (ja) 次のトークンは IDENT であるべきですが、= が見つかりました");
        assertThat(compiler.compile("fn main() { missing() }", "main.zeno").errors()).containsExactly(
                "Generation Error: main.zeno:1:13: Function 'missing' is not defined or imported"
                        + "\n  (ja) 関数 'missing' は定義もインポートもされていません");
    }

    @Test
    @Tag("integration")
    void generationErrorsKeepPrimaryTextByDefault() {
        CompilationResult result = new ZenoCompiler(CompilerOptions.defaults())
                .compile("fn main() { missing() }", "main.zeno");

        assertThat(result.errors()).containsExactly(
                "Generation Error: main.zeno:1:13: Function 'missing' is not defined or imported");
        assertThat(result.issues()).isEmpty();
    }

    @Test
    @Tag("integration")
    void issuesBecomeErrorsWhenConfigured() {
        CompilerOptions options = new CompilerOptions(false, "Main", "", true, List.of("unused-function"), ".zeno");

        CompilationResult result = new ZenoCompiler(options).compile("fn helper() {}\nfn main() {}", "main.zeno");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.javaSource()).isNull();
        assertThat(result.errors())
                .containsExactly("main.zeno:1:4: [unused-function] Function 'helper' is defined but not used.");
    }

    @Test
    @Tag("integration")
    void runsOnlyEnabledRules() {
        CompilerOptions options = new CompilerOptions(false, "Main", "", false, List.of("unused-import"), ".zeno");

        CompilationResult result = new ZenoCompiler(options).compile(SAMPLE, "main.zeno");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.issues()).isEmpty();
    }

    @Test
    @Tag("unit")
    void rejectsUnknownRuleNames() {
        CompilerOptions options = new CompilerOptions(false, "Main", "", false, List.of("no-tabs"), ".zeno");

        assertThatThrownBy(() -> new ZenoCompiler(options)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("integration")
    void compilesFileWithRelativeImport() throws IOException {
        Files.writeString(tempDir.resolve("greet.zeno"), String.join("\n",
                "import { println } from \"std/fmt\"",
                "pub fn Greet(name: string) { println(\"hello\", name) }"));
        Path main = tempDir.resolve("app.zeno");
        Files.writeString(main, "import { Greet } from \"./greet\"\nfn main() { Greet(\"zeno\") }\n");

        CompilationResult result = new ZenoCompiler(CompilerOptions.defaults().withClassName("App")).compileFile(main);

        assertThat(result.errors()).isEmpty();
        assertThat(result.javaSource()).contains(
                "// Code generated by zeno from app.zeno. DO NOT EDIT.",
                "public final class App {",
                "GreetModule.Greet(\"zeno\");",
                "public static void Greet(String name) {",
                "ZenoRuntime.println(\"hello\", name);");
    }
}
