package org.zeno.compiler.backend;

import org.zeno.compiler.diagnostics.DiagnosticsEngine;
import org.zeno.compiler.frontend.lexer.Lexer;
import org.zeno.compiler.frontend.module.FileSystemModuleResolver;
import org.zeno.compiler.frontend.module.ModuleResolver;
import org.zeno.compiler.frontend.module.ResolvedModule;
import org.zeno.compiler.frontend.parser.Parser;
import org.zeno.compiler.frontend.parser.ast.Program;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests compilation of imported Zeno modules into nested classes.
 */
@ExtendWith(MockitoExtension.class)
public class ModuleGenerationTest {

    @TempDir
    Path tempDir;

    @Mock
    ModuleResolver resolver;

    private static Program parse(String source, String fileName) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Program program = new Parser(new Lexer(source, fileName), diagnostics).parse();
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        return program;
    }

    private static ResolvedModule.SourceModule source(String logicalName, String content) {
        return new ResolvedModule.SourceModule(logicalName, content);
    }

    @Test
    @Tag("integration")
    void compilesRelativeModuleFromDisk() throws IOException {
        Files.writeString(tempDir.resolve("math_utils.zeno"), String.join("\n",
                "pub fn Twice(x: int): int { return double(x) }",
                "fn double(x: int): int { return x * 2 }"));
        Path mainFile = tempDir.resolve("main.zeno");
        Program program = parse(String.join("\n",
                "import { println } from \"std/fmt\"",
                "import { Twice } from \"./math_utils\"",
                "fn main() { println(Twice(21)) }"), mainFile.toString());

        String java = new JavaGenerator(new FileSystemModuleResolver(".zeno"), "", "Main").generate(program);

        assertThat(java).contains(
                "ZenoRuntime.println(MathUtilsModule.Twice(21L));",
                "    static final class MathUtilsModule {",
                "        public static long Twice(long x) {",
                "            return double_(x);",
                "        private static long double_(long x) {");
    }

    @Test
    @Tag("unit")
    void moduleTopLevelStatementsRunInStaticInitializer() throws IOException {
        when(resolver.resolve(eq("./config"), anyString()))
                .thenReturn(Optional.of(source("/src/config.zeno",
                        "import { println } from \"std/fmt\"\nprintln(\"loading\")\npub fn Port(): int { return 8080 }")));
        when(resolver.resolve(eq("std/fmt"), anyString()))
                .thenReturn(new FileSystemModuleResolver(".zeno").resolve("std/fmt", "/src/config.zeno"));

        String java = new JavaGenerator(resolver, "", "Main")
                .generate(parse("import { Port } from \"./config\"\nfn main() { let p = Port() }", "/src/main.zeno"));

        assertThat(java).contains(
                "final long p = ConfigModule.Port();",
                "        static {",
                "            ZenoRuntime.println(\"loading\");",
                "        public static long Port() {");
    }

    @Test
    @Tag("unit")
    void privateModuleFunctionsAreNotExported() throws IOException {
        when(resolver.resolve(eq("./lib"), anyString()))
                .thenReturn(Optional.of(source("/src/lib.zeno", "fn hidden() {}")));

        assertThatThrownBy(() -> new JavaGenerator(resolver, "", "Main")
                .generate(parse("import { hidden } from \"./lib\"\nfn main() { hidden() }", "/src/main.zeno")))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("Function 'hidden' is not exported from module './lib'");
    }

    @Test
    @Tag("unit")
    void sharedModuleIsCompiledOnce() throws IOException {
        when(resolver.resolve(eq("./util"), anyString()))
                .thenReturn(Optional.of(source("/src/util.zeno", "pub fn One(): int { return 1 }\npub fn Two(): int { return 2 }")));

        String java = new JavaGenerator(resolver, "", "Main").generate(parse(String.join("\n",
                "import { One } from \"./util\"",
                "import { Two } from \"./util\"",
                "fn main() { let x = One() + Two() }"), "/src/main.zeno"));

        assertThat(java.split("static final class UtilModule \\{", -1)).hasSize(2);
        assertThat(java).contains("final long x = UtilModule.One() + UtilModule.Two();");
        verify(resolver, times(2)).resolve(eq("./util"), anyString());
    }

    @Test
    @Tag("unit")
    void distinctModulesWithSameFileNameGetDistinctClasses() throws IOException {
        when(resolver.resolve(eq("./a/util"), anyString()))
                .thenReturn(Optional.of(source("/src/a/util.zeno", "pub fn A(): int { return 1 }")));
        when(resolver.resolve(eq("./b/util"), anyString()))
                .thenReturn(Optional.of(source("/src/b/util.zeno", "pub fn B(): int { return 2 }")));

        String java = new JavaGenerator(resolver, "", "Main").generate(parse(String.join("\n",
                "import { A } from \"./a/util\"",
                "import { B } from \"./b/util\"",
                "fn main() { let x = A() + B() }"), "/src/main.zeno"));

        assertThat(java).contains("static final class UtilModule {", "static final class UtilModule2 {",
                "final long x = UtilModule.A() + UtilModule2.B();");
    }

    @Test
    @Tag("unit")
    void moduleClassNeverClashesWithOuterClass() throws IOException {
        when(resolver.resolve(eq("../lib/main"), anyString()))
                .thenReturn(Optional.of(source("/lib/main.zeno", "pub fn F(): int { return 1 }")));

        String java = new JavaGenerator(resolver, "", "MainModule").generate(parse(
                "import { F } from \"../lib/main\"\nfn main() { let x = F() }", "/src/main.zeno"));

        assertThat(java).contains("public final class MainModule {", "static final class MainModule2 {",
                "final long x = MainModule2.F();");
    }

    @Test
    @Tag("unit")
    void detectsCircularImports() throws IOException {
        when(resolver.resolve(eq("./a"), anyString()))
                .thenReturn(Optional.of(source("/x/a.zeno", "import { B } from \"./b\"\npub fn A() { B() }")));
        when(resolver.resolve(eq("./b"), anyString()))
                .thenReturn(Optional.of(source("/x/b.zeno", "import { A } from \"./a\"\npub fn B() { A() }")));

        assertThatThrownBy(() -> new JavaGenerator(resolver, "", "Main")
                .generate(parse("import { A } from \"./a\"\nfn main() { A() }", "/x/main.zeno")))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("circular import detected: /x/main.zeno -> /x/a.zeno -> /x/b.zeno -> /x/a.zeno");
    }

    @Test
    @Tag("unit")
    void reportsModuleParseErrors() throws IOException {
        when(resolver.resolve(eq("./broken"), anyString()))
                .thenReturn(Optional.of(source("/src/broken.zeno", "pub let x = 1")));

        assertThatThrownBy(() -> new JavaGenerator(resolver, "", "Main")
                .generate(parse("import { X } from \"./broken\"\nfn main() {}", "/src/main.zeno")))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("Parse errors in module /src/broken.zeno: /src/broken.zeno:1:1: pub can only be used with function definitions");
    }

    @Test
    @Tag("unit")
    void moduleParseErrorsKeepLocalizedTextWhenRequested() throws IOException {
        when(resolver.resolve(eq("./broken"), anyString()))
                .thenReturn(Optional.of(source("/src/broken.zeno", "pub let x = 1")));

        assertThatThrownBy(() -> new JavaGenerator(resolver, "", "Main", true)
                .generate(parse("import { X } from \"./broken\"\nfn main() {}", "/src/main.zeno")))
                .isInstanceOfSatisfying(GenerationException.class, e -> assertThat(e.render(true))
                        .contains("/src/broken.zeno:1:1: pub can only be used with function definitions\n"
                                + "  (ja) pub は関数定義にのみ使用できます"));
    }

    @Test
    @Tag("unit")
    void wrapsReadFailures() throws IOException {
        IOException failure = new IOException("disk error");
        when(resolver.resolve(eq("./gone"), anyString())).thenThrow(failure);

        assertThatThrownBy(() -> new JavaGenerator(resolver, "", "Main")
                .generate(parse("import { X } from \"./gone\"\nfn main() {}", "/src/main.zeno")))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("Failed to read module file ./gone: disk error")
                .hasCause(failure);
    }
}
