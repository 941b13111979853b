package org.zeno.compiler.api;

import org.zeno.compiler.backend.GenerationException;
import org.zeno.compiler.backend.JavaGenerator;
import org.zeno.compiler.diagnostics.DiagnosticsEngine;
import org.zeno.compiler.frontend.io.SourceLoader;
import org.zeno.compiler.frontend.lexer.Lexer;
import org.zeno.compiler.frontend.module.FileSystemModuleResolver;
import org.zeno.compiler.frontend.module.ModuleResolver;
import org.zeno.compiler.frontend.parser.Parser;
import org.zeno.compiler.frontend.parser.ast.Program;
import org.zeno.compiler.frontend.semantics.Issue;
import org.zeno.compiler.frontend.semantics.LintRuleRegistry;
import org.zeno.compiler.frontend.semantics.SemanticAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for compiling Zeno source into Java source.
 * <p>
 * Runs the phases in order: tokenizing and parsing, analysis, generation. Parse errors stop
 * the compilation before generation; analysis issues only do so when
 * {@link CompilerOptions#failOnIssues()} is set. A compiler instance is stateless and may be
 * shared between threads.
 */
public class ZenoCompiler {

    private static final Logger log = LoggerFactory.getLogger(ZenoCompiler.class);

    private final CompilerOptions options;
    private final ModuleResolver resolver;
    private final LintRuleRegistry rules;

    public ZenoCompiler(CompilerOptions options) {
        this(options, new FileSystemModuleResolver(options.sourceExtension()));
    }

    /**
     * @param options  The compilation options.
     * @param resolver Resolves the paths of import statements.
     * @throws IllegalArgumentException if the options name an unknown lint rule.
     */
    public ZenoCompiler(CompilerOptions options, ModuleResolver resolver) {
        this.options = options;
        this.resolver = resolver;
        this.rules = LintRuleRegistry.initializeWithDefaults().retainOnly(options.lintRules());
    }

    /**
     * Compiles source text.
     * @param source   The Zeno source.
     * @param fileName The file name used in diagnostics and for resolving relative imports.
     * @return The compilation result.
     */
    public CompilationResult compile(String source, String fileName) {
        long start = System.nanoTime();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Parser parser = new Parser(new Lexer(source, fileName), diagnostics);
        Program program = parser.parse();
        log.debug("Parsed {}: {} top-level statements in {} ms", fileName, program.statements().size(), elapsedMillis(start));

        if (diagnostics.hasErrors()) {
            log.debug("Parsing {} failed:\n{}", fileName, diagnostics.summary());
            return CompilationResult.failed(diagnostics.errorMessages(options.emitSecondaryDiagnostics()), List.of());
        }

        long analysisStart = System.nanoTime();
        List<Issue> issues = new SemanticAnalyzer(rules).analyze(program, fileName);
        log.debug("Analyzed {}: {} issues in {} ms", fileName, issues.size(), elapsedMillis(analysisStart));
        if (options.failOnIssues() && !issues.isEmpty()) {
            return CompilationResult.failed(issues.stream().map(Issue::format).toList(), issues);
        }

        long generationStart = System.nanoTime();
        try {
            String javaSource = new JavaGenerator(resolver, options.packageName(), options.className(),
                    options.emitSecondaryDiagnostics()).generate(program);
            log.debug("Generated {} in {} ms (total {} ms)", options.className(), elapsedMillis(generationStart), elapsedMillis(start));
            return new CompilationResult(List.of(), javaSource, issues);
        } catch (GenerationException e) {
            log.debug("Generation for {} failed: {}", fileName, e.getMessage());
            return CompilationResult.failed(List.of(e.render(options.emitSecondaryDiagnostics())), issues);
        }
    }

    /**
     * Compiles a source file. The generated class is named after the options, not the file.
     * @param file The Zeno source file.
     * @return The compilation result.
     * @throws IOException if the file cannot be read.
     */
    public CompilationResult compileFile(Path file) throws IOException {
        SourceLoader.LoadResult loaded = SourceLoader.loadFile(file.toAbsolutePath().normalize());
        return compile(loaded.content(), loaded.logicalName());
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
