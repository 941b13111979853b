package org.zeno.compiler.backend;

import org.zeno.compiler.diagnostics.Diagnostic;
import org.zeno.compiler.diagnostics.DiagnosticsEngine;
import org.zeno.compiler.diagnostics.Messages;
import org.zeno.compiler.frontend.lexer.Lexer;
import org.zeno.compiler.frontend.module.ModuleResolver;
import org.zeno.compiler.frontend.module.NativeFunction;
import org.zeno.compiler.frontend.module.ResolvedModule;
import org.zeno.compiler.frontend.module.StandardLibrary;
import org.zeno.compiler.frontend.parser.Parser;
import org.zeno.compiler.frontend.parser.ast.FunctionDefinition;
import org.zeno.compiler.frontend.parser.ast.ImportStatement;
import org.zeno.compiler.frontend.parser.ast.Parameter;
import org.zeno.compiler.frontend.parser.ast.Program;
import org.zeno.compiler.model.Token;
import org.zeno.compiler.model.ZenoType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Generates Java source for a parsed Zeno program.
 *
 * <p>The program becomes one {@code public final class}. Zeno functions become static methods,
 * top-level statements run at the start of {@code main}, and every imported Zeno module is
 * compiled into a nested static class. Standard-library imports call the runtime bridge.
 *
 * <p>A generator instance holds no state between calls to {@link #generate}.
 */
public class JavaGenerator {

    private static final Logger log = LoggerFactory.getLogger(JavaGenerator.class);

    private final ModuleResolver resolver;
    private final String packageName;
    private final String className;
    private final boolean emitSecondaryDiagnostics;

    public JavaGenerator(ModuleResolver resolver, String packageName, String className) {
        this(resolver, packageName, className, false);
    }

    /**
     * @param resolver                 Resolves import paths.
     * @param packageName              The package of the generated class, or an empty string for none.
     * @param className                The simple name of the generated class.
     * @param emitSecondaryDiagnostics Whether parse errors of imported modules carry their
     *                                 localized companion text.
     */
    public JavaGenerator(ModuleResolver resolver, String packageName, String className,
                         boolean emitSecondaryDiagnostics) {
        this.resolver = resolver;
        this.packageName = packageName == null ? "" : packageName;
        this.className = className;
        this.emitSecondaryDiagnostics = emitSecondaryDiagnostics;
    }

    /**
     * Generates the Java source of a program.
     * @param program A program that parsed without errors.
     * @return The complete Java compilation unit.
     * @throws GenerationException if the program uses an unsupported construct or an import
     *                             cannot be resolved.
     */
    public String generate(Program program) {
        String source = new Session().generateEntry(program);
        log.debug("Generated class {} from {} ({} characters)", className, program.fileName(), source.length());
        return source;
    }

    /**
     * A compiled imported module.
     *
     * @param className The nested class holding the module's functions.
     * @param exports   The module's public functions by name.
     * @param code      The nested class declaration.
     */
    private record ModuleClass(String className, Map<String, CallTarget> exports, CodeWriter code) {}

    /**
     * State of one call to {@link #generate}.
     */
    private final class Session {

        private final Map<String, ModuleClass> modules = new LinkedHashMap<>();
        private final Deque<String> inProgress = new ArrayDeque<>();
        private final Set<String> classNames = new HashSet<>();

        String generateEntry(Program program) {
            classNames.add(className);
            inProgress.push(logicalName(program.fileName()));

            Map<String, CallTarget> callables = unitCallables(program);
            CodeWriter members = new CodeWriter(1);
            new UnitGenerator(program.statements(), callables).emitEntryMembers(members);

            CodeWriter out = new CodeWriter(0);
            out.line("// Code generated by zeno from " + baseName(program.fileName()) + ". DO NOT EDIT.");
            if (!packageName.isEmpty()) {
                out.line("package " + packageName + ";");
            }
            out.blank();
            out.line("import org.zeno.runtime.JsonValue;");
            out.line("import org.zeno.runtime.ZenoRuntime;");
            out.blank();
            out.line("public final class " + className + " {");
            out.indent();
            out.blank();
            out.line("private " + className + "() {");
            out.line("}");
            out.append(members);
            for (ModuleClass module : modules.values()) {
                out.append(module.code());
            }
            out.dedent();
            out.line("}");
            return out.toString();
        }

        /**
         * Collects the names callable from one unit: its own functions (validated) and its imports.
         */
        private Map<String, CallTarget> unitCallables(Program program) {
            Map<String, CallTarget> callables = new LinkedHashMap<>();
            for (FunctionDefinition fn : program.functions()) {
                if (callables.containsKey(fn.name().text())) {
                    throw new GenerationException(Messages.DUPLICATE_FUNCTION, fn.name(), fn.name().text());
                }
                callables.put(fn.name().text(), functionTarget(fn, ""));
            }
            for (ImportStatement imp : program.imports()) {
                Map<String, CallTarget> exports = resolveImport(imp, program.fileName());
                for (ImportStatement.ImportedSymbol symbol : imp.symbols()) {
                    CallTarget target = exports.get(symbol.name().text());
                    if (target == null) {
                        throw new GenerationException(Messages.NOT_EXPORTED, symbol.name(),
                                symbol.name().text(), imp.modulePath());
                    }
                    if (callables.containsKey(symbol.localName())) {
                        throw new GenerationException(Messages.DUPLICATE_IMPORT, symbol.localToken(), symbol.localName());
                    }
                    callables.put(symbol.localName(), target);
                }
            }
            return callables;
        }

        private Map<String, CallTarget> resolveImport(ImportStatement imp, String importingFile) {
            String path = imp.modulePath();
            Optional<ResolvedModule> resolved;
            try {
                resolved = resolver.resolve(path, importingFile);
            } catch (IOException e) {
                throw new GenerationException(diagnostic(Messages.MODULE_READ_FAILED, imp.path(), path, e.getMessage()), e);
            }
            if (resolved.isEmpty()) {
                Messages message = StandardLibrary.isStandardPath(path) ? Messages.UNKNOWN_STD_MODULE : Messages.UNKNOWN_MODULE;
                throw new GenerationException(message, imp.path(), path);
            }

            ResolvedModule module = resolved.get();
            if (module instanceof ResolvedModule.NativeModule nativeModule) {
                Map<String, CallTarget> exports = new LinkedHashMap<>();
                for (NativeFunction function : nativeModule.exports().values()) {
                    exports.put(function.name(), UnitGenerator.nativeTarget(function));
                }
                return exports;
            }
            ResolvedModule.SourceModule source = (ResolvedModule.SourceModule) module;
            return compileModule(source, imp.path()).exports();
        }

        private ModuleClass compileModule(ResolvedModule.SourceModule source, Token importedAt) {
            String path = source.logicalName();
            ModuleClass existing = modules.get(path);
            if (existing != null) {
                return existing;
            }
            if (inProgress.contains(path)) {
                List<String> cycle = new ArrayList<>(inProgress);
                Collections.reverse(cycle);
                cycle.add(path);
                throw new GenerationException(Messages.CIRCULAR_IMPORT, importedAt, String.join(" -> ", cycle));
            }

            log.debug("Compiling imported module {}", path);
            DiagnosticsEngine diagnostics = new DiagnosticsEngine();
            Program program = new Parser(new Lexer(source.content(), path), diagnostics).parse();
            if (diagnostics.hasErrors()) {
                throw new GenerationException(Messages.MODULE_PARSE_ERRORS, importedAt, path,
                        String.join("; ", diagnostics.errorMessages(emitSecondaryDiagnostics)));
            }

            inProgress.push(path);
            String nestedName = uniqueClassName(JavaNames.className(path) + "Module");
            Map<String, CallTarget> callables = unitCallables(program);

            CodeWriter code = new CodeWriter(1);
            code.blank();
            code.line("static final class " + nestedName + " {");
            code.indent();
            code.blank();
            code.line("private " + nestedName + "() {");
            code.line("}");
            new UnitGenerator(program.statements(), callables).emitModuleMembers(code);
            code.dedent();
            code.line("}");
            inProgress.pop();

            Map<String, CallTarget> exports = new LinkedHashMap<>();
            for (FunctionDefinition fn : program.functions()) {
                if (fn.isPublic()) {
                    exports.put(fn.name().text(), functionTarget(fn, nestedName + "."));
                }
            }
            ModuleClass compiled = new ModuleClass(nestedName, exports, code);
            modules.put(path, compiled);
            return compiled;
        }

        private String uniqueClassName(String base) {
            String candidate = base;
            for (int i = 2; !classNames.add(candidate); i++) {
                candidate = base + i;
            }
            return candidate;
        }
    }

    /**
     * Validates a function signature and describes how to call it. Every parameter needs a type.
     */
    private static CallTarget functionTarget(FunctionDefinition fn, String qualifier) {
        List<ZenoType> parameterTypes = new ArrayList<>();
        for (Parameter parameter : fn.parameters()) {
            if (parameter.type() == null) {
                throw new GenerationException(Messages.PARAMETER_TYPE_REQUIRED, parameter.name(),
                        parameter.name().text(), fn.name().text());
            }
            parameterTypes.add(JavaTypes.resolve(parameter.type()));
        }
        ZenoType returnType = fn.returnType() == null ? null : JavaTypes.resolve(fn.returnType());
        int required = fn.isVariadic() ? parameterTypes.size() - 1 : parameterTypes.size();
        return new CallTarget(qualifier + JavaNames.identifier(fn.name().text()), parameterTypes, required,
                fn.isVariadic(), returnType);
    }

    private static Diagnostic diagnostic(Messages message, Token at, Object... args) {
        return new Diagnostic(message.primary(args), message.secondary(args),
                at.fileName(), at.line(), at.column());
    }

    /**
     * The name a file resolver would give the entry file, so that a module importing it back
     * is reported as a cycle.
     */
    private static String logicalName(String fileName) {
        return Path.of(fileName).toAbsolutePath().normalize().toString().replace('\\', '/');
    }

    private static String baseName(String fileName) {
        String normalized = fileName.replace('\\', '/');
        return normalized.substring(normalized.lastIndexOf('/') + 1);
    }
}
