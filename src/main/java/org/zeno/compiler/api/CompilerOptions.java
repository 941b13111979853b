package org.zeno.compiler.api;

import com.typesafe.config.Config;

import java.util.List;

/**
 * Options controlling one compilation.
 *
 * @param emitSecondaryDiagnostics Whether error messages are followed by their Japanese companion text.
 * @param className                The simple name of the generated Java class.
 * @param packageName              The package of the generated class; empty for the default package.
 * @param failOnIssues             Whether analysis issues prevent code generation.
 * @param lintRules                The names of the enabled analysis rules, in any order.
 * @param sourceExtension          The file extension appended to relative import paths.
 */
public record CompilerOptions(boolean emitSecondaryDiagnostics,
                              String className,
                              String packageName,
                              boolean failOnIssues,
                              List<String> lintRules,
                              String sourceExtension) {

    private static final String COMPILER = "zeno.compiler.";

    public CompilerOptions {
        lintRules = List.copyOf(lintRules);
    }

    /**
     * Reads the options from the {@code zeno.compiler} and {@code zeno.lint} sections.
     * @param config A resolved configuration, usually from {@link org.zeno.compiler.config.ConfigLoader}.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static CompilerOptions fromConfig(Config config) {
        return new CompilerOptions(
                config.getBoolean(COMPILER + "emit-secondary-diagnostics"),
                config.getString(COMPILER + "class-name"),
                config.getString(COMPILER + "package-name"),
                config.getBoolean(COMPILER + "fail-on-issues"),
                config.getStringList("zeno.lint.rules"),
                config.getString(COMPILER + "source-extension"));
    }

    /**
     * The options defined by the bundled {@code reference.conf}.
     */
    public static CompilerOptions defaults() {
        return new CompilerOptions(false, "Main", "", false,
                List.of("unused-variable", "unused-function", "function-naming-convention",
                        "variable-naming-convention", "unused-import"),
                ".zeno");
    }

    public CompilerOptions withClassName(String name) {
        return new CompilerOptions(emitSecondaryDiagnostics, name, packageName, failOnIssues, lintRules, sourceExtension);
    }

    public CompilerOptions withSecondaryDiagnostics(boolean enabled) {
        return new CompilerOptions(enabled, className, packageName, failOnIssues, lintRules, sourceExtension);
    }
}
