package org.zeno.compiler.api;

import org.zeno.compiler.frontend.semantics.Issue;

import java.util.List;
import java.util.Optional;

/**
 * The outcome of compiling one source file.
 *
 * @param errors     Parse and generation errors in reporting order; empty on success.
 * @param javaSource The generated Java source, or null when there are errors.
 * @param issues     The analysis issues; present even when compilation failed after parsing.
 */
public record CompilationResult(List<String> errors, String javaSource, List<Issue> issues) {

    public CompilationResult {
        errors = List.copyOf(errors);
        issues = List.copyOf(issues);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public Optional<String> javaSourceIfPresent() {
        return Optional.ofNullable(javaSource);
    }

    static CompilationResult failed(List<String> errors, List<Issue> issues) {
        return new CompilationResult(errors, null, issues);
    }
}
