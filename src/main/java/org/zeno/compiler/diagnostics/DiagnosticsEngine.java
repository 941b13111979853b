package org.zeno.compiler.diagnostics;

import org.zeno.compiler.model.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the errors of one compilation unit. Reporting never throws;
 * callers check {@link #hasErrors()} between phases.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a catalogued error at the position of the given token.
     * @param message The catalog entry.
     * @param at The token the error refers to.
     * @param args The format arguments of the message.
     */
    public void reportError(Messages message, Token at, Object... args) {
        diagnostics.add(new Diagnostic(
                message.primary(args), message.secondary(args),
                at.fileName(), at.line(), at.column()));
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Returns the rendered error messages in reporting order.
     * @param withSecondary Whether to include the localized companion text.
     * @return The error strings.
     */
    public List<String> errorMessages(boolean withSecondary) {
        return diagnostics.stream()
                .map(d -> d.render(withSecondary))
                .toList();
    }

    /**
     * Creates a one-line-per-diagnostic summary, suitable for logging.
     * @return The summary text.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : diagnostics) {
            sb.append(d).append('\n');
        }
        return sb.toString().trim();
    }
}
