package org.zeno.compiler.backend;

import org.zeno.compiler.diagnostics.Diagnostic;
import org.zeno.compiler.diagnostics.Messages;
import org.zeno.compiler.model.Token;

/**
 * Thrown when a program cannot be translated. Generation errors are fatal for the
 * compilation unit: no partial output is produced.
 */
public class GenerationException extends RuntimeException {

    private static final String PREFIX = "Generation Error: ";

    private final transient Diagnostic diagnostic;

    public GenerationException(Messages message, Token at, Object... args) {
        this(new Diagnostic(message.primary(args), message.secondary(args),
                at.fileName(), at.line(), at.column()), null);
    }

    public GenerationException(Diagnostic diagnostic, Throwable cause) {
        super(PREFIX + diagnostic.render(false), cause);
        this.diagnostic = diagnostic;
    }

    /**
     * Renders the error, optionally followed by its localized companion text.
     * @param withSecondary Whether to include the secondary-language message.
     * @return The error text.
     */
    public String render(boolean withSecondary) {
        return PREFIX + diagnostic.render(withSecondary);
    }
}
