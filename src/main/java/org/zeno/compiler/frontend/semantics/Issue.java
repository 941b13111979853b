package org.zeno.compiler.frontend.semantics;

import org.zeno.compiler.frontend.parser.ast.SourceLocatable;
import org.zeno.compiler.model.Token;

/**
 * One finding reported by a lint rule.
 *
 * @param filePath The file the finding refers to; filled in by the analyzer if left null.
 * @param line     1-based line, or 0 if unknown.
 * @param column   1-based column, or 0 if unknown.
 * @param ruleName The identifier of the reporting rule.
 * @param message  The human-readable message.
 */
public record Issue(String filePath, int line, int column, String ruleName, String message) {

    /**
     * Creates an issue positioned at the given token, leaving the file path to the analyzer.
     */
    public static Issue at(Token token, String ruleName, String message) {
        return new Issue(null, token.line(), token.column(), ruleName, message);
    }

    public static Issue at(SourceLocatable node, String ruleName, String message) {
        return at(node.token(), ruleName, message);
    }

    public Issue withFilePath(String path) {
        return new Issue(path, line, column, ruleName, message);
    }

    /**
     * Formats the issue as {@code path:line:column: [rule] message}. Unknown positions print as 1.
     * @return The formatted issue.
     */
    public String format() {
        return String.format("%s:%d:%d: [%s] %s",
                filePath, Math.max(line, 1), Math.max(column, 1), ruleName, message);
    }

    @Override
    public String toString() {
        return format();
    }
}
