package org.zeno.compiler.diagnostics;

/**
 * A single error reported during compilation.
 *
 * @param message   The primary (English) message text.
 * @param secondary The localized companion text, or {@code null} if none is available.
 * @param fileName  The source file the message refers to.
 * @param line      1-based line, or 0 if unknown.
 * @param column    1-based column, or 0 if unknown.
 */
public record Diagnostic(String message, String secondary, String fileName, int line, int column) {

    /**
     * Renders the diagnostic as {@code file:line:column: message}.
     * @param withSecondary Whether to append the localized companion text on its own line.
     * @return The rendered text.
     */
    public String render(boolean withSecondary) {
        String primary = location() + message;
        if (withSecondary && secondary != null) {
            return primary + "\n  (ja) " + secondary;
        }
        return primary;
    }

    private String location() {
        if (fileName == null || fileName.isEmpty()) {
            return line > 0 ? line + ":" + column + ": " : "";
        }
        return fileName + ":" + Math.max(line, 1) + ":" + Math.max(column, 1) + ": ";
    }

    @Override
    public String toString() {
        return render(false);
    }
}
