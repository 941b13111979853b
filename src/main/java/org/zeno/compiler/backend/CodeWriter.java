package org.zeno.compiler.backend;

/**
 * Line-oriented text buffer with indentation.
 */
final class CodeWriter {

    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private int level;

    CodeWriter(int level) {
        this.level = level;
    }

    CodeWriter line(String text) {
        out.append(INDENT.repeat(level)).append(text).append('\n');
        return this;
    }

    CodeWriter blank() {
        out.append('\n');
        return this;
    }

    CodeWriter indent() {
        level++;
        return this;
    }

    CodeWriter dedent() {
        level--;
        return this;
    }

    /**
     * Appends the content of another writer verbatim.
     */
    CodeWriter append(CodeWriter other) {
        out.append(other.out);
        return this;
    }

    boolean isEmpty() {
        return out.length() == 0;
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
