package org.openscad.ast.printer;

/**
 * Accumulates printed source with line-level indentation.
 */
public class SourcePrinter {

    private static final String INDENT = "    ";

    private final StringBuilder buf = new StringBuilder();
    private int level;
    private boolean atLineStart = true;

    public SourcePrinter print(String text) {
        if (atLineStart && !text.isEmpty()) {
            buf.append(INDENT.repeat(level));
            atLineStart = false;
        }
        buf.append(text);
        return this;
    }

    public SourcePrinter println(String text) {
        print(text);
        return println();
    }

    public SourcePrinter println() {
        buf.append('\n');
        atLineStart = true;
        return this;
    }

    public SourcePrinter indent() {
        level++;
        return this;
    }

    public SourcePrinter unindent() {
        if (level == 0) {
            throw new IllegalStateException("Cannot unindent below column 0");
        }
        level--;
        return this;
    }

    public String getSource() {
        return buf.toString();
    }

    @Override
    public String toString() {
        return getSource();
    }
}
