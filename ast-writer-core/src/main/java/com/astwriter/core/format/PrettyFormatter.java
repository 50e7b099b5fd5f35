package com.astwriter.core.format;

/**
 * Formatter that indents with spaces and breaks lines with {@code "\n"}.
 *
 * <p>The indentation of a line is {@code offset + nesting * indentSize} spaces.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * SourceFormatter formatter = new PrettyFormatter(4, 0);
 * formatter.renderIndent();          // ""
 * formatter.nested().renderIndent(); // "    "
 * }</pre>
 */
public final class PrettyFormatter implements SourceFormatter {

    private final int indentSize;
    private final int offset;
    private final int nesting;
    private final String indent;

    /**
     * Creates a top-level formatter.
     *
     * @param indentSize spaces per nesting level
     * @param offset spaces added before every indented line
     * @throws IllegalArgumentException if either value is negative
     */
    public PrettyFormatter(int indentSize, int offset) {
        this(indentSize, offset, 0);
    }

    private PrettyFormatter(int indentSize, int offset, int nesting) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indentSize must not be negative: " + indentSize);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
        this.indentSize = indentSize;
        this.offset = offset;
        this.nesting = nesting;
        this.indent = " ".repeat(offset + nesting * indentSize);
    }

    @Override
    public String renderIndent() {
        return indent;
    }

    @Override
    public String renderWrap() {
        return "\n";
    }

    @Override
    public PrettyFormatter nested() {
        return new PrettyFormatter(indentSize, offset, nesting + 1);
    }

    public int getIndentSize() {
        return indentSize;
    }

    public int getOffset() {
        return offset;
    }

    public int getNesting() {
        return nesting;
    }

    @Override
    public String toString() {
        return "PrettyFormatter{indentSize=" + indentSize + ", offset=" + offset + ", nesting=" + nesting + "}";
    }
}
