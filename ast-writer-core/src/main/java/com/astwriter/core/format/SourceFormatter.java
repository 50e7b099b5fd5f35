package com.astwriter.core.format;

/**
 * Layout policy consulted by writers: indentation and line breaks.
 *
 * <p>The writer engine only passes a formatter through to writers and never interprets it.
 * Formatters are immutable: a writer that renders nested content asks for a deeper
 * formatter via {@link #nested()} instead of changing the shared one, so a formatter can
 * be used by concurrent renders.
 *
 * @see PrettyFormatter
 * @see SpacelessFormatter
 */
public interface SourceFormatter {

    /**
     * Returns the indentation for a line at this formatter's nesting level.
     *
     * @return indentation text, possibly empty
     */
    String renderIndent();

    /**
     * Returns the text separating two lines.
     *
     * @return line break text, possibly empty
     */
    String renderWrap();

    /**
     * Returns a formatter one nesting level deeper than this one.
     *
     * @return nested formatter
     */
    SourceFormatter nested();
}
