package com.astwriter.core.format;

/**
 * Formatter producing the most compact output: no indentation and no line breaks.
 */
public final class SpacelessFormatter implements SourceFormatter {

    @Override
    public String renderIndent() {
        return "";
    }

    @Override
    public String renderWrap() {
        return "";
    }

    @Override
    public SpacelessFormatter nested() {
        return this;
    }

    @Override
    public String toString() {
        return "SpacelessFormatter";
    }
}
