package com.astwriter.core.util;

/**
 * Escaping for double-quoted string literals, shared by Solidity and Yul.
 */
public final class StringLiterals {

    private StringLiterals() {
        // Utility class
    }

    /**
     * Escapes quotes, backslashes and line control characters; everything else is kept.
     *
     * @param value raw string contents
     * @return contents safe to place between double quotes
     */
    public static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Escapes {@code value} and wraps it in double quotes.
     *
     * @param value raw string contents
     * @return quoted literal
     */
    public static String quote(String value) {
        return "\"" + escape(value) + "\"";
    }
}
