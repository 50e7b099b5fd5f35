package com.astwriter.core.model;

/**
 * Kinds of literal values.
 */
public enum LiteralKind {
    /** Decimal or hexadecimal number, written as is */
    NUMBER,

    /** {@code true} or {@code false} */
    BOOL,

    /** Double-quoted string */
    STRING,

    /** String that may hold non-ASCII text ({@code unicode"..."}) */
    UNICODE_STRING,

    /** Hex string literal ({@code hex"00ff"}) */
    HEX_STRING
}
