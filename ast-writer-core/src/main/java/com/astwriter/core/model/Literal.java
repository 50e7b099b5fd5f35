package com.astwriter.core.model;

import com.astwriter.core.ast.AstNode;

import java.util.Objects;

/**
 * Literal value.
 *
 * @param id node id
 * @param kind literal kind
 * @param value unquoted value (string contents for strings, digits for hex strings)
 */
public record Literal(
    int id,
    LiteralKind kind,
    String value
) implements AstNode {
    /**
     * Compact constructor with validation.
     */
    public Literal {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
