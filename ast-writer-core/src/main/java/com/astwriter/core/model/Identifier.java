package com.astwriter.core.model;

import com.astwriter.core.ast.AstNode;

import java.util.Objects;

/**
 * Reference to a named declaration.
 *
 * @param id node id
 * @param name referenced name
 */
public record Identifier(
    int id,
    String name
) implements AstNode {
    /**
     * Compact constructor with validation.
     */
    public Identifier {
        Objects.requireNonNull(name, "name must not be null");
    }
}
