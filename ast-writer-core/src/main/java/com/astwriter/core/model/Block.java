package com.astwriter.core.model;

import com.astwriter.core.ast.AstNode;

import java.util.List;

/**
 * Braced statement block.
 *
 * @param id node id
 * @param statements statements in order
 */
public record Block(
    int id,
    List<AstNode> statements
) implements AstNode {
    /**
     * Compact constructor with validation.
     */
    public Block {
        statements = statements != null ? List.copyOf(statements) : List.of();
    }

    @Override
    public List<AstNode> children() {
        return statements;
    }
}
