package com.astwriter.core.model;

import com.astwriter.core.ast.AstNode;

import java.util.List;

/**
 * Block whose arithmetic is not overflow-checked ({@code unchecked { ... }}).
 *
 * @param id node id
 * @param statements statements in order
 */
public record UncheckedBlock(
    int id,
    List<AstNode> statements
) implements AstNode {
    /**
     * Compact constructor with validation.
     */
    public UncheckedBlock {
        statements = statements != null ? List.copyOf(statements) : List.of();
    }

    @Override
    public List<AstNode> children() {
        return statements;
    }
}
