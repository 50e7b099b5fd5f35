package com.astwriter.core.model;

import com.astwriter.core.ast.AstNode;

import java.util.List;

/**
 * Root of a source file.
 *
 * @param id node id
 * @param nodes top-level nodes (pragmas, functions)
 */
public record SourceUnit(
    int id,
    List<AstNode> nodes
) implements AstNode {
    /**
     * Compact constructor with validation.
     */
    public SourceUnit {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
    }

    @Override
    public List<AstNode> children() {
        return nodes;
    }
}
