package com.astwriter.core.model;

import com.astwriter.core.ast.AstNode;

import java.util.List;

/**
 * Return statement.
 *
 * @param id node id
 * @param expression returned value, or null for a bare {@code return}
 */
public record Return(
    int id,
    AstNode expression
) implements AstNode {

    @Override
    public List<AstNode> children() {
        return expression == null ? List.of() : List.of(expression);
    }
}
