package com.astwriter.core.model;

import com.astwriter.core.ast.AstNode;

import java.util.List;
import java.util.Objects;

/**
 * Expression evaluated as a statement.
 *
 * @param id node id
 * @param expression evaluated expression
 */
public record ExpressionStatement(
    int id,
    AstNode expression
) implements AstNode {
    /**
     * Compact constructor with validation.
     */
    public ExpressionStatement {
        Objects.requireNonNull(expression, "expression must not be null");
    }

    @Override
    public List<AstNode> children() {
        return List.of(expression);
    }
}
