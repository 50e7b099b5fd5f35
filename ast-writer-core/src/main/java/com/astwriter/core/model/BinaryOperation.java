package com.astwriter.core.model;

import com.astwriter.core.ast.AstNode;

import java.util.List;
import java.util.Objects;

/**
 * Binary operation such as {@code a + b}.
 *
 * @param id node id
 * @param operator operator symbol
 * @param leftExpression left operand
 * @param rightExpression right operand
 */
public record BinaryOperation(
    int id,
    String operator,
    AstNode leftExpression,
    AstNode rightExpression
) implements AstNode {
    /**
     * Compact constructor with validation.
     */
    public BinaryOperation {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(leftExpression, "leftExpression must not be null");
        Objects.requireNonNull(rightExpression, "rightExpression must not be null");
    }

    @Override
    public List<AstNode> children() {
        return List.of(leftExpression, rightExpression);
    }
}
