package com.astwriter.core.model;

import com.astwriter.core.ast.AstNode;

import java.util.List;
import java.util.Objects;

/**
 * Assignment expression such as {@code a = b} or {@code a += b}.
 *
 * @param id node id
 * @param operator assignment operator
 * @param leftHandSide assigned expression
 * @param rightHandSide assigned value
 */
public record Assignment(
    int id,
    String operator,
    AstNode leftHandSide,
    AstNode rightHandSide
) implements AstNode {
    /**
     * Compact constructor with validation.
     */
    public Assignment {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(leftHandSide, "leftHandSide must not be null");
        Objects.requireNonNull(rightHandSide, "rightHandSide must not be null");
    }

    @Override
    public List<AstNode> children() {
        return List.of(leftHandSide, rightHandSide);
    }
}
