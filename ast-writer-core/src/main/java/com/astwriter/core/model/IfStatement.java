package com.astwriter.core.model;

import com.astwriter.core.ast.AstNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Conditional statement.
 *
 * @param id node id
 * @param condition condition expression
 * @param trueBody statement executed when the condition holds
 * @param falseBody else branch, or null
 */
public record IfStatement(
    int id,
    AstNode condition,
    AstNode trueBody,
    AstNode falseBody
) implements AstNode {
    /**
     * Compact constructor with validation.
     */
    public IfStatement {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(trueBody, "trueBody must not be null");
    }

    @Override
    public List<AstNode> children() {
        List<AstNode> children = new ArrayList<>(3);
        children.add(condition);
        children.add(trueBody);
        if (falseBody != null) {
            children.add(falseBody);
        }
        return children;
    }
}
