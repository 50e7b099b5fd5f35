package com.astwriter.core.model;

import com.astwriter.core.ast.AstNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Function call expression.
 *
 * @param id node id
 * @param expression called expression
 * @param arguments call arguments
 */
public record FunctionCall(
    int id,
    AstNode expression,
    List<AstNode> arguments
) implements AstNode {
    /**
     * Compact constructor with validation.
     */
    public FunctionCall {
        Objects.requireNonNull(expression, "expression must not be null");
        arguments = arguments != null ? List.copyOf(arguments) : List.of();
    }

    @Override
    public List<AstNode> children() {
        List<AstNode> children = new ArrayList<>(arguments.size() + 1);
        children.add(expression);
        children.addAll(arguments);
        return children;
    }
}
