package com.astwriter.core.model;

import com.astwriter.core.ast.AstNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Local variable declaration with an optional initial value.
 *
 * @param id node id
 * @param declaration declared variable
 * @param initialValue initial value, or null
 */
public record VariableDeclarationStatement(
    int id,
    VariableDeclaration declaration,
    AstNode initialValue
) implements AstNode {
    /**
     * Compact constructor with validation.
     */
    public VariableDeclarationStatement {
        Objects.requireNonNull(declaration, "declaration must not be null");
    }

    @Override
    public List<AstNode> children() {
        List<AstNode> children = new ArrayList<>(2);
        children.add(declaration);
        if (initialValue != null) {
            children.add(initialValue);
        }
        return children;
    }
}
