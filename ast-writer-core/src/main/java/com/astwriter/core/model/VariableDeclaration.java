package com.astwriter.core.model;

import com.astwriter.core.ast.AstNode;

import java.util.Objects;

/**
 * Variable or parameter declaration such as {@code string memory s}.
 *
 * @param id node id
 * @param typeName declared type
 * @param storageLocation data location ("memory", "storage", "calldata"), or null
 * @param name variable name, may be empty for unnamed return parameters
 */
public record VariableDeclaration(
    int id,
    String typeName,
    String storageLocation,
    String name
) implements AstNode {
    /**
     * Compact constructor with validation.
     */
    public VariableDeclaration {
        Objects.requireNonNull(typeName, "typeName must not be null");
        if (name == null) {
            name = "";
        }
    }
}
