package com.astwriter.core.model;

import com.astwriter.core.ast.AstNode;

import java.util.List;
import java.util.Objects;

/**
 * Pragma directive such as {@code pragma solidity ^0.8.0}.
 *
 * @param id node id
 * @param literals pragma tokens after the {@code pragma} keyword (e.g., ["solidity", "^0.8.0"])
 */
public record PragmaDirective(
    int id,
    List<String> literals
) implements AstNode {
    /**
     * Compact constructor with validation.
     */
    public PragmaDirective {
        Objects.requireNonNull(literals, "literals must not be null");
        literals = List.copyOf(literals);
        if (literals.isEmpty()) {
            throw new IllegalArgumentException("literals must not be empty");
        }
    }
}
