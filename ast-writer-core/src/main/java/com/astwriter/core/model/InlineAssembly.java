package com.astwriter.core.model;

import com.astwriter.core.ast.AstNode;
import com.astwriter.core.ast.IrNode;

import java.util.List;
import java.util.Objects;

/**
 * Inline assembly statement whose body is an IR tree.
 *
 * @param id node id
 * @param flags assembly flags (e.g., "memory-safe")
 * @param body IR block
 */
public record InlineAssembly(
    int id,
    List<String> flags,
    IrNode body
) implements AstNode {
    /**
     * Compact constructor with validation.
     */
    public InlineAssembly {
        Objects.requireNonNull(body, "body must not be null");
        flags = flags != null ? List.copyOf(flags) : List.of();
    }
}
