package com.astwriter.core.ast;

import java.util.List;

/**
 * A node of a structured syntax tree.
 *
 * <p>Nodes are owned by the caller and only read by the writer engine. Writers are resolved
 * by the node's runtime class, and any metadata the engine produces (source ranges) is kept
 * in side tables keyed by node identity, never stored on the node.
 *
 * <p>Implementations are typically immutable records. Since records compare by value, two
 * structurally equal nodes are still distinct nodes for the engine.
 */
public interface AstNode {

    /**
     * Returns the node id, unique within its tree.
     *
     * @return node id
     */
    int id();

    /**
     * Returns the node type name used in diagnostics and serialized output.
     *
     * @return node type name, the simple class name by default
     */
    default String nodeType() {
        return getClass().getSimpleName();
    }

    /**
     * Returns the direct child nodes in source order.
     *
     * @return child nodes, empty for leaves
     */
    default List<AstNode> children() {
        return List.of();
    }

    /**
     * Returns a human-readable, multi-line dump of this node and its subtree.
     *
     * <p>Diagnostics only.
     *
     * @return debug representation
     * @see AstPrinter
     */
    default String print() {
        return AstPrinter.print(this);
    }
}
