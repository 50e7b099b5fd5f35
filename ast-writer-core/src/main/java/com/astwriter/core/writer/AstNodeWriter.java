package com.astwriter.core.writer;

import com.astwriter.core.ast.AstNode;

/**
 * Rendering strategy for one structured node type.
 *
 * <p>Writers are registered per node class in an {@link AstWriterMapping} and produce
 * {@link SrcDesc}s, composing child content through {@link AstWriter#desc(Object...)}.
 * Writers hold no per-render state; they may read the formatter and the target version
 * from the {@link AstWriter} they are given.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class AssignmentWriter implements AstNodeWriter<Assignment> {
 *     @Override
 *     public SrcDesc writeInner(Assignment node, AstWriter writer) {
 *         return writer.desc(node.leftHandSide(), " " + node.operator() + " ", node.rightHandSide());
 *     }
 * }
 * }</pre>
 *
 * @param <T> node type
 * @see AstWriterMapping
 */
public interface AstNodeWriter<T extends AstNode> {

    /**
     * Describes the content of {@code node} without attaching the node itself.
     *
     * @param node node to describe
     * @param writer engine, used to describe child nodes
     * @return description of the node's content
     */
    SrcDesc writeInner(T node, AstWriter writer);

    /**
     * Describes {@code node} including its own attribution and any surrounding text.
     *
     * <p>The default wraps {@link #writeInner} in a single span for {@code node}, so the
     * node's source range covers exactly its content. Overrides add text that must not be
     * part of the node's range, such as statement terminators or documentation, as
     * siblings of the span. For {@code a = 1;} an expression statement writer returns:
     *
     * <pre>
     * [[ExpressionStatement#4, [[Assignment#3, [[Identifier#1, ["a"]], " = ", [Literal#2, ["1"]]]]]], ";"]
     * </pre>
     *
     * @param node node to describe
     * @param writer engine, used to describe child nodes
     * @return description of the node and its surrounding syntax
     */
    default SrcDesc writeWhole(T node, AstWriter writer) {
        return SrcDesc.wrap(node, writeInner(node, writer));
    }
}
