package com.astwriter.core.writer;

import com.astwriter.core.ast.IrNode;

/**
 * Rendering strategy for one IR node tag.
 *
 * <p>IR rendering is not source-mapped: writers return text directly and render children
 * by calling {@link IrWriter#write(IrNode)}.
 */
@FunctionalInterface
public interface IrNodeWriter {

    /**
     * Renders {@code node}.
     *
     * @param node node to render
     * @param writer engine, used to render child nodes
     * @return generated source
     */
    String write(IrNode node, IrWriter writer);
}
