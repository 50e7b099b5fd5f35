package com.astwriter.core.writer;

import com.astwriter.core.ast.IrNode;
import com.astwriter.core.format.SourceFormatter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders IR trees to source text by dispatching on each node's tag.
 *
 * <p>No source map is produced. Recursion happens in the writers themselves, which call
 * {@link #write(IrNode)} for their children.
 */
public class IrWriter {

    private final IrWriterMapping mapping;
    private final SourceFormatter formatter;

    /**
     * Creates a writer.
     *
     * @param mapping writers per tag
     * @param formatter layout policy passed to writers
     */
    public IrWriter(IrWriterMapping mapping, SourceFormatter formatter) {
        this.mapping = Objects.requireNonNull(mapping, "mapping must not be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
    }

    public IrWriterMapping getMapping() {
        return mapping;
    }

    public SourceFormatter getFormatter() {
        return formatter;
    }

    /**
     * Returns a writer with the same mapping and a formatter one nesting level deeper.
     *
     * @return nested writer
     */
    public IrWriter nested() {
        return new IrWriter(mapping, formatter.nested());
    }

    /**
     * Renders {@code node}.
     *
     * @param node node to render
     * @return generated source
     * @throws MissingWriterException if no writer is registered for the node's tag
     */
    public String write(IrNode node) {
        Objects.requireNonNull(node, "node must not be null");

        IrNodeWriter writer = mapping.lookup(node.nodeType());
        if (writer == null) {
            throw MissingWriterException.forIrNode(node);
        }
        return writer.write(node, this);
    }

    /**
     * Renders {@code nodes} in order, joined by {@code separator}.
     *
     * @param nodes nodes to render
     * @param separator text between consecutive nodes
     * @return generated source
     */
    public String writeAll(List<IrNode> nodes, String separator) {
        return nodes.stream()
            .map(this::write)
            .collect(Collectors.joining(separator));
    }
}
