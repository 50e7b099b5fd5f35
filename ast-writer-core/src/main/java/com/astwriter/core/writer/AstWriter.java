package com.astwriter.core.writer;

import com.astwriter.core.ast.AstNode;
import com.astwriter.core.format.SourceFormatter;
import com.astwriter.core.util.Utf8;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Renders structured syntax trees to source text and records the byte range of every node.
 *
 * <p>Rendering runs in two passes:
 * <ol>
 *   <li>{@link #desc(Object...)} resolves the writer of every node through the
 *       {@link AstWriterMapping} and builds a {@link SrcDesc} tree.</li>
 *   <li>{@link #descToSourceString(SrcDesc, SourceMap)} flattens that tree into text,
 *       recording each node's range in a {@link SourceMap}.</li>
 * </ol>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * AstWriter writer = new AstWriter(mapping, new PrettyFormatter(4, 0), "0.8.20");
 * SourceMap sourceMap = new SourceMap();
 *
 * String source = writer.write(sourceUnit, sourceMap);
 * SourceRange range = sourceMap.get(functionDefinition);
 * }</pre>
 *
 * <p>An {@code AstWriter} holds only immutable configuration, so one instance can render
 * disjoint trees concurrently as long as each render uses its own {@link SourceMap}.
 * Both passes recurse once per tree level; extremely deep trees can exhaust the stack.
 */
public class AstWriter {

    private static final Logger log = LoggerFactory.getLogger(AstWriter.class);

    private final AstWriterMapping mapping;
    private final SourceFormatter formatter;
    private final String targetVersion;

    /**
     * Creates a writer.
     *
     * @param mapping writers per node class
     * @param formatter layout policy passed to writers
     * @param targetVersion language version writers may gate syntax on
     */
    public AstWriter(AstWriterMapping mapping, SourceFormatter formatter, String targetVersion) {
        this.mapping = Objects.requireNonNull(mapping, "mapping must not be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
        this.targetVersion = Objects.requireNonNull(targetVersion, "targetVersion must not be null");
    }

    public AstWriterMapping getMapping() {
        return mapping;
    }

    public SourceFormatter getFormatter() {
        return formatter;
    }

    public String getTargetVersion() {
        return targetVersion;
    }

    /**
     * Returns a writer sharing this writer's mapping and target version, with a formatter
     * one nesting level deeper. Writers of block-like nodes describe their children with it.
     *
     * @return nested writer
     */
    public AstWriter nested() {
        return new AstWriter(mapping, formatter.nested(), targetVersion);
    }

    /**
     * Describes the concatenation of {@code args}.
     *
     * <ul>
     *   <li>{@code null} contributes nothing, so optional children need no branching.</li>
     *   <li>A {@link String} contributes itself, attributed to no node.</li>
     *   <li>An {@link AstNode} contributes its writer's {@link AstNodeWriter#writeWhole}
     *       elements, spliced in place.</li>
     * </ul>
     *
     * @param args text fragments, nodes and nulls
     * @return combined description
     * @throws MissingWriterException if no writer is registered for a node's class
     * @throws InvalidDescArgumentException if an argument is of any other type
     */
    public SrcDesc desc(Object... args) {
        List<SrcDesc.Element> result = new ArrayList<>();

        for (Object arg : args) {
            if (arg == null) {
                continue;
            }

            if (arg instanceof String text) {
                result.add(new SrcDesc.Text(text));
            } else if (arg instanceof AstNode node) {
                result.addAll(describeNode(node).elements());
            } else {
                throw new InvalidDescArgumentException(arg);
            }
        }

        return new SrcDesc(result);
    }

    /**
     * Describes {@code nodes} in order with {@code separator} text between consecutive nodes.
     *
     * @param nodes nodes to describe
     * @param separator text placed between nodes, attributed to no node
     * @return combined description
     * @throws MissingWriterException if no writer is registered for a node's class
     */
    public SrcDesc join(Collection<? extends AstNode> nodes, String separator) {
        SrcDesc.Builder builder = SrcDesc.builder();
        boolean first = true;

        for (AstNode node : nodes) {
            if (!first) {
                builder.text(separator);
            }
            builder.append(describeNode(node));
            first = false;
        }

        return builder.build();
    }

    /**
     * Converts a description into source text while recording the range of every
     * {@link SrcDesc.NodeSpan} in {@code sourceMap}.
     *
     * <p>A node's range covers exactly the text produced by its nested description. A node
     * appearing in more than one span keeps the range of the last one.
     *
     * @param desc description to flatten
     * @param sourceMap map receiving node ranges
     * @return generated source
     */
    public String descToSourceString(SrcDesc desc, SourceMap sourceMap) {
        Objects.requireNonNull(sourceMap, "sourceMap must not be null");

        Flattener flattener = new Flattener(sourceMap);
        flattener.flatten(desc);
        return flattener.source.toString();
    }

    /**
     * Renders {@code node}, discarding source ranges.
     *
     * @param node root node
     * @return generated source
     * @throws MissingWriterException if a node in the tree has no registered writer
     * @throws InvalidDescArgumentException if a writer passes an invalid argument to {@link #desc}
     */
    public String write(AstNode node) {
        return write(node, new SourceMap());
    }

    /**
     * Renders {@code node}, recording the range of it and every descendant in {@code sourceMap}.
     *
     * <p>The whole description is built before anything is flattened, so a failing render
     * leaves {@code sourceMap} untouched.
     *
     * @param node root node
     * @param sourceMap map receiving node ranges
     * @return generated source
     * @throws MissingWriterException if a node in the tree has no registered writer
     * @throws InvalidDescArgumentException if a writer passes an invalid argument to {@link #desc}
     */
    public String write(AstNode node, SourceMap sourceMap) {
        Objects.requireNonNull(node, "node must not be null");

        SrcDesc desc = desc(node);
        int mappedBefore = sourceMap.size();
        String source = descToSourceString(desc, sourceMap);

        if (log.isDebugEnabled()) {
            log.debug("Rendered {}#{}: {} bytes, {} nodes mapped",
                node.nodeType(), node.id(), Utf8.encodedLength(source), sourceMap.size() - mappedBefore);
        }

        return source;
    }

    private SrcDesc describeNode(AstNode node) {
        AstNodeWriter<AstNode> writer = mapping.lookup(node);
        if (writer == null) {
            throw MissingWriterException.forAstNode(node);
        }
        return writer.writeWhole(node, this);
    }

    /**
     * Single depth-first pass accumulating text and the running byte offset.
     */
    private static final class Flattener {

        private final SourceMap sourceMap;
        private final StringBuilder source = new StringBuilder();
        private int size;

        private Flattener(SourceMap sourceMap) {
            this.sourceMap = sourceMap;
        }

        private void flatten(SrcDesc desc) {
            for (SrcDesc.Element element : desc) {
                if (element instanceof SrcDesc.Text text) {
                    source.append(text.text());
                    size += Utf8.encodedLength(text.text());
                } else if (element instanceof SrcDesc.NodeSpan span) {
                    int start = size;
                    flatten(span.desc());
                    sourceMap.put(span.node(), new SourceRange(start, size - start));
                }
            }
        }
    }
}
