package com.astwriter.core.writer;

import com.astwriter.core.ast.AstNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mapping from nodes to their byte ranges in generated source.
 *
 * <p>Keys are compared by identity, so structurally equal nodes (records with equal
 * components) keep separate ranges. The map is filled by
 * {@link AstWriter#descToSourceString(SrcDesc, SourceMap)}; callers may pass their own
 * instance to {@link AstWriter#write(AstNode, SourceMap)} to collect ranges of several
 * renders.
 *
 * <p>Not thread-safe: concurrent renders must not share an instance.
 */
public class SourceMap {

    private final Map<AstNode, SourceRange> ranges = new IdentityHashMap<>();
    private final List<AstNode> insertionOrder = new ArrayList<>();

    /**
     * A node with its range.
     *
     * @param node mapped node
     * @param range node range
     */
    public record Entry(AstNode node, SourceRange range) {
    }

    /**
     * Records the range of a node, replacing any earlier range for the same node.
     *
     * @param node mapped node
     * @param range node range
     * @return previous range, or null
     */
    public SourceRange put(AstNode node, SourceRange range) {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(range, "range must not be null");

        SourceRange previous = ranges.put(node, range);
        if (previous == null) {
            insertionOrder.add(node);
        }
        return previous;
    }

    /**
     * Gets the range of a node.
     *
     * @param node node to look up
     * @return range, or null if the node is not mapped
     */
    public SourceRange get(AstNode node) {
        return ranges.get(node);
    }

    public boolean contains(AstNode node) {
        return ranges.containsKey(node);
    }

    public int size() {
        return ranges.size();
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    /**
     * Returns all entries in source order: by offset ascending, then by length descending,
     * so enclosing nodes precede the nodes they contain. Nodes sharing the exact same range
     * are listed outermost first.
     *
     * @return sorted entries
     */
    public List<Entry> entries() {
        List<Entry> entries = new ArrayList<>(insertionOrder.size());
        // Flattening records children before their parents; reversed, parents come first
        for (int i = insertionOrder.size() - 1; i >= 0; i--) {
            AstNode node = insertionOrder.get(i);
            entries.add(new Entry(node, ranges.get(node)));
        }
        entries.sort(Comparator
            .comparingInt((Entry entry) -> entry.range().offset())
            .thenComparing(Comparator.comparingInt((Entry entry) -> entry.range().length()).reversed()));
        return entries;
    }

    /**
     * Removes all entries.
     */
    public void clear() {
        ranges.clear();
        insertionOrder.clear();
    }

    @Override
    public String toString() {
        return "SourceMap{size=" + ranges.size() + "}";
    }
}
