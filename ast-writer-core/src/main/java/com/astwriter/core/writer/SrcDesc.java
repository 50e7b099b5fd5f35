package com.astwriter.core.writer;

import com.astwriter.core.ast.AstNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Intermediate description of generated source, produced by {@link AstNodeWriter}s.
 *
 * <p>A description is an ordered sequence of elements, each either a literal {@link Text}
 * fragment or a {@link NodeSpan} attaching an {@link AstNode} to a nested description:
 *
 * <pre>
 * SrcDesc ::= (Text | NodeSpan(AstNode, SrcDesc))*
 * </pre>
 *
 * <p>Having {@code NodeSpan(Identifier#5, <descX>)} in the tree states that the text
 * produced by {@code <descX>} is exactly the source of {@code Identifier#5} in the source
 * map. Writers never track offsets themselves; {@link AstWriter#descToSourceString}
 * computes them while flattening.
 *
 * <p>Descriptions are immutable values built fresh for every render. Equality is
 * structural: two descriptions are equal when their elements are, which for spans
 * compares nodes with {@code equals}.
 *
 * @param elements elements in output order
 */
public record SrcDesc(
    List<Element> elements
) implements Iterable<SrcDesc.Element> {

    private static final SrcDesc EMPTY = new SrcDesc(List.of());

    /**
     * Compact constructor with validation.
     */
    public SrcDesc {
        Objects.requireNonNull(elements, "elements must not be null");
        elements = List.copyOf(elements);
    }

    /**
     * An element of a description.
     */
    public sealed interface Element permits Text, NodeSpan {
    }

    /**
     * Literal text not attributed to any node by itself.
     *
     * @param text emitted text
     */
    public record Text(String text) implements Element {
        public Text {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public String toString() {
            return quote(text);
        }
    }

    /**
     * Attribution of everything {@code desc} produces to {@code node}.
     *
     * @param node owning node
     * @param desc nested description
     */
    public record NodeSpan(AstNode node, SrcDesc desc) implements Element {
        public NodeSpan {
            Objects.requireNonNull(node, "node must not be null");
            Objects.requireNonNull(desc, "desc must not be null");
        }

        @Override
        public String toString() {
            return "[" + node.nodeType() + "#" + node.id() + ", " + desc + "]";
        }
    }

    /**
     * Returns the empty description.
     *
     * @return description without elements
     */
    public static SrcDesc empty() {
        return EMPTY;
    }

    /**
     * Creates a description holding a single text fragment.
     *
     * @param text emitted text
     * @return new description
     */
    public static SrcDesc text(String text) {
        return new SrcDesc(List.of(new Text(text)));
    }

    /**
     * Creates a description with a single span attributing {@code inner} to {@code node}.
     *
     * @param node owning node
     * @param inner nested description
     * @return new description
     */
    public static SrcDesc wrap(AstNode node, SrcDesc inner) {
        return new SrcDesc(List.of(new NodeSpan(node, inner)));
    }

    /**
     * Concatenates descriptions in order.
     *
     * @param descs descriptions to concatenate
     * @return new description containing all elements
     */
    public static SrcDesc concat(SrcDesc... descs) {
        Builder builder = builder();
        for (SrcDesc desc : descs) {
            builder.append(desc);
        }
        return builder.build();
    }

    /**
     * Creates an empty builder.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public int size() {
        return elements.size();
    }

    @Override
    public Iterator<Element> iterator() {
        return elements.iterator();
    }

    /**
     * Renders the description in the bracket notation used in documentation, e.g.
     * {@code [[Identifier#1, ["a"]], " = ", [Literal#2, ["1"]]]}.
     */
    @Override
    public String toString() {
        return elements.stream()
            .map(Object::toString)
            .collect(Collectors.joining(", ", "[", "]"));
    }

    private static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Mutable builder for descriptions. Not thread-safe.
     */
    public static final class Builder {

        private final List<Element> elements = new ArrayList<>();

        private Builder() {
        }

        /**
         * Appends a text fragment.
         *
         * @param text emitted text
         * @return this builder
         */
        public Builder text(String text) {
            elements.add(new Text(text));
            return this;
        }

        /**
         * Appends all elements of {@code desc}, spliced in place.
         *
         * @param desc description to append
         * @return this builder
         */
        public Builder append(SrcDesc desc) {
            elements.addAll(desc.elements());
            return this;
        }

        /**
         * Appends a span attributing {@code desc} to {@code node}.
         *
         * @param node owning node
         * @param desc nested description
         * @return this builder
         */
        public Builder span(AstNode node, SrcDesc desc) {
            elements.add(new NodeSpan(node, desc));
            return this;
        }

        public SrcDesc build() {
            return new SrcDesc(elements);
        }
    }
}
