package com.astwriter.core.writer;

import com.astwriter.core.ast.AstNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable registry of {@link AstNodeWriter}s keyed by node class.
 *
 * <p>Lookup uses the node's exact runtime class; writers registered for a supertype are
 * not considered. The node catalog and the writer catalog therefore evolve independently:
 * adding a node type means registering a writer for it, and a forgotten registration is
 * reported as a {@link MissingWriterException} at render time.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AstWriterMapping mapping = AstWriterMapping.builder()
 *     .register(Identifier.class, new IdentifierWriter())
 *     .register(Literal.class, new LiteralWriter())
 *     .build();
 * }</pre>
 */
public final class AstWriterMapping {

    private final Map<Class<? extends AstNode>, AstNodeWriter<?>> writers;

    private AstWriterMapping(Map<Class<? extends AstNode>, AstNodeWriter<?>> writers) {
        this.writers = Map.copyOf(writers);
    }

    /**
     * Creates an empty builder.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder(Map.of());
    }

    /**
     * Creates a builder pre-populated with this mapping's registrations, for extending it.
     *
     * @return new builder
     */
    public Builder toBuilder() {
        return new Builder(writers);
    }

    /**
     * Finds the writer registered for the runtime class of {@code node}.
     *
     * @param node node to render
     * @param <T> node type
     * @return registered writer, or null if none
     */
    @SuppressWarnings("unchecked")
    public <T extends AstNode> AstNodeWriter<T> lookup(T node) {
        // Safe: register() only pairs a class with a writer accepting that class
        return (AstNodeWriter<T>) writers.get(node.getClass());
    }

    /**
     * Checks whether a writer is registered for exactly {@code type}.
     *
     * @param type node class
     * @return true if registered
     */
    public boolean contains(Class<?> type) {
        return writers.containsKey(type);
    }

    public int size() {
        return writers.size();
    }

    /**
     * Returns the node classes that have a registered writer.
     *
     * @return registered node classes
     */
    public Set<Class<? extends AstNode>> nodeTypes() {
        return writers.keySet();
    }

    /**
     * Builder for {@link AstWriterMapping}. Not thread-safe.
     */
    public static final class Builder {

        private final Map<Class<? extends AstNode>, AstNodeWriter<?>> writers;

        private Builder(Map<Class<? extends AstNode>, AstNodeWriter<?>> initial) {
            this.writers = new LinkedHashMap<>(initial);
        }

        /**
         * Registers the writer for a node class.
         *
         * @param type node class
         * @param writer writer for that class
         * @param <T> node type
         * @return this builder
         * @throws IllegalArgumentException if a writer is already registered for {@code type}
         */
        public <T extends AstNode> Builder register(Class<T> type, AstNodeWriter<? super T> writer) {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(writer, "writer must not be null");

            if (writers.putIfAbsent(type, writer) != null) {
                throw new IllegalArgumentException("Writer already registered for " + type.getName());
            }
            return this;
        }

        public AstWriterMapping build() {
            return new AstWriterMapping(writers);
        }
    }
}
