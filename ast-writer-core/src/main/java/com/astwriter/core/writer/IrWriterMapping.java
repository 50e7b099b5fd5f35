package com.astwriter.core.writer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable registry of {@link IrNodeWriter}s keyed by IR node tag.
 */
public final class IrWriterMapping {

    private final Map<String, IrNodeWriter> writers;

    private IrWriterMapping(Map<String, IrNodeWriter> writers) {
        this.writers = Map.copyOf(writers);
    }

    public static Builder builder() {
        return new Builder(Map.of());
    }

    public Builder toBuilder() {
        return new Builder(writers);
    }

    /**
     * Finds the writer for a tag.
     *
     * @param nodeType IR node tag
     * @return registered writer, or null if none
     */
    public IrNodeWriter lookup(String nodeType) {
        return writers.get(nodeType);
    }

    public boolean contains(String nodeType) {
        return writers.containsKey(nodeType);
    }

    public int size() {
        return writers.size();
    }

    public Set<String> nodeTypes() {
        return writers.keySet();
    }

    /**
     * Builder for {@link IrWriterMapping}. Not thread-safe.
     */
    public static final class Builder {

        private final Map<String, IrNodeWriter> writers;

        private Builder(Map<String, IrNodeWriter> initial) {
            this.writers = new LinkedHashMap<>(initial);
        }

        /**
         * Registers the writer for a tag.
         *
         * @param nodeType IR node tag
         * @param writer writer for that tag
         * @return this builder
         * @throws IllegalArgumentException if a writer is already registered for {@code nodeType}
         */
        public Builder register(String nodeType, IrNodeWriter writer) {
            Objects.requireNonNull(nodeType, "nodeType must not be null");
            Objects.requireNonNull(writer, "writer must not be null");

            if (writers.putIfAbsent(nodeType, writer) != null) {
                throw new IllegalArgumentException("Writer already registered for " + nodeType);
            }
            return this;
        }

        public IrWriterMapping build() {
            return new IrWriterMapping(writers);
        }
    }
}
