package com.astwriter.core.ast;

import com.astwriter.core.util.DebugDump;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of a low-level intermediate representation tree, identified by a string tag.
 *
 * <p>Unlike {@link AstNode}s, IR nodes carry no class identity of their own: the
 * {@code nodeType} tag is the dispatch key and all other properties live in {@code data}.
 * Values in {@code data} are strings, numbers, booleans, nested {@code IrNode}s or lists
 * of {@code IrNode}s.
 *
 * @param nodeType type tag (e.g., "YulFunctionCall")
 * @param data node properties, in declaration order
 */
public record IrNode(
    String nodeType,
    Map<String, Object> data
) {
    /**
     * Compact constructor with validation.
     */
    public IrNode {
        Objects.requireNonNull(nodeType, "nodeType must not be null");
        // LinkedHashMap keeps the order for dumps; null values are allowed for absent children
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * Creates a node from alternating key/value pairs.
     *
     * @param nodeType type tag
     * @param keyValues keys and values, alternating
     * @return new node
     * @throws IllegalArgumentException if an odd number of arguments is given or a key is not a string
     */
    public static IrNode of(String nodeType, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs but got " + keyValues.length + " arguments");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (!(keyValues[i] instanceof String key)) {
                throw new IllegalArgumentException("Key at position " + i + " is not a string: " + keyValues[i]);
            }
            data.put(key, keyValues[i + 1]);
        }
        return new IrNode(nodeType, data);
    }

    /**
     * Gets a string property.
     *
     * @param key property name
     * @return property value as string
     * @throws IllegalStateException if the property is missing
     */
    public String string(String key) {
        return String.valueOf(require(key));
    }

    /**
     * Gets a child node property.
     *
     * @param key property name
     * @return child node
     * @throws IllegalStateException if the property is missing or not a node
     */
    public IrNode node(String key) {
        Object value = require(key);
        if (value instanceof IrNode child) {
            return child;
        }
        throw new IllegalStateException(nodeType + "." + key + " is not an IR node: " + value);
    }

    /**
     * Gets an optional child node property.
     *
     * @param key property name
     * @return child node, or empty if absent or null
     */
    public Optional<IrNode> optionalNode(String key) {
        return data.get(key) == null ? Optional.empty() : Optional.of(node(key));
    }

    /**
     * Gets a list-of-nodes property. A missing property is an empty list.
     *
     * @param key property name
     * @return child nodes
     * @throws IllegalStateException if the property holds anything other than nodes
     */
    public List<IrNode> nodes(String key) {
        Object value = data.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalStateException(nodeType + "." + key + " is not a list: " + value);
        }
        List<IrNode> result = new ArrayList<>(list.size());
        for (Object element : list) {
            if (!(element instanceof IrNode child)) {
                throw new IllegalStateException(nodeType + "." + key + " contains a non-node element: " + element);
            }
            result.add(child);
        }
        return result;
    }

    /**
     * Returns a pretty-printed JSON dump of this node (tag and data) for diagnostics.
     *
     * @return debug representation
     */
    public String dump() {
        return DebugDump.toJson(this);
    }

    private Object require(String key) {
        Object value = data.get(key);
        if (value == null) {
            throw new IllegalStateException(nodeType + " has no property '" + key + "'");
        }
        return value;
    }
}
