package com.astwriter.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Best-effort debug rendering of arbitrary values for error messages.
 *
 * <p>Values are serialized as indented JSON with Jackson. Values Jackson cannot serialize
 * fall back to {@link String#valueOf(Object)}. Never used for control flow.
 */
public final class DebugDump {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private DebugDump() {
        // Utility class
    }

    /**
     * Renders {@code value} as pretty-printed JSON, or as its string form if that fails.
     *
     * @param value value to render, may be null
     * @return debug representation
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException | RuntimeException e) {
            return String.valueOf(value);
        }
    }

    /**
     * Converts {@code value} to a Jackson tree, or to a missing node if it cannot be serialized.
     *
     * @param value value to convert, may be null
     * @return tree representation, never null
     */
    public static JsonNode toTree(Object value) {
        try {
            JsonNode tree = MAPPER.valueToTree(value);
            return tree == null ? MissingNode.getInstance() : tree;
        } catch (IllegalArgumentException e) {
            return MissingNode.getInstance();
        }
    }
}
